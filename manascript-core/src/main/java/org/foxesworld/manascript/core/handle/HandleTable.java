package org.foxesworld.manascript.core.handle;

import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.core.thing.ThingLifecycleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Arena of simulation objects exposed to scripts.
 *
 * <p>Each exposed {@link Thing} occupies one slot. A {@link Handle} is valid only while its slot is
 * occupied and the slot generation equals the handle generation. Destruction bumps the generation
 * and frees the slot, so every handle minted before stays stale forever, even after the slot is
 * reused.</p>
 *
 * <p>Mint, resolve and invalidate are serialized on the table monitor. The simulation must call
 * {@link #onThingDestroyed(Thing)} synchronously while destroying an object.</p>
 */
public final class HandleTable implements ThingLifecycleListener {

    private static final Logger logger = LoggerFactory.getLogger(HandleTable.class);

    private static final int INITIAL_CAPACITY = 64;

    private final Predicate<Thing> liveness;

    private Thing[] occupants = new Thing[INITIAL_CAPACITY];
    private int[] generations = new int[INITIAL_CAPACITY];
    private final BitSet occupied = new BitSet();
    private final Map<Thing, Integer> slotByThing = new IdentityHashMap<>();

    // free-list without boxing
    private int[] free = new int[INITIAL_CAPACITY];
    private int freeSize = 0;
    private int nextSlot = 0;

    private int retired = 0;

    /**
     * @param liveness the registry's liveness check, usually {@code registry::isAlive}; minting is
     *                 refused for objects it reports dead, so a destroyed object never gets a handle
     *                 again
     */
    public HandleTable(Predicate<Thing> liveness) {
        this.liveness = Objects.requireNonNull(liveness, "liveness");
    }

    /**
     * Returns the handle of {@code thing}, assigning a slot on first exposure. Repeated calls for the
     * same live object return the same handle. Dead objects get {@link Handle#INVALID}.
     */
    public synchronized Handle mint(Thing thing) {
        Objects.requireNonNull(thing, "thing");

        Integer existing = slotByThing.get(thing);
        if (existing != null) {
            return new Handle(existing, generations[existing]);
        }
        if (!liveness.test(thing)) {
            logger.warn("Refusing handle for destroyed {} #{}", thing.type(), thing.publicId());
            return Handle.INVALID;
        }

        int slot = allocateSlot();
        occupants[slot] = thing;
        occupied.set(slot);
        slotByThing.put(thing, slot);

        logger.debug("Handle minted slot={} gen={} for {} #{}", slot, generations[slot], thing.type(), thing.publicId());
        return new Handle(slot, generations[slot]);
    }

    /**
     * @return the live object behind {@code handle}, or {@code null} when the handle is stale,
     *         invalid or was never minted by this table
     */
    public synchronized Thing resolve(Handle handle) {
        if (handle == null || handle.isInvalid()) return null;
        int slot = handle.slot();
        if (slot >= nextSlot || !occupied.get(slot)) return null;
        if (generations[slot] != handle.generation()) return null;
        return occupants[slot];
    }

    public boolean isLive(Handle handle) {
        return resolve(handle) != null;
    }

    /**
     * Invalidates the handle of {@code thing}. Objects never exposed to scripts are ignored.
     */
    public synchronized void invalidate(Thing thing) {
        if (thing == null) return;
        Integer slot = slotByThing.remove(thing);
        if (slot == null) return;
        release(slot);
    }

    @Override
    public void onThingDestroyed(Thing thing) {
        invalidate(thing);
    }

    /** Number of objects currently exposed. */
    public synchronized int liveCount() {
        return slotByThing.size();
    }

    /** Slots permanently taken out of use after generation exhaustion. */
    public synchronized int retiredSlots() {
        return retired;
    }

    /**
     * Invalidates every exposed object. Outstanding handles become stale; slots stay reusable.
     */
    public synchronized void clear() {
        for (int slot = occupied.nextSetBit(0); slot >= 0; slot = occupied.nextSetBit(slot + 1)) {
            release(slot);
        }
        slotByThing.clear();
    }

    // ---------------- internals ----------------

    private int allocateSlot() {
        if (freeSize > 0) {
            return free[--freeSize];
        }
        int slot = nextSlot++;
        if (slot == occupants.length) {
            int cap = occupants.length << 1;
            occupants = Arrays.copyOf(occupants, cap);
            generations = Arrays.copyOf(generations, cap);
        }
        return slot;
    }

    private void release(int slot) {
        occupants[slot] = null;
        occupied.clear(slot);

        if (generations[slot] == Integer.MAX_VALUE) {
            // a wrapped generation could alias an old handle
            retired++;
            logger.info("Handle slot {} retired after generation exhaustion", slot);
            return;
        }
        generations[slot]++;

        if (freeSize == free.length) {
            free = Arrays.copyOf(free, free.length << 1);
        }
        free[freeSize++] = slot;
    }
}

package org.foxesworld.manascript.engine.world;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.manascript.core.thing.Thing;
import org.foxesworld.manascript.core.thing.ThingLifecycleListener;
import org.foxesworld.manascript.core.thing.ThingRegistry;
import org.foxesworld.manascript.core.thing.ThingType;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory simulation registry: owns the lifetime of {@link Being}s.
 *
 * <p>Public ids are 16-bit, start at 1 and are reused after destruction. {@link #destroy(Thing)}
 * notifies lifecycle listeners synchronously, before the id is released. Driven from the
 * simulation thread.</p>
 */
public final class GameWorld implements ThingRegistry {

    private static final Logger log = LogManager.getLogger(GameWorld.class);

    private static final int MAX_PUBLIC_ID = 0xFFFF;

    // index = public id, slot 0 unused
    private Being[] beings = new Being[64];
    private int nextId = 1;
    private int size;

    private int[] freeIds = new int[64];
    private int freeCount;

    private final List<ThingLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public Being spawn(ThingType type, String name) {
        Objects.requireNonNull(type, "type");
        int id = allocateId();
        Being b = new Being(type, id, name != null ? name : type.name().toLowerCase(Locale.ROOT));
        beings[id] = b;
        size++;
        log.debug("Spawned {}", b);
        return b;
    }

    /** Live being with {@code publicId}, or {@code null}. */
    public Being find(int publicId) {
        return publicId > 0 && publicId < nextId ? beings[publicId] : null;
    }

    @Override
    public boolean isAlive(Thing thing) {
        return thing != null && find(thing.publicId()) == thing;
    }

    /** Destroys {@code thing}. Unknown or already destroyed things are ignored. */
    public void destroy(Thing thing) {
        if (!isAlive(thing)) return;

        for (ThingLifecycleListener l : listeners) {
            try {
                l.onThingDestroyed(thing);
            } catch (RuntimeException e) {
                log.error("Lifecycle listener {} failed for {}", l, thing, e);
            }
        }

        int id = thing.publicId();
        beings[id] = null;
        size--;
        if (freeCount == freeIds.length) {
            freeIds = Arrays.copyOf(freeIds, freeIds.length << 1);
        }
        freeIds[freeCount++] = id;
        log.debug("Destroyed {}", thing);
    }

    public int size() {
        return size;
    }

    @Override
    public void addLifecycleListener(ThingLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeLifecycleListener(ThingLifecycleListener listener) {
        listeners.remove(listener);
    }

    private int allocateId() {
        if (freeCount > 0) {
            return freeIds[--freeCount];
        }
        if (nextId > MAX_PUBLIC_ID) {
            throw new IllegalStateException("Out of public ids (" + MAX_PUBLIC_ID + " beings alive)");
        }
        int id = nextId++;
        if (id == beings.length) {
            beings = Arrays.copyOf(beings, beings.length << 1);
        }
        return id;
    }
}

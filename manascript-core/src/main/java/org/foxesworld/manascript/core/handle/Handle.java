package org.foxesworld.manascript.core.handle;

/**
 * Opaque, script-safe reference to a simulation object: an arena slot plus the generation the slot
 * had when the handle was minted.
 *
 * <p>Handles are plain values. Scripts may keep them forever; a handle whose object died is
 * detected as stale by {@link HandleTable#resolve(Handle)} and never aliases a later occupant of
 * the same slot.</p>
 */
public record Handle(int slot, int generation) {

    /** Never resolves. Returned when minting is refused (object already dead). */
    public static final Handle INVALID = new Handle(-1, 0);

    public boolean isInvalid() {
        return slot < 0;
    }

    @Override
    public String toString() {
        return isInvalid() ? "Handle[invalid]" : "Handle[" + slot + "#" + generation + "]";
    }
}

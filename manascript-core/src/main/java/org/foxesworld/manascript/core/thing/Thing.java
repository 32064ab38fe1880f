package org.foxesworld.manascript.core.thing;

/**
 * A simulation object that may be exposed to scripts.
 *
 * <p>Lifetime is owned by the {@link ThingRegistry}; the scripting layer only observes it.
 * Implementations are compared by identity.</p>
 */
public interface Thing {

    ThingType type();

    /** Id visible to clients in protocol messages. */
    int publicId();
}

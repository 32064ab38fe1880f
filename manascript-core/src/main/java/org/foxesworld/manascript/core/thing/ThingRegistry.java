package org.foxesworld.manascript.core.thing;

/**
 * The simulation's entity registry, as seen by the scripting layer.
 * It is the sole authority on whether a {@link Thing} is alive.
 */
public interface ThingRegistry {

    boolean isAlive(Thing thing);

    /** Listeners are invoked in registration order on every destruction. */
    void addLifecycleListener(ThingLifecycleListener listener);

    void removeLifecycleListener(ThingLifecycleListener listener);
}

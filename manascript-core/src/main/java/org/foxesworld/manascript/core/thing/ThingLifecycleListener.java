package org.foxesworld.manascript.core.thing;

@FunctionalInterface
public interface ThingLifecycleListener {

    /**
     * Called synchronously by the registry while destroying {@code thing}, before its id or storage
     * is released.
     */
    void onThingDestroyed(Thing thing);
}

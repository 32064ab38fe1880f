package org.foxesworld.manascript.engine.bridge;

import org.foxesworld.manascript.core.thing.Thing;

/**
 * Validated arguments of one callback invocation, positionally matching the callback's shape.
 */
public final class CallbackArgs {

    private final String scriptName;
    private final Object[] values;

    CallbackArgs(String scriptName, Object[] values) {
        this.scriptName = scriptName;
        this.values = values;
    }

    /** Script the call came from, for logs. */
    public String scriptName() {
        return scriptName;
    }

    public int size() {
        return values.length;
    }

    public Thing thing(int index) {
        return (Thing) values[index];
    }

    public int integer(int index) {
        return (Integer) values[index];
    }

    public String string(int index) {
        return (String) values[index];
    }
}

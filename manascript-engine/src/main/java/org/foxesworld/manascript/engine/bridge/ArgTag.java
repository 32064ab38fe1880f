package org.foxesworld.manascript.engine.bridge;

/** Kind of a value passed from script code to a native callback. */
public enum ArgTag {
    ABSENT,
    INTEGER,
    HANDLE,
    STRING,
    /** Anything else: booleans, objects, functions, non-integral numbers. */
    UNSUPPORTED
}

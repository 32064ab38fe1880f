package org.foxesworld.manascript.engine.bridge;

import org.foxesworld.manascript.core.handle.Handle;
import org.graalvm.polyglot.Value;

/**
 * Tagged value received from script code. {@code value} is an {@link Integer}, a {@link Handle}, a
 * {@link String}, or {@code null} for absent/unsupported values.
 */
public record CallbackArgument(ArgTag tag, Object value) {

    public static final CallbackArgument ABSENT = new CallbackArgument(ArgTag.ABSENT, null);

    /** Classifies one interpreter value without ever throwing. */
    public static CallbackArgument of(Value v) {
        if (v == null || v.isNull()) return ABSENT;
        try {
            if (v.isHostObject()) {
                Object host = v.asHostObject();
                return host instanceof Handle h
                        ? new CallbackArgument(ArgTag.HANDLE, h)
                        : new CallbackArgument(ArgTag.UNSUPPORTED, null);
            }
            if (v.isNumber() && v.fitsInInt()) {
                return new CallbackArgument(ArgTag.INTEGER, v.asInt());
            }
            if (v.isString()) {
                return new CallbackArgument(ArgTag.STRING, v.asString());
            }
            return new CallbackArgument(ArgTag.UNSUPPORTED, null);
        } catch (RuntimeException e) {
            return new CallbackArgument(ArgTag.UNSUPPORTED, null);
        }
    }
}

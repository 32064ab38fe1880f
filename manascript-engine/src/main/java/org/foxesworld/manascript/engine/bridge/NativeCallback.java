package org.foxesworld.manascript.engine.bridge;

import java.util.List;

/**
 * Native function callable from scripts as {@code mana.<name>(...)}.
 *
 * <p>{@link #invoke(CallbackArgs)} only runs after {@link CallbackBridge} has checked every argument
 * against {@link #shape()} and resolved every handle to a live object of the expected kind.</p>
 */
public interface NativeCallback {

    String name();

    List<ArgSpec> shape();

    void invoke(CallbackArgs args);
}

package org.foxesworld.manascript.engine.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/** {@code mana.log_info(text)} / {@code mana.log_warn(text)}: script output to the server log. */
public final class ScriptLogCallback implements NativeCallback {

    private static final Logger log = LogManager.getLogger("manascript.script");
    private static final List<ArgSpec> SHAPE = List.of(ArgSpec.string());

    private final String name;
    private final boolean warn;

    public ScriptLogCallback(String name, boolean warn) {
        this.name = name;
        this.warn = warn;
    }

    @Override public String name() { return name; }
    @Override public List<ArgSpec> shape() { return SHAPE; }

    @Override
    public void invoke(CallbackArgs args) {
        if (warn) log.warn("[JS:{}] {}", args.scriptName(), args.string(0));
        else log.info("[JS:{}] {}", args.scriptName(), args.string(0));
    }
}

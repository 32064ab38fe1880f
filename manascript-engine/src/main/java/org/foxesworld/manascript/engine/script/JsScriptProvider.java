package org.foxesworld.manascript.engine.script;

import org.foxesworld.manascript.script.ScriptEngineProvider;
import org.foxesworld.manascript.script.ScriptHost;
import org.foxesworld.manascript.script.ScriptLoader;

/** Registers the GraalJS backend as engine {@code "js"}. */
public final class JsScriptProvider implements ScriptEngineProvider {

    @Override public String engineName() { return "js"; }

    @Override public String fileExtension() { return "js"; }

    @Override
    public ScriptLoader createLoader(ScriptHost host) {
        return new JsScriptLoader(host);
    }
}

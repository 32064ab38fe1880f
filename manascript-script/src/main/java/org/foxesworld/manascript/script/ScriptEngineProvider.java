package org.foxesworld.manascript.script;

/**
 * Backend plug-in discovered through {@link java.util.ServiceLoader}
 * ({@code META-INF/services/org.foxesworld.manascript.script.ScriptEngineProvider}).
 */
public interface ScriptEngineProvider {

    /** Name scripts are registered under, e.g. {@code "js"}. */
    String engineName();

    /** File extension of this engine's scripts, without the dot. */
    String fileExtension();

    /** Creates the loader registered for {@link #engineName()}. Called once per registry. */
    ScriptLoader createLoader(ScriptHost host);
}

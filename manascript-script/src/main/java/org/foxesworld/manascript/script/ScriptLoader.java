package org.foxesworld.manascript.script;

/**
 * Loads one script file into a new interpreter instance of a particular engine.
 */
@FunctionalInterface
public interface ScriptLoader {

    /**
     * @param path resource path of the script file
     * @return a live script; never a half-initialized one
     * @throws ScriptLoadException when the file is missing or cannot be compiled
     */
    Script load(String path) throws ScriptLoadException;
}

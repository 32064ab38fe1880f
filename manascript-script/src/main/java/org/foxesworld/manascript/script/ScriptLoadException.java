package org.foxesworld.manascript.script;

/**
 * A script file could not be turned into a usable interpreter instance (missing file, syntax
 * error, unreadable source). Loaders throw it; {@link ScriptEngines} logs it and reports no script.
 */
public class ScriptLoadException extends Exception {

    private final String path;

    public ScriptLoadException(String path, String message) {
        super(message);
        this.path = path;
    }

    public ScriptLoadException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}

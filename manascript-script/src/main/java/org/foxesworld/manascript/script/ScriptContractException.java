package org.foxesworld.manascript.script;

/**
 * Misuse of the {@link Script} call sequence (push without prepare, nested prepare, use after
 * close). This is a programming error on the native side, never a scripting error.
 */
public final class ScriptContractException extends IllegalStateException {

    public ScriptContractException(String message) {
        super(message);
    }
}

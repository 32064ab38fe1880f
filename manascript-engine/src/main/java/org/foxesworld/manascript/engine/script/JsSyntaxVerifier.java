package org.foxesworld.manascript.engine.script;

import org.foxesworld.manascript.script.ScriptLoadException;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.SourceSection;

/**
 * Syntax check of a script file before any of its top-level code runs.
 */
final class JsSyntaxVerifier {

    private JsSyntaxVerifier() {}

    /**
     * Parses {@code src} in {@code ctx}; does not execute it.
     *
     * @throws ScriptLoadException with the error location when the source does not compile
     */
    static void verify(Context ctx, Source src) throws ScriptLoadException {
        try {
            ctx.parse(src);
        } catch (PolyglotException pe) {
            String kind = pe.isSyntaxError() ? "syntax error" : "compilation failed";
            throw new ScriptLoadException(src.getName(), kind + location(pe) + ": " + pe.getMessage(), pe);
        }
    }

    static String location(PolyglotException pe) {
        SourceSection at = pe.getSourceLocation();
        if (at == null) return "";
        return " @ " + at.getSource().getName() + ":" + at.getStartLine() + ":" + at.getStartColumn();
    }
}

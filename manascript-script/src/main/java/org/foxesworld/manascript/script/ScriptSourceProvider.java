package org.foxesworld.manascript.script;

import java.io.IOException;

/**
 * Resource-loading collaborator: resolves script paths to their full source text.
 */
public interface ScriptSourceProvider {

    boolean exists(String path);

    /**
     * @return the whole file as text, or {@code null} if the resource does not exist
     * @throws IOException when the resource exists but cannot be read or decoded
     */
    String loadText(String path) throws IOException;
}

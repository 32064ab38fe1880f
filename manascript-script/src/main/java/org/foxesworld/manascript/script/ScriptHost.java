package org.foxesworld.manascript.script;

import org.foxesworld.manascript.core.handle.HandleTable;
import org.foxesworld.manascript.core.net.MessageSender;

/**
 * What the server offers to script engine backends when they are installed.
 */
public interface ScriptHost {

    HandleTable handles();

    ScriptSourceProvider sources();

    MessageSender messages();

    ScriptingConfig config();
}

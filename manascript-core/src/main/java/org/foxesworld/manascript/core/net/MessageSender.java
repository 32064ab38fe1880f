package org.foxesworld.manascript.core.net;

import org.foxesworld.manascript.core.thing.Thing;

/**
 * Message-sending subsystem used by callbacks to notify connected clients.
 */
@FunctionalInterface
public interface MessageSender {

    /**
     * Delivers {@code message} to the client controlling {@code character}. Characters without a
     * connected client are silently skipped by implementations.
     */
    void sendTo(Thing character, MessageOut message);
}

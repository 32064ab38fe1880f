package org.foxesworld.manascript.core.net;

/** Game-server to client message ids used by script callbacks. */
public final class ProtocolMessages {

    /** W npc id, S choices (colon separated). */
    public static final int GPMSG_NPC_CHOICE = 0x02B0;

    /** W npc id, S message. */
    public static final int GPMSG_NPC_MESSAGE = 0x02B1;

    private ProtocolMessages() {}
}

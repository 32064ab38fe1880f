package org.foxesworld.manascript.engine.bridge;

import org.foxesworld.manascript.core.net.MessageOut;
import org.foxesworld.manascript.core.net.MessageSender;
import org.foxesworld.manascript.core.thing.Thing;

import java.util.List;
import java.util.Objects;

/**
 * Sends an NPC dialogue message to one character.
 * Shape {@code (npc, character, string)}; wire layout {@code W npc public id, S text}.
 */
public final class NpcDialogCallback implements NativeCallback {

    private static final List<ArgSpec> SHAPE = List.of(ArgSpec.npc(), ArgSpec.character(), ArgSpec.string());

    private final String name;
    private final int messageId;
    private final MessageSender messages;

    public NpcDialogCallback(String name, int messageId, MessageSender messages) {
        this.name = Objects.requireNonNull(name, "name");
        this.messageId = messageId;
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ArgSpec> shape() {
        return SHAPE;
    }

    @Override
    public void invoke(CallbackArgs args) {
        Thing npc = args.thing(0);
        Thing character = args.thing(1);

        MessageOut msg = new MessageOut(messageId);
        msg.writeShort(npc.publicId());
        msg.writeString(args.string(2));
        messages.sendTo(character, msg);
    }
}

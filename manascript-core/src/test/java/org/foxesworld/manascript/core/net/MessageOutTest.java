package org.foxesworld.manascript.core.net;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MessageOutTest {

    @Test
    void npcMessageLayout() {
        MessageOut msg = new MessageOut(ProtocolMessages.GPMSG_NPC_MESSAGE)
                .writeShort(0x0102)
                .writeString("hi");

        assertThat(msg.id()).isEqualTo(ProtocolMessages.GPMSG_NPC_MESSAGE);
        assertThat(msg.toByteArray()).containsExactly(
                0xB1, 0x02,   // id
                0x02, 0x01,   // npc public id
                0x02, 0x00,   // string length
                'h', 'i');
    }

    @Test
    void nullString_isWrittenEmpty() {
        MessageOut msg = new MessageOut(1).writeString(null);

        assertThat(msg.length()).isEqualTo(4);
    }

    @Test
    void overlongString_isCutAtCharacterBoundary() throws Exception {
        String text = "Ж".repeat(40_000);

        byte[] wire = new MessageOut(ProtocolMessages.GPMSG_NPC_MESSAGE).writeString(text).toByteArray();

        int declared = (wire[2] & 0xFF) | (wire[3] & 0xFF) << 8;
        assertThat(declared).isEqualTo(65_534);
        assertThat(wire).hasSize(4 + declared);

        String decoded = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(wire, 4, declared))
                .toString();
        assertThat(decoded).isEqualTo("Ж".repeat(32_767));
    }

    @Test
    void stringAtLimit_isKeptWhole() {
        String text = "a".repeat(MessageOut.MAX_STRING_BYTES);

        MessageOut msg = new MessageOut(1).writeString(text);

        assertThat(msg.length()).isEqualTo(4 + MessageOut.MAX_STRING_BYTES);
    }
}

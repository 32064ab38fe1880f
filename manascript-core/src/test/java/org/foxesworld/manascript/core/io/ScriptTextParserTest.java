package org.foxesworld.manascript.core.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScriptTextParserTest {

    private final ScriptTextParser parser = new ScriptTextParser();

    @Test
    void parse_dropsUtf8ByteOrderMark() throws IOException {
        byte[] body = "function onTalk() { return 1; }".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);

        assertThat(parser.parse(withBom)).isEqualTo("function onTalk() { return 1; }");
    }

    @Test
    void parse_keepsNonAsciiText() throws IOException {
        String src = "var greeting = 'Привет, путник';";
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);

        assertThat(parser.parse(new ByteArrayInputStream(bytes))).isEqualTo(src);
    }

    @Test
    void parse_rejectsMalformedUtf8() {
        byte[] broken = {'v', 'a', 'r', ' ', (byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> parser.parse(broken))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    void parse_path(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("npc.js");
        Files.writeString(file, "// empty\n", StandardCharsets.UTF_8);

        assertThat(parser.parse(file)).isEqualTo("// empty\n");
        assertThatThrownBy(() -> parser.parse(dir.resolve("missing.js")))
                .isInstanceOf(NoSuchFileException.class);
    }
}

package org.foxesworld.manascript.core.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes script source files: strict UTF-8, optional byte order mark dropped, CRLF kept as is.
 */
public final class ScriptTextParser extends ByteParser<String> {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    @Override
    protected String parseBytes(byte[] data) throws IOException {
        int offset = hasBom(data) ? UTF8_BOM.length : 0;
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, offset, data.length - offset))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Script source is not valid UTF-8", e);
        }
    }

    private static boolean hasBom(byte[] data) {
        return data.length >= 3
                && data[0] == UTF8_BOM[0]
                && data[1] == UTF8_BOM[1]
                && data[2] == UTF8_BOM[2];
    }
}

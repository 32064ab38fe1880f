package org.foxesworld.manascript.core.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Outgoing protocol message: a 16-bit id followed by little-endian fields.
 * Strings are written as a 16-bit byte length and UTF-8 bytes; longer strings are cut at the last
 * whole character that fits.
 */
public final class MessageOut {

    private static final Logger logger = LoggerFactory.getLogger(MessageOut.class);

    static final int MAX_STRING_BYTES = 0xFFFF;

    private final int id;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream(32);

    public MessageOut(int id) {
        this.id = id;
        writeShort(id);
    }

    public int id() {
        return id;
    }

    public MessageOut writeShort(int v) {
        out.write(v & 0xFF);
        out.write((v >>> 8) & 0xFF);
        return this;
    }

    public MessageOut writeString(String s) {
        byte[] bytes = (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
        int len = bytes.length;
        if (len > MAX_STRING_BYTES) {
            len = MAX_STRING_BYTES;
            // back off over continuation bytes (10xxxxxx) to the start of the cut character
            while (len > 0 && (bytes[len] & 0xC0) == 0x80) {
                len--;
            }
            logger.warn("String of {} bytes truncated to {} in message 0x{}",
                    bytes.length, len, Integer.toHexString(id));
        }
        writeShort(len);
        out.write(bytes, 0, len);
        return this;
    }

    /** Encoded message including the id prefix. */
    public byte[] toByteArray() {
        return out.toByteArray();
    }

    public int length() {
        return out.size();
    }

    @Override
    public String toString() {
        return "MessageOut{id=0x" + Integer.toHexString(id) + ", length=" + out.size() + '}';
    }
}

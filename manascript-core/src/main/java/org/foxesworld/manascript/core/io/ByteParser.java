package org.foxesworld.manascript.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Base for turning raw resource bytes into objects of type T.
 * <p>
 * Inputs are read fully into memory before {@link #parseBytes(byte[])} sees them.
 * Failures are logged once here and rethrown to the caller.
 */
public abstract class ByteParser<T> {
    private static final Logger logger = LoggerFactory.getLogger(ByteParser.class);

    /**
     * @param data never null
     * @throws IOException when the bytes cannot be turned into a T
     */
    protected abstract T parseBytes(byte[] data) throws IOException;

    public T parse(byte[] data) throws IOException {
        Objects.requireNonNull(data, "data");
        try {
            return parseBytes(data);
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to parse {} bytes: {}", data.length, ex.getMessage(), ex);
            throw ex;
        }
    }

    /** Stream is always closed. */
    public T parse(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input");
        byte[] data;
        try (InputStream in = input) {
            data = in.readAllBytes();
        } catch (IOException ex) {
            logger.error("Failed to read stream: {}", ex.getMessage(), ex);
            throw ex;
        }
        return parse(data);
    }

    public T parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            logger.error("File does not exist: {}", path.toAbsolutePath());
            throw new NoSuchFileException(path.toAbsolutePath().toString());
        }
        return parse(Files.newInputStream(path));
    }
}

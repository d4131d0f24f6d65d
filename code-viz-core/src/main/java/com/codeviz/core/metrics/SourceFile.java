package com.codeviz.core.metrics;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Content of a source file together with the metadata observed when it was read.
 *
 * @param content decoded text, without a leading byte order mark
 * @param sizeBytes raw length of the file in bytes
 * @param lastModified modification time taken before the content was read
 */
public record SourceFile(
    String content,
    long sizeBytes,
    Instant lastModified
) {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Compact constructor with validation.
     */
    public SourceFile {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative: " + sizeBytes);
        }
    }

    /**
     * Reads a file as strict UTF-8.
     *
     * <p>The modification time is captured before the bytes, so a file that changes
     * while being read is seen as stale by the next cache lookup rather than cached
     * with a newer timestamp than its content.
     *
     * @param path file to read
     * @return file content and metadata
     * @throws CharacterCodingException if the file is not valid UTF-8
     * @throws IOException if the file cannot be read
     */
    public static SourceFile read(Path path) throws IOException {
        Instant lastModified = Files.getLastModifiedTime(path).toInstant();
        byte[] bytes = Files.readAllBytes(path);
        String content = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }
        return new SourceFile(content, bytes.length, lastModified);
    }

    /**
     * Creates an in-memory source, mainly for tests.
     *
     * @param content text
     * @param lastModified modification time to report
     * @return source with the UTF-8 length of {@code content}
     */
    public static SourceFile of(String content, Instant lastModified) {
        return new SourceFile(content, content.getBytes(StandardCharsets.UTF_8).length, lastModified);
    }
}

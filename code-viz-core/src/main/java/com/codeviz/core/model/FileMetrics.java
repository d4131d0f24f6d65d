package com.codeviz.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Metrics computed for a single source file during one analysis pass.
 *
 * @param path path relative to the analysis root, {@code /}-separated
 * @param language language tag of the parser that measured the file (e.g. "typescript")
 * @param loc lines of code, excluding blank lines and lines that only hold comments
 * @param sizeBytes raw size of the file in bytes
 * @param functionCount number of function, method and closure declarations
 * @param lastModified modification time observed when the file was read
 */
public record FileMetrics(
    String path,
    String language,
    int loc,
    long sizeBytes,
    int functionCount,
    Instant lastModified
) {
    /**
     * Compact constructor with validation.
     */
    public FileMetrics {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        if (loc < 0) {
            throw new IllegalArgumentException("loc must not be negative: " + loc);
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative: " + sizeBytes);
        }
        if (functionCount < 0) {
            throw new IllegalArgumentException("functionCount must not be negative: " + functionCount);
        }
    }
}

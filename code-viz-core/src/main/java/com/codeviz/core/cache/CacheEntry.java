package com.codeviz.core.cache;

import com.codeviz.core.model.FileMetrics;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * On-disk form of one cache entry.
 *
 * <p>The modification time is split into seconds and nanoseconds so that it survives
 * the round trip exactly; the hit test compares it for equality.
 *
 * @param version format version; entries of another version are misses
 * @param path root-relative path the entry belongs to
 * @param language language tag
 * @param loc lines of code
 * @param sizeBytes file size
 * @param functionCount function count
 * @param modifiedEpochSecond modification time, seconds part
 * @param modifiedNano modification time, nanosecond adjustment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CacheEntry(
    @JsonProperty("version") int version,
    @JsonProperty("path") String path,
    @JsonProperty("language") String language,
    @JsonProperty("loc") int loc,
    @JsonProperty("sizeBytes") long sizeBytes,
    @JsonProperty("functionCount") int functionCount,
    @JsonProperty("modifiedEpochSecond") long modifiedEpochSecond,
    @JsonProperty("modifiedNano") int modifiedNano
) {
    static final int CURRENT_VERSION = 1;

    static CacheEntry from(FileMetrics metrics) {
        Instant modified = metrics.lastModified();
        return new CacheEntry(
            CURRENT_VERSION,
            metrics.path(),
            metrics.language(),
            metrics.loc(),
            metrics.sizeBytes(),
            metrics.functionCount(),
            modified.getEpochSecond(),
            modified.getNano()
        );
    }

    Instant lastModified() {
        return Instant.ofEpochSecond(modifiedEpochSecond, modifiedNano);
    }

    FileMetrics toMetrics() {
        return new FileMetrics(path, language, loc, sizeBytes, functionCount, lastModified());
    }
}

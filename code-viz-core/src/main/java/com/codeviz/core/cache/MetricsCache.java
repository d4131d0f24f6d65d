package com.codeviz.core.cache;

import com.codeviz.core.model.FileMetrics;

import java.util.Optional;

/**
 * Memoizes {@link FileMetrics} across runs, keyed by root-relative path and
 * validated against the file's modification time.
 *
 * <p>Implementations must tolerate concurrent calls for distinct paths.
 *
 * @since 1.0.0
 */
public interface MetricsCache {

    /**
     * Returns cached metrics if the file has not been modified since they were stored.
     * Never throws: any problem reading the entry is a miss.
     *
     * @param path root-relative path
     * @return cached metrics, or empty on a miss
     */
    Optional<FileMetrics> get(String path);

    /**
     * Stores metrics under {@link FileMetrics#path()}, replacing any previous entry.
     *
     * @param metrics metrics to store
     * @throws CacheException if the entry cannot be written
     */
    void set(FileMetrics metrics) throws CacheException;

    /**
     * Removes the entry for a path, if any.
     *
     * @param path root-relative path
     * @throws CacheException if an existing entry cannot be removed
     */
    void invalidate(String path) throws CacheException;

    /**
     * Removes every entry.
     *
     * @throws CacheException if the cache cannot be emptied
     */
    void clear() throws CacheException;

    /**
     * Cache that stores nothing, for runs with caching turned off.
     *
     * @return shared no-op cache
     */
    static MetricsCache disabled() {
        return NoOpCache.INSTANCE;
    }
}

package com.codeviz.core.cache;

import com.codeviz.core.model.FileMetrics;

import java.util.Optional;

/**
 * Always misses; writes are discarded.
 */
final class NoOpCache implements MetricsCache {

    static final NoOpCache INSTANCE = new NoOpCache();

    private NoOpCache() {
    }

    @Override
    public Optional<FileMetrics> get(String path) {
        return Optional.empty();
    }

    @Override
    public void set(FileMetrics metrics) {
        // nothing to store
    }

    @Override
    public void invalidate(String path) {
        // nothing stored
    }

    @Override
    public void clear() {
        // nothing stored
    }
}

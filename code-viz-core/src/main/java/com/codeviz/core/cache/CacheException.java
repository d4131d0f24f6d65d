package com.codeviz.core.cache;

/**
 * Thrown when a cache entry cannot be written or removed.
 *
 * @since 1.0.0
 */
public class CacheException extends Exception {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}

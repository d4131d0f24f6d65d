package com.codeviz.core.metrics;

/**
 * Thrown when metrics cannot be computed for a file.
 *
 * @since 1.0.0
 */
public class MetricsException extends Exception {

    /**
     * Why the computation failed.
     */
    public enum Reason {
        PARSE_FAILED,
        TIMED_OUT
    }

    private final String path;
    private final Reason reason;

    public MetricsException(String path, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.reason = reason;
    }

    public String getPath() {
        return path;
    }

    public Reason getReason() {
        return reason;
    }
}

package com.codeviz.core.scanner;

import com.codeviz.core.AnalysisException;

import java.nio.file.Path;

/**
 * Thrown when a scan cannot start: the root is unusable or an exclusion pattern
 * does not compile.
 *
 * @since 1.0.0
 */
public class ScanException extends AnalysisException {

    /**
     * Why the scan was rejected.
     */
    public enum Reason {
        NOT_FOUND,
        NOT_A_DIRECTORY,
        INVALID_PATTERN,
        WALK_FAILED
    }

    private final Reason reason;

    public ScanException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ScanException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static ScanException notFound(Path root) {
        return new ScanException(Reason.NOT_FOUND, "Root does not exist: " + root);
    }

    static ScanException notADirectory(Path root) {
        return new ScanException(Reason.NOT_A_DIRECTORY, "Root is not a directory: " + root);
    }
}

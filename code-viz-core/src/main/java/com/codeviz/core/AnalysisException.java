package com.codeviz.core;

/**
 * Base class for errors that abort an analysis run.
 *
 * <p>Per-file problems never surface as this exception; they are reported as
 * {@link com.codeviz.core.model.AnalysisWarning warnings} and the run continues.
 *
 * @since 1.0.0
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

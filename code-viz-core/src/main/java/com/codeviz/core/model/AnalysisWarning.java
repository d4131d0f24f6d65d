package com.codeviz.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Non-fatal issue recorded against a single file or directory.
 *
 * @param path path relative to the analysis root
 * @param kind category of the issue
 * @param message human-readable detail
 */
public record AnalysisWarning(
    String path,
    WarningKind kind,
    String message
) {
    /** Orders warnings by path, then by kind. */
    public static final Comparator<AnalysisWarning> ORDER =
        Comparator.comparing(AnalysisWarning::path).thenComparing(AnalysisWarning::kind);

    /**
     * Compact constructor with validation.
     */
    public AnalysisWarning {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }

    /**
     * Returns true if the warning means the file is missing from the result.
     * Cache failures are the only kind that still yield metrics.
     *
     * @return true if the file was skipped
     */
    public boolean isSkip() {
        return kind != WarningKind.CACHE_FAILURE;
    }
}

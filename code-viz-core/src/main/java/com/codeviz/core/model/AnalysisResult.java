package com.codeviz.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Complete result of analyzing one repository.
 *
 * <p>This is the stable contract consumed by output formatters, diff tooling and
 * visualizations. {@code files} is always sorted by path.
 *
 * @param summary aggregate statistics
 * @param files per-file metrics, sorted by path
 * @param timestamp when the analysis finished
 */
public record AnalysisResult(
    Summary summary,
    List<FileMetrics> files,
    Instant timestamp
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        files = files != null ? List.copyOf(files) : List.of();
    }
}

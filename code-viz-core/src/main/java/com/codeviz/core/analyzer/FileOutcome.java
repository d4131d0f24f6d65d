package com.codeviz.core.analyzer;

import com.codeviz.core.model.AnalysisWarning;
import com.codeviz.core.model.FileMetrics;

import java.util.List;
import java.util.Optional;

/**
 * Result of processing one scanned file: metrics, warnings, or both when the
 * metrics could not be written to the cache.
 *
 * @param metrics computed or cached metrics, null if the file was skipped
 * @param warnings problems encountered for the file
 * @param cacheHit whether the metrics came from the cache
 */
record FileOutcome(
    FileMetrics metrics,
    List<AnalysisWarning> warnings,
    boolean cacheHit
) {
    FileOutcome {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    static FileOutcome cached(FileMetrics metrics) {
        return new FileOutcome(metrics, List.of(), true);
    }

    static FileOutcome computed(FileMetrics metrics, List<AnalysisWarning> warnings) {
        return new FileOutcome(metrics, warnings, false);
    }

    static FileOutcome skipped(AnalysisWarning warning) {
        return new FileOutcome(null, List.of(warning), false);
    }

    Optional<FileMetrics> metricsIfPresent() {
        return Optional.ofNullable(metrics);
    }
}

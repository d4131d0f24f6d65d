package com.codeviz.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Analysis result together with the warnings collected while producing it.
 *
 * <p>Callers that gate CI on skipped files use {@link #warnings()}; callers that only
 * need metrics use {@link #result()}.
 *
 * @param result the analysis result
 * @param warnings per-file warnings ordered by path, then kind
 */
public record AnalysisReport(
    AnalysisResult result,
    List<AnalysisWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisReport {
        Objects.requireNonNull(result, "result must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Returns true if any file was skipped or degraded.
     *
     * @return true if there are warnings
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Returns the paths of files that were left out of the result.
     *
     * @return skipped paths, in warning order, without duplicates
     */
    public List<String> skippedPaths() {
        return warnings.stream()
            .filter(AnalysisWarning::isSkip)
            .map(AnalysisWarning::path)
            .distinct()
            .toList();
    }
}

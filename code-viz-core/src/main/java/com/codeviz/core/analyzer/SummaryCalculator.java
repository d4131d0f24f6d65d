package com.codeviz.core.analyzer;

import com.codeviz.core.model.FileMetrics;
import com.codeviz.core.model.Summary;

import java.util.Comparator;
import java.util.List;

/**
 * Reduces per-file metrics into a {@link Summary}.
 *
 * @since 1.0.0
 */
public final class SummaryCalculator {

    /** Largest first; equal sizes in path order. */
    static final Comparator<FileMetrics> BY_SIZE_DESCENDING =
        Comparator.comparingInt(FileMetrics::loc).reversed().thenComparing(FileMetrics::path);

    private SummaryCalculator() {
        // Utility class
    }

    /**
     * Builds the summary for a set of files.
     *
     * @param files metrics of every analyzed file
     * @return totals and the paths of the largest files by LOC
     */
    public static Summary summarize(List<FileMetrics> files) {
        long totalLoc = 0;
        long totalFunctions = 0;
        for (FileMetrics file : files) {
            totalLoc += file.loc();
            totalFunctions += file.functionCount();
        }
        List<String> largestFiles = files.stream()
            .sorted(BY_SIZE_DESCENDING)
            .limit(Summary.LARGEST_FILES_LIMIT)
            .map(FileMetrics::path)
            .toList();
        return new Summary(files.size(), totalLoc, totalFunctions, largestFiles);
    }
}

package com.codeviz.core.model;

import java.util.List;

/**
 * Aggregate statistics over all files of an analysis run.
 *
 * @param totalFiles number of files that were measured
 * @param totalLoc sum of lines of code
 * @param totalFunctions sum of function counts
 * @param largestFiles up to ten paths ordered by descending LOC, ties by ascending path
 */
public record Summary(
    int totalFiles,
    long totalLoc,
    long totalFunctions,
    List<String> largestFiles
) {
    /** Maximum number of entries in {@link #largestFiles()}. */
    public static final int LARGEST_FILES_LIMIT = 10;

    /**
     * Compact constructor with validation.
     */
    public Summary {
        largestFiles = largestFiles != null ? List.copyOf(largestFiles) : List.of();
    }
}

package com.codeviz.core.scanner;

import com.codeviz.core.model.AnalysisWarning;
import com.codeviz.core.util.FileUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Output of a repository scan.
 *
 * @param root absolute, normalized scan root
 * @param files absolute paths of the accepted files, sorted by root-relative path
 * @param warnings entries that were skipped because of an error or a size limit
 */
public record ScanResult(
    Path root,
    List<Path> files,
    List<AnalysisWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        Objects.requireNonNull(root, "root must not be null");
        files = files != null ? List.copyOf(files) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Root-relative form of {@link #files()}, in the same order.
     *
     * @return relative {@code /}-separated paths
     */
    public List<String> relativePaths() {
        return files.stream()
            .map(file -> FileUtils.toRelativePath(root, file))
            .toList();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}

package com.codeviz.core.scanner;

import com.codeviz.core.config.AnalysisConfig;
import com.codeviz.core.model.AnalysisWarning;
import com.codeviz.core.model.WarningKind;
import com.codeviz.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Enumerates the source files of a repository.
 *
 * <p>The walk never follows symbolic links and never opens a directory that is
 * excluded, hidden or ignored by a {@code .gitignore}. Only files whose extension
 * is in the allow-list are reported, sorted by their root-relative path so that
 * repeated scans of the same tree produce the same order.
 *
 * <p>Entries that cannot be read are reported as warnings; the scan itself only
 * fails when the root is unusable or a pattern does not compile.
 *
 * @since 1.0.0
 */
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    private final Set<String> allowedExtensions;

    /**
     * @param allowedExtensions file extensions (without dot) to report; compared case-insensitively
     */
    public RepositoryScanner(Set<String> allowedExtensions) {
        Objects.requireNonNull(allowedExtensions, "allowedExtensions must not be null");
        this.allowedExtensions = allowedExtensions.stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Scans with the default options and the given exclusion patterns.
     *
     * @param root directory to scan
     * @param excludePatterns glob patterns relative to the root
     * @return accepted files and warnings
     * @throws ScanException if the root is unusable or a pattern is invalid
     */
    public ScanResult scan(Path root, List<String> excludePatterns) throws ScanException {
        return scan(root, AnalysisConfig.defaults().withExcludePatterns(excludePatterns));
    }

    /**
     * Scans a repository.
     *
     * @param root directory to scan
     * @param config exclusion, {@code .gitignore} and size options
     * @return accepted files and warnings
     * @throws ScanException if the root is unusable or a pattern is invalid
     */
    public ScanResult scan(Path root, AnalysisConfig config) throws ScanException {
        Objects.requireNonNull(config, "config must not be null");
        Path normalizedRoot = resolveRoot(root);
        ExcludeMatcher excludes = ExcludeMatcher.compile(config.excludePatterns());

        log.info("Scanning {} ({} exclude patterns, gitignore={})",
            normalizedRoot, excludes.getPatterns().size(), config.respectGitignore());

        Walker walker = new Walker(normalizedRoot, excludes, config);
        try {
            Files.walkFileTree(normalizedRoot, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, walker);
        } catch (IOException e) {
            throw new ScanException(ScanException.Reason.WALK_FAILED,
                "Failed to walk " + normalizedRoot + ": " + e.getMessage(), e);
        }

        List<Path> files = new ArrayList<>(walker.accepted.values());
        List<AnalysisWarning> warnings = new ArrayList<>(walker.warnings);
        warnings.sort(AnalysisWarning.ORDER);

        log.info("Scan of {} complete: {} files, {} directories pruned, {} warnings",
            normalizedRoot, files.size(), walker.prunedDirectories, warnings.size());
        return new ScanResult(normalizedRoot, files, warnings);
    }

    /**
     * Resolves the directory a scan starts from. A root that is itself a symbolic
     * link is followed; links below the root never are.
     *
     * @param root directory as given by the caller
     * @return absolute real path of the root
     * @throws ScanException if the root does not exist or is not a directory
     */
    public static Path resolveRoot(Path root) throws ScanException {
        Objects.requireNonNull(root, "root must not be null");
        if (!Files.exists(root)) {
            throw ScanException.notFound(root);
        }
        if (!Files.isDirectory(root)) {
            throw ScanException.notADirectory(root);
        }
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new ScanException(ScanException.Reason.WALK_FAILED,
                "Failed to resolve " + root + ": " + e.getMessage(), e);
        }
    }

    private final class Walker extends SimpleFileVisitor<Path> {

        private final Path root;
        private final ExcludeMatcher excludes;
        private final boolean respectGitignore;
        private final long maxFileSizeBytes;

        // Keyed by relative path, so iteration order is the output order.
        private final Map<String, Path> accepted = new TreeMap<>(Comparator.naturalOrder());
        private final List<AnalysisWarning> warnings = new ArrayList<>();
        private final Deque<GitIgnoreRules> ignoreStack = new ArrayDeque<>();
        private int prunedDirectories;

        private Walker(Path root, ExcludeMatcher excludes, AnalysisConfig config) {
            this.root = root;
            this.excludes = excludes;
            this.respectGitignore = config.respectGitignore();
            this.maxFileSizeBytes = config.maxFileSizeBytes();
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            Path relative = root.relativize(dir);
            if (!dir.equals(root)) {
                String reason = skipReason(relative, true);
                if (reason != null) {
                    log.debug("Pruning {} ({})", relative, reason);
                    prunedDirectories++;
                    return FileVisitResult.SKIP_SUBTREE;
                }
            }
            ignoreStack.addLast(loadIgnoreRules(dir, relative));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            ignoreStack.pollLast();
            if (exc != null) {
                addFailure(dir, exc);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isSymbolicLink() || !attrs.isRegularFile()) {
                log.debug("Skipping non-regular file {}", file);
                return FileVisitResult.CONTINUE;
            }
            Path relative = root.relativize(file);
            if (skipReason(relative, false) != null) {
                return FileVisitResult.CONTINUE;
            }
            if (!allowedExtensions.contains(FileUtils.getNormalizedExtension(file))) {
                return FileVisitResult.CONTINUE;
            }

            String relativePath = FileUtils.toRelativePath(root, file);
            if (attrs.size() > maxFileSizeBytes) {
                log.warn("Skipping {}: {} bytes exceeds limit of {} bytes", relativePath, attrs.size(), maxFileSizeBytes);
                warnings.add(new AnalysisWarning(relativePath, WarningKind.FILE_TOO_LARGE,
                    "File size " + attrs.size() + " bytes exceeds limit of " + maxFileSizeBytes + " bytes"));
                return FileVisitResult.CONTINUE;
            }
            accepted.put(relativePath, file);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            if (!file.equals(root) && skipReason(root.relativize(file), false) != null) {
                log.debug("Ignoring unreadable excluded entry {}", file);
                return FileVisitResult.CONTINUE;
            }
            addFailure(file, exc);
            return FileVisitResult.CONTINUE;
        }

        /**
         * Returns why an entry is skipped, or null if it is kept.
         */
        private String skipReason(Path relative, boolean directory) {
            if (FileUtils.isHidden(relative)) {
                return "hidden";
            }
            if (excludes.matches(relative)) {
                return "excluded";
            }
            if (respectGitignore && isIgnored(relative, directory)) {
                return "gitignored";
            }
            return null;
        }

        private boolean isIgnored(Path relative, boolean directory) {
            GitIgnoreRules.Verdict verdict = GitIgnoreRules.Verdict.NONE;
            for (GitIgnoreRules rules : ignoreStack) {
                GitIgnoreRules.Verdict candidate = rules.evaluate(relative, directory);
                if (candidate != GitIgnoreRules.Verdict.NONE) {
                    verdict = candidate;
                }
            }
            return verdict == GitIgnoreRules.Verdict.IGNORED;
        }

        private GitIgnoreRules loadIgnoreRules(Path dir, Path relative) {
            Path ignoreFile = dir.resolve(GitIgnoreRules.FILE_NAME);
            if (!respectGitignore || !Files.isRegularFile(ignoreFile)) {
                return GitIgnoreRules.parse(relative, List.of());
            }
            try {
                List<String> lines = Files.readAllLines(ignoreFile, StandardCharsets.UTF_8);
                log.debug("Loaded {} lines from {}", lines.size(), ignoreFile);
                return GitIgnoreRules.parse(relative, lines);
            } catch (IOException e) {
                addFailure(ignoreFile, e);
                return GitIgnoreRules.parse(relative, List.of());
            }
        }

        private void addFailure(Path path, IOException exc) {
            String relativePath = FileUtils.toRelativePath(root, path);
            WarningKind kind = exc instanceof AccessDeniedException
                ? WarningKind.PERMISSION_DENIED
                : WarningKind.IO_ERROR;
            log.warn("Skipping {}: {} ({})", relativePath, kind, exc.getMessage());
            warnings.add(new AnalysisWarning(relativePath, kind, String.valueOf(exc.getMessage())));
        }
    }
}

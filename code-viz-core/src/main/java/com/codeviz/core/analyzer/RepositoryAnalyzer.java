package com.codeviz.core.analyzer;

import com.codeviz.core.AnalysisException;
import com.codeviz.core.cache.CacheException;
import com.codeviz.core.cache.DiskCache;
import com.codeviz.core.cache.MetricsCache;
import com.codeviz.core.config.AnalysisConfig;
import com.codeviz.core.metrics.MetricsCalculator;
import com.codeviz.core.metrics.MetricsException;
import com.codeviz.core.metrics.SourceFile;
import com.codeviz.core.model.AnalysisReport;
import com.codeviz.core.model.AnalysisResult;
import com.codeviz.core.model.AnalysisWarning;
import com.codeviz.core.model.FileMetrics;
import com.codeviz.core.model.WarningKind;
import com.codeviz.core.parser.LanguageParser;
import com.codeviz.core.parser.ParserRegistry;
import com.codeviz.core.parser.UnsupportedLanguageException;
import com.codeviz.core.scanner.RepositoryScanner;
import com.codeviz.core.scanner.ScanResult;
import com.codeviz.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a complete analysis: scan, measure every file in parallel, reduce.
 *
 * <p><b>Pipeline:</b></p>
 * <ol>
 *   <li>Scan the root once ({@link RepositoryScanner}).</li>
 *   <li>For each file, on a fixed worker pool: serve from the cache if the file is
 *       unchanged, otherwise read, parse, measure and write back to the cache.</li>
 *   <li>Collect outcomes in scan order (never completion order) and build the summary.</li>
 * </ol>
 *
 * <p>A file that cannot be processed is left out of the result and reported as an
 * {@link AnalysisWarning}; it never aborts the run. Each file gets
 * {@link AnalysisConfig#parseTimeoutMillis()} from the moment its task starts. The
 * limit is handed to the parser, which aborts engines that support it and frees the
 * worker. A watchdog backs this up for engines that cannot be stopped: their file is
 * abandoned, reported as timed out, and its late result is neither returned nor cached.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * RepositoryAnalyzer analyzer = new RepositoryAnalyzer();
 * AnalysisResult result = analyzer.analyze(Path.of("."), AnalysisConfig.defaults());
 * System.out.println(result.summary().totalLoc());
 * }</pre>
 *
 * @since 1.0.0
 */
public class RepositoryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAnalyzer.class);

    private final ParserRegistry registry;
    private final MetricsCalculator calculator;

    /**
     * Creates an analyzer with every parser discovered on the classpath.
     */
    public RepositoryAnalyzer() {
        this(ParserRegistry.discover());
    }

    public RepositoryAnalyzer(ParserRegistry registry) {
        this(registry, new MetricsCalculator());
    }

    public RepositoryAnalyzer(ParserRegistry registry, MetricsCalculator calculator) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
    }

    /**
     * Analyzes a repository.
     *
     * @param root directory to analyze
     * @param config run options
     * @return metrics of every analyzed file plus the summary
     * @throws AnalysisException if the root is unusable or an exclude pattern is invalid
     */
    public AnalysisResult analyze(Path root, AnalysisConfig config) throws AnalysisException {
        return analyzeWithWarnings(root, config).result();
    }

    /**
     * Analyzes a repository and also returns the files that were skipped.
     *
     * @param root directory to analyze
     * @param config run options
     * @return result and warnings
     * @throws AnalysisException if the root is unusable or an exclude pattern is invalid
     */
    public AnalysisReport analyzeWithWarnings(Path root, AnalysisConfig config) throws AnalysisException {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path resolvedRoot = RepositoryScanner.resolveRoot(root);
        MetricsCache cache = config.useCache()
            ? new DiskCache(resolvedRoot, config.resolveCacheDirectory(resolvedRoot))
            : MetricsCache.disabled();
        return analyzeWithWarnings(resolvedRoot, config, cache);
    }

    /**
     * Analyzes a repository using the given cache, regardless of
     * {@link AnalysisConfig#useCache()}.
     *
     * @param root directory to analyze
     * @param config run options
     * @param cache cache to consult and update
     * @return result and warnings
     * @throws AnalysisException if the root is unusable or an exclude pattern is invalid
     */
    public AnalysisReport analyzeWithWarnings(Path root, AnalysisConfig config, MetricsCache cache)
            throws AnalysisException {
        Objects.requireNonNull(cache, "cache must not be null");
        Instant started = Instant.now();
        long startNanos = System.nanoTime();
        log.info("Analyzing {} with {} worker threads (cache {})",
            root, config.effectiveParallelism(), config.useCache() ? "enabled" : "disabled");

        RepositoryScanner scanner = new RepositoryScanner(registry.getSupportedExtensions());
        ScanResult scan = scanner.scan(root, config);

        List<FileOutcome> outcomes = processAll(scan, config, cache);

        List<FileMetrics> files = new ArrayList<>(outcomes.size());
        List<AnalysisWarning> warnings = new ArrayList<>(scan.warnings());
        int cacheHits = 0;
        for (FileOutcome outcome : outcomes) {
            outcome.metricsIfPresent().ifPresent(files::add);
            warnings.addAll(outcome.warnings());
            if (outcome.cacheHit()) {
                cacheHits++;
            }
        }
        warnings.sort(AnalysisWarning.ORDER);

        AnalysisResult result = new AnalysisResult(SummaryCalculator.summarize(files), files, started);
        log.info("Analysis of {} complete: {} files, {} LOC, {} functions, {} warnings, {} cache hits in {} ms",
            scan.root(),
            result.summary().totalFiles(),
            result.summary().totalLoc(),
            result.summary().totalFunctions(),
            warnings.size(),
            cacheHits,
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return new AnalysisReport(result, warnings);
    }

    // ==================== Fan-out ====================

    private List<FileOutcome> processAll(ScanResult scan, AnalysisConfig config, MetricsCache cache) {
        List<Path> files = scan.files();
        if (files.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(config.effectiveParallelism(), files.size());
        ExecutorService workers = Executors.newFixedThreadPool(threads, namedDaemonThreads("code-viz-worker"));
        ScheduledExecutorService watchdog =
            Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("code-viz-watchdog"));
        try {
            List<String> paths = new ArrayList<>(files.size());
            List<CompletableFuture<FileOutcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                String relativePath = FileUtils.toRelativePath(scan.root(), file);
                paths.add(relativePath);
                futures.add(submit(relativePath, file, cache, config.parseTimeoutMillis(), workers, watchdog));
            }

            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(paths.get(i), futures.get(i), config.parseTimeoutMillis()));
            }
            return outcomes;
        } finally {
            workers.shutdownNow();
            watchdog.shutdownNow();
        }
    }

    private CompletableFuture<FileOutcome> submit(String relativePath, Path file, MetricsCache cache,
                                                  long timeoutMillis, ExecutorService workers,
                                                  ScheduledExecutorService watchdog) {
        CompletableFuture<FileOutcome> outcome = new CompletableFuture<>();
        // set by whichever side settles the file first: the watchdog or the cache write
        AtomicBoolean settled = new AtomicBoolean();
        workers.execute(() -> {
            ScheduledFuture<?> timer = watchdog.schedule(() -> {
                if (settled.compareAndSet(false, true)) {
                    outcome.completeExceptionally(new TimeoutException(
                        "Processing exceeded " + timeoutMillis + " ms"));
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
            try {
                outcome.complete(processFile(relativePath, file, cache, timeoutMillis, settled));
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            } finally {
                timer.cancel(false);
            }
        });
        return outcome;
    }

    private FileOutcome await(String relativePath, CompletableFuture<FileOutcome> future, long timeoutMillis) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                return skip(relativePath, WarningKind.TIMEOUT,
                    "Parsing did not finish within " + timeoutMillis + " ms");
            }
            if (cause instanceof Error error) {
                throw error;
            }
            log.error("Unexpected failure while processing {}", relativePath, cause);
            return skip(relativePath, WarningKind.PARSE_FAILURE,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    // ==================== Per-file work ====================

    /**
     * Processes one file. Expected failures become warnings; only programming
     * errors escape.
     */
    private FileOutcome processFile(String relativePath, Path file, MetricsCache cache, long timeoutMillis,
                                    AtomicBoolean settled) {
        Optional<FileMetrics> cached = cache.get(relativePath);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", relativePath);
            return FileOutcome.cached(cached.get());
        }

        Optional<String> language = registry.detectLanguage(file);
        if (language.isEmpty()) {
            return skip(relativePath, WarningKind.UNSUPPORTED_LANGUAGE,
                "No parser for extension '" + FileUtils.getNormalizedExtension(file) + "'");
        }
        LanguageParser parser;
        try {
            parser = registry.getParser(language.get());
        } catch (UnsupportedLanguageException e) {
            return skip(relativePath, WarningKind.UNSUPPORTED_LANGUAGE, e.getMessage());
        }

        SourceFile source;
        try {
            source = SourceFile.read(file);
        } catch (CharacterCodingException e) {
            return skip(relativePath, WarningKind.UNREADABLE_ENCODING, "File is not valid UTF-8");
        } catch (AccessDeniedException e) {
            return skip(relativePath, WarningKind.PERMISSION_DENIED, "Permission denied");
        } catch (NoSuchFileException e) {
            return skip(relativePath, WarningKind.IO_ERROR, "File disappeared during analysis");
        } catch (IOException e) {
            return skip(relativePath, WarningKind.IO_ERROR, e.getMessage());
        }

        FileMetrics metrics;
        try {
            metrics = calculator.calculate(relativePath, source, parser, timeoutMillis);
        } catch (MetricsException e) {
            WarningKind kind = e.getReason() == MetricsException.Reason.TIMED_OUT
                ? WarningKind.TIMEOUT
                : WarningKind.PARSE_FAILURE;
            return skip(relativePath, kind, e.getMessage());
        }
        log.debug("Measured {}: {} LOC, {} functions", relativePath, metrics.loc(), metrics.functionCount());

        if (!settled.compareAndSet(false, true)) {
            // already reported as timed out; the result is discarded and must not be cached
            return FileOutcome.computed(metrics, List.of());
        }
        try {
            cache.set(metrics);
        } catch (CacheException e) {
            log.warn("Failed to cache metrics for {}: {}", relativePath, e.getMessage());
            return FileOutcome.computed(metrics, List.of(
                new AnalysisWarning(relativePath, WarningKind.CACHE_FAILURE, e.getMessage())));
        }
        return FileOutcome.computed(metrics, List.of());
    }

    private static FileOutcome skip(String relativePath, WarningKind kind, String message) {
        log.warn("Skipping {}: {} ({})", relativePath, kind, message);
        return FileOutcome.skipped(new AnalysisWarning(relativePath, kind, message));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.codeviz.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Options for one analysis run.
 *
 * <p>A plain value: built once per invocation and never mutated while the run is in
 * progress. Collaborators that load settings from a file (TOML, YAML, JSON) can bind
 * this record directly with Jackson through {@link #fromJson}; absent properties take
 * the defaults below.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "excludePatterns": ["**&#47;node_modules/**", "generated/**"],
 *   "useCache": true,
 *   "parseTimeoutMillis": 5000
 * }
 * }</pre>
 *
 * @param excludePatterns glob patterns, relative to the root, whose matches are skipped entirely
 * @param useCache whether unchanged files are served from the metrics cache
 * @param respectGitignore whether {@code .gitignore} files in the tree exclude entries
 * @param maxFileSizeBytes files larger than this are skipped with a warning
 * @param parseTimeoutMillis time limit for processing a single file
 * @param parallelism worker threads; {@code 0} means one per available processor
 * @param cacheDirectory cache location; {@code null} means {@code <root>/.code-viz/cache}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    List<String> excludePatterns,
    boolean useCache,
    boolean respectGitignore,
    long maxFileSizeBytes,
    long parseTimeoutMillis,
    int parallelism,
    String cacheDirectory
) {
    /** Dependency caches, build output and version-control metadata. */
    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
        "**/node_modules/**",
        "target/**",
        "build/**",
        "dist/**",
        ".git/**"
    );

    /** 10 MiB. */
    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;

    public static final long DEFAULT_PARSE_TIMEOUT_MILLIS = 5_000L;

    /** Cache location relative to the analysis root. */
    public static final String DEFAULT_CACHE_DIRECTORY = ".code-viz/cache";

    /**
     * Compact constructor with validation.
     */
    public AnalysisConfig {
        excludePatterns = excludePatterns != null ? List.copyOf(excludePatterns) : List.of();
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFileSizeBytes must be positive: " + maxFileSizeBytes);
        }
        if (parseTimeoutMillis <= 0) {
            throw new IllegalArgumentException("parseTimeoutMillis must be positive: " + parseTimeoutMillis);
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("parallelism must not be negative: " + parallelism);
        }
    }

    /**
     * Creates the default configuration: common build and dependency directories
     * excluded, cache enabled, {@code .gitignore} honoured.
     *
     * @return default configuration
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
            DEFAULT_EXCLUDE_PATTERNS,
            true,
            true,
            DEFAULT_MAX_FILE_SIZE_BYTES,
            DEFAULT_PARSE_TIMEOUT_MILLIS,
            0,
            null
        );
    }

    /**
     * Jackson entry point; every property is optional.
     */
    @JsonCreator
    static AnalysisConfig fromJson(
            @JsonProperty("excludePatterns") List<String> excludePatterns,
            @JsonProperty("useCache") Boolean useCache,
            @JsonProperty("respectGitignore") Boolean respectGitignore,
            @JsonProperty("maxFileSizeBytes") Long maxFileSizeBytes,
            @JsonProperty("parseTimeoutMillis") Long parseTimeoutMillis,
            @JsonProperty("parallelism") Integer parallelism,
            @JsonProperty("cacheDirectory") String cacheDirectory) {
        return new AnalysisConfig(
            excludePatterns != null ? excludePatterns : DEFAULT_EXCLUDE_PATTERNS,
            useCache == null || useCache,
            respectGitignore == null || respectGitignore,
            maxFileSizeBytes != null ? maxFileSizeBytes : DEFAULT_MAX_FILE_SIZE_BYTES,
            parseTimeoutMillis != null ? parseTimeoutMillis : DEFAULT_PARSE_TIMEOUT_MILLIS,
            parallelism != null ? parallelism : 0,
            cacheDirectory
        );
    }

    public AnalysisConfig withExcludePatterns(List<String> patterns) {
        return new AnalysisConfig(patterns, useCache, respectGitignore, maxFileSizeBytes,
            parseTimeoutMillis, parallelism, cacheDirectory);
    }

    public AnalysisConfig withUseCache(boolean enabled) {
        return new AnalysisConfig(excludePatterns, enabled, respectGitignore, maxFileSizeBytes,
            parseTimeoutMillis, parallelism, cacheDirectory);
    }

    public AnalysisConfig withRespectGitignore(boolean enabled) {
        return new AnalysisConfig(excludePatterns, useCache, enabled, maxFileSizeBytes,
            parseTimeoutMillis, parallelism, cacheDirectory);
    }

    public AnalysisConfig withMaxFileSizeBytes(long bytes) {
        return new AnalysisConfig(excludePatterns, useCache, respectGitignore, bytes,
            parseTimeoutMillis, parallelism, cacheDirectory);
    }

    public AnalysisConfig withParseTimeoutMillis(long millis) {
        return new AnalysisConfig(excludePatterns, useCache, respectGitignore, maxFileSizeBytes,
            millis, parallelism, cacheDirectory);
    }

    public AnalysisConfig withParallelism(int threads) {
        return new AnalysisConfig(excludePatterns, useCache, respectGitignore, maxFileSizeBytes,
            parseTimeoutMillis, threads, cacheDirectory);
    }

    public AnalysisConfig withCacheDirectory(String directory) {
        return new AnalysisConfig(excludePatterns, useCache, respectGitignore, maxFileSizeBytes,
            parseTimeoutMillis, parallelism, directory);
    }

    /**
     * Number of worker threads to use for this run.
     *
     * @return {@link #parallelism()} if set, otherwise the available processor count
     */
    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Resolves the cache directory for an analysis root. Relative settings are
     * resolved against the root.
     *
     * @param root analysis root
     * @return absolute-or-root-relative cache directory
     */
    public Path resolveCacheDirectory(Path root) {
        String directory = cacheDirectory != null && !cacheDirectory.isBlank()
            ? cacheDirectory
            : DEFAULT_CACHE_DIRECTORY;
        return root.resolve(directory);
    }
}

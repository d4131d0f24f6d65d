package com.codeviz.core.analyzer;

import com.codeviz.core.AnalysisException;
import com.codeviz.core.RepositoryTestBase;
import com.codeviz.core.cache.CacheException;
import com.codeviz.core.cache.DiskCache;
import com.codeviz.core.cache.MetricsCache;
import com.codeviz.core.config.AnalysisConfig;
import com.codeviz.core.model.AnalysisReport;
import com.codeviz.core.model.AnalysisResult;
import com.codeviz.core.model.AnalysisWarning;
import com.codeviz.core.model.FileMetrics;
import com.codeviz.core.model.WarningKind;
import com.codeviz.core.parser.LanguageParser;
import com.codeviz.core.parser.ParserRegistry;
import com.codeviz.core.parser.SourceRange;
import com.codeviz.core.parser.SyntaxTree;
import com.codeviz.core.parser.impl.javascript.TypeScriptParser;
import com.codeviz.core.scanner.ScanException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Functional tests for {@link RepositoryAnalyzer}.
 */
class RepositoryAnalyzerTest extends RepositoryTestBase {

    private static final AnalysisConfig NO_CACHE = AnalysisConfig.defaults().withUseCache(false);

    private final CountingParser countingParser = new CountingParser();
    private final RepositoryAnalyzer analyzer = new RepositoryAnalyzer(new ParserRegistry(List.of(countingParser)));

    @Test
    void analyze_excludedDirectory_summarizesRemainingFiles() throws Exception {
        createFile("a.ts", codeLines(10));
        createFile("b.ts", codeLines(5) + "// comment\n".repeat(5));
        createFile("excluded/c.ts", codeLines(50));

        AnalysisResult result = analyzer.analyze(tempDir, NO_CACHE.withExcludePatterns(List.of("excluded/**")));

        assertThat(result.summary().totalFiles()).isEqualTo(2);
        assertThat(result.summary().totalLoc()).isEqualTo(15);
        assertThat(result.summary().largestFiles()).containsExactly("a.ts", "b.ts");
        assertThat(result.files()).extracting(FileMetrics::path).containsExactly("a.ts", "b.ts");
    }

    @Test
    void analyze_emptyRoot_returnsEmptySummary() throws Exception {
        AnalysisResult result = analyzer.analyze(tempDir, NO_CACHE);

        assertThat(result.summary().totalFiles()).isZero();
        assertThat(result.summary().totalLoc()).isZero();
        assertThat(result.summary().largestFiles()).isEmpty();
        assertThat(result.files()).isEmpty();
    }

    @Test
    void analyze_differentParallelism_producesIdenticalFiles() throws Exception {
        for (int i = 0; i < 40; i++) {
            createFile("pkg" + (i % 5) + "/file" + i + ".ts",
                codeLines(i % 7 + 1) + "function f" + i + "() {}\n");
        }

        AnalysisResult sequential = analyzer.analyze(tempDir, NO_CACHE.withParallelism(1));
        AnalysisResult parallel = analyzer.analyze(tempDir, NO_CACHE.withParallelism(8));

        assertThat(parallel.files()).isEqualTo(sequential.files());
        assertThat(parallel.summary()).isEqualTo(sequential.summary());
        assertThat(parallel.files()).extracting(FileMetrics::path).isSorted();
    }

    @Test
    void analyze_invalidUtf8File_isSkippedWithWarning() throws Exception {
        createFile("a.ts", codeLines(3));
        createFile("b.ts", new byte[]{'l', 'e', 't', ' ', (byte) 0xFF, (byte) 0xFE, '\n'});
        createFile("c.ts", codeLines(2));

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir, NO_CACHE);

        assertThat(report.result().summary().totalFiles()).isEqualTo(2);
        assertThat(report.result().files()).extracting(FileMetrics::path).containsExactly("a.ts", "c.ts");
        assertThat(report.warnings())
            .extracting(AnalysisWarning::path, AnalysisWarning::kind)
            .containsExactly(tuple("b.ts", WarningKind.UNREADABLE_ENCODING));
        assertThat(report.skippedPaths()).containsExactly("b.ts");
    }

    @Test
    void analyze_cachedRun_doesNotParseUnchangedFiles() throws Exception {
        createFile("a.ts", codeLines(4));
        Path b = createFile("b.ts", codeLines(6));
        AnalysisConfig config = AnalysisConfig.defaults();

        AnalysisResult first = analyzer.analyze(tempDir, config);
        int parsesAfterFirstRun = countingParser.parses.get();
        AnalysisResult second = analyzer.analyze(tempDir, config);

        assertThat(parsesAfterFirstRun).isEqualTo(2);
        assertThat(countingParser.parses.get()).isEqualTo(parsesAfterFirstRun);
        assertThat(second.files()).isEqualTo(first.files());
        assertThat(tempDir.resolve(".code-viz/cache")).isDirectory();

        Files.writeString(b, codeLines(8));
        setModified(b, Instant.now().plusSeconds(60));
        AnalysisResult third = analyzer.analyze(tempDir, config);

        assertThat(countingParser.parses.get()).isEqualTo(parsesAfterFirstRun + 1);
        assertThat(third.files()).extracting(FileMetrics::loc).containsExactly(4, 8);
    }

    @Test
    void analyze_cacheDisabled_parsesEveryRun() throws Exception {
        createFile("a.ts", codeLines(1));

        analyzer.analyze(tempDir, NO_CACHE);
        analyzer.analyze(tempDir, NO_CACHE);

        assertThat(countingParser.parses.get()).isEqualTo(2);
        assertThat(tempDir.resolve(".code-viz")).doesNotExist();
    }

    @Test
    void analyze_slowFile_timesOutWithoutStoppingRun() throws Exception {
        createFile("fast.ts", codeLines(2));
        createFile("slow.ts", "// SLOW\n" + codeLines(2));

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir,
            NO_CACHE.withParseTimeoutMillis(2_000).withParallelism(2));

        assertThat(report.result().files()).extracting(FileMetrics::path).containsExactly("fast.ts");
        assertThat(report.warnings())
            .extracting(AnalysisWarning::path, AnalysisWarning::kind)
            .containsExactly(tuple("slow.ts", WarningKind.TIMEOUT));
    }

    @Test
    void analyze_parserHonouringTimeLimit_releasesWorkerForQueuedFiles() throws Exception {
        createFile("a_stuck.ts", "// ABORT\n" + codeLines(2));
        createFile("b_fast.ts", codeLines(2));
        createFile("c_fast.ts", codeLines(3));

        long started = System.nanoTime();
        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir,
            NO_CACHE.withParseTimeoutMillis(300).withParallelism(1));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(report.result().files()).extracting(FileMetrics::path).containsExactly("b_fast.ts", "c_fast.ts");
        assertThat(report.warnings())
            .extracting(AnalysisWarning::path, AnalysisWarning::kind)
            .containsExactly(tuple("a_stuck.ts", WarningKind.TIMEOUT));
        assertThat(elapsedMillis).isLessThan(10_000);
    }

    @Test
    void analyze_hugeFile_isAbortedByEngineTimeLimit() throws Exception {
        createFile("a_huge.ts", "const value = [1, 2, 3].map(n => n * 2);\n".repeat(150_000));
        createFile("b_small.ts", codeLines(2));

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir,
            NO_CACHE.withParseTimeoutMillis(50).withParallelism(1));

        assertThat(report.result().files()).extracting(FileMetrics::path).containsExactly("b_small.ts");
        assertThat(report.warnings())
            .extracting(AnalysisWarning::path, AnalysisWarning::kind)
            .containsExactly(tuple("a_huge.ts", WarningKind.TIMEOUT));
    }

    @Test
    void analyze_lateResultAfterTimeout_isNeverCached() throws Exception {
        createFile("fast.ts", codeLines(2));
        createFile("slow.ts", "// SLOW\n" + codeLines(2));
        RecordingCache cache = new RecordingCache();

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir,
            AnalysisConfig.defaults().withParseTimeoutMillis(500).withParallelism(2), cache);
        assertThat(countingParser.slowParseReturned.await(30, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);

        assertThat(report.warnings()).extracting(AnalysisWarning::kind).containsExactly(WarningKind.TIMEOUT);
        assertThat(cache.written).containsExactly("fast.ts");
    }

    @Test
    void analyze_symlinkedRoot_analyzesLinkTarget() throws Exception {
        createFile("real/a.ts", codeLines(3));
        Path link = tempDir.resolve("link");
        assumeSymlinksSupported(link, tempDir.resolve("real"));

        AnalysisReport viaLink = analyzer.analyzeWithWarnings(link, AnalysisConfig.defaults());
        AnalysisResult viaTarget = analyzer.analyze(tempDir.resolve("real"), NO_CACHE);

        assertThat(viaLink.hasWarnings()).isFalse();
        assertThat(viaLink.result().files()).isEqualTo(viaTarget.files());
        assertThat(viaLink.result().summary().totalFiles()).isEqualTo(1);
        assertThat(tempDir.resolve("real/.code-viz/cache")).isDirectory();
    }

    @Test
    void analyze_parserFailure_isReportedAsParseFailure() throws Exception {
        createFile("ok.ts", codeLines(2));
        createFile("boom.ts", "// BOOM\n");

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir, NO_CACHE);

        assertThat(report.result().summary().totalFiles()).isEqualTo(1);
        assertThat(report.warnings()).singleElement()
            .satisfies(w -> {
                assertThat(w.path()).isEqualTo("boom.ts");
                assertThat(w.kind()).isEqualTo(WarningKind.PARSE_FAILURE);
            });
    }

    @Test
    void analyze_cacheWriteFailure_keepsMetricsAndWarns() throws Exception {
        createFile("a.ts", codeLines(3));
        MetricsCache failingCache = new MetricsCache() {
            @Override
            public Optional<FileMetrics> get(String path) {
                return Optional.empty();
            }

            @Override
            public void set(FileMetrics metrics) throws CacheException {
                throw new CacheException("disk full", new IOException("No space left on device"));
            }

            @Override
            public void invalidate(String path) {
            }

            @Override
            public void clear() {
            }
        };

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir, AnalysisConfig.defaults(), failingCache);

        assertThat(report.result().files()).extracting(FileMetrics::path).containsExactly("a.ts");
        assertThat(report.warnings()).extracting(AnalysisWarning::kind).containsExactly(WarningKind.CACHE_FAILURE);
        assertThat(report.skippedPaths()).isEmpty();
    }

    @Test
    void analyze_cacheEntryForStaleFile_isRecomputed() throws Exception {
        Path file = createFile("a.ts", codeLines(2));
        setModified(file, Instant.parse("2024-01-01T00:00:00Z"));
        DiskCache cache = new DiskCache(tempDir.toAbsolutePath().normalize(), tempDir.resolve("cache-dir"));
        cache.set(new FileMetrics("a.ts", "typescript", 999, 1, 0, Instant.parse("2023-01-01T00:00:00Z")));

        AnalysisReport report = analyzer.analyzeWithWarnings(tempDir, AnalysisConfig.defaults(), cache);

        assertThat(report.result().files()).singleElement()
            .satisfies(metrics -> assertThat(metrics.loc()).isEqualTo(2));
        assertThat(countingParser.parses.get()).isEqualTo(1);
    }

    @Test
    void analyze_missingRoot_throwsScanException() {
        Path missing = tempDir.resolve("nope");

        assertThatThrownBy(() -> analyzer.analyze(missing, NO_CACHE))
            .isInstanceOf(ScanException.class)
            .isInstanceOf(AnalysisException.class)
            .hasFieldOrPropertyWithValue("reason", ScanException.Reason.NOT_FOUND);
    }

    @Test
    void analyze_invalidPattern_throwsScanException() {
        assertThatThrownBy(() -> analyzer.analyze(tempDir, NO_CACHE.withExcludePatterns(List.of("{unclosed"))))
            .isInstanceOf(ScanException.class);
    }

    @Test
    void analyze_discoveredRegistry_handlesMixedLanguages() throws Exception {
        createFile("web/app.ts", "export const f = () => 1;\n");
        createFile("core/lib.rs", "// lib\nfn main() {}\n");
        createFile("tools/run.py", "def run():\n    pass\n");
        createFile("cmd/main.go", "package main\n\nfunc main() {}\n");
        createFile("native/x.cpp", "int x() { return 0; }\n");
        createFile("jvm/A.java", "class A { void m() {} }\n");
        createFile("docs/readme.md", "# not code\n");

        AnalysisResult result = new RepositoryAnalyzer().analyze(tempDir, NO_CACHE);

        assertThat(result.files())
            .extracting(FileMetrics::path, FileMetrics::language, FileMetrics::functionCount)
            .containsExactly(
                tuple("cmd/main.go", "go", 1),
                tuple("core/lib.rs", "rust", 1),
                tuple("jvm/A.java", "java", 1),
                tuple("native/x.cpp", "cpp", 1),
                tuple("tools/run.py", "python", 1),
                tuple("web/app.ts", "typescript", 1));
        assertThat(result.summary().totalLoc()).isEqualTo(8);
    }

    private static void assumeSymlinksSupported(Path link, Path target) throws IOException {
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
        }
    }

    /**
     * TypeScript parser that counts parses and reacts to marker comments:
     * {@code // SLOW} ignores the time limit and sleeps past it, {@code // ABORT}
     * gives up when the limit is reached, {@code // BOOM} fails.
     */
    private static final class CountingParser implements LanguageParser {

        private final TypeScriptParser delegate = new TypeScriptParser();
        private final AtomicInteger parses = new AtomicInteger();
        private final CountDownLatch slowParseReturned = new CountDownLatch(1);

        @Override
        public String getLanguage() {
            return delegate.getLanguage();
        }

        @Override
        public Set<String> getExtensions() {
            return delegate.getExtensions();
        }

        @Override
        public boolean isAvailable() {
            return delegate.isAvailable();
        }

        @Override
        public SyntaxTree parse(String source) {
            return parse(source, 0);
        }

        @Override
        public SyntaxTree parse(String source, long timeoutMillis) {
            parses.incrementAndGet();
            if (source.startsWith("// BOOM")) {
                throw new ParseException("engine failure");
            }
            if (source.startsWith("// ABORT")) {
                sleep(timeoutMillis > 0 ? timeoutMillis : 30_000);
                throw new ParseTimeoutException("aborted after " + timeoutMillis + " ms");
            }
            if (source.startsWith("// SLOW")) {
                sleep(30_000);
                try {
                    return delegate.parse(source, timeoutMillis);
                } finally {
                    slowParseReturned.countDown();
                }
            }
            return delegate.parse(source, timeoutMillis);
        }

        @Override
        public List<SourceRange> findCommentRanges(SyntaxTree tree) {
            return delegate.findCommentRanges(tree);
        }

        @Override
        public int countFunctions(SyntaxTree tree) {
            return delegate.countFunctions(tree);
        }

        private static void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Cache that records writes and never hits.
     */
    private static final class RecordingCache implements MetricsCache {

        private final List<String> written = new CopyOnWriteArrayList<>();

        @Override
        public Optional<FileMetrics> get(String path) {
            return Optional.empty();
        }

        @Override
        public void set(FileMetrics metrics) {
            written.add(metrics.path());
        }

        @Override
        public void invalidate(String path) {
        }

        @Override
        public void clear() {
        }
    }
}

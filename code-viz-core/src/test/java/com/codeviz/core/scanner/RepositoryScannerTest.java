package com.codeviz.core.scanner;

import com.codeviz.core.RepositoryTestBase;
import com.codeviz.core.config.AnalysisConfig;
import com.codeviz.core.model.AnalysisWarning;
import com.codeviz.core.model.WarningKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Functional tests for {@link RepositoryScanner}.
 */
class RepositoryScannerTest extends RepositoryTestBase {

    private final RepositoryScanner scanner = new RepositoryScanner(Set.of("ts", "rs", "py"));

    @Test
    void scan_nestedFiles_returnsSortedRelativePaths() throws Exception {
        createFile("src/z.ts", "");
        createFile("b.ts", "");
        createFile("src/a/deep.rs", "");
        createFile("a.py", "");

        ScanResult result = scanner.scan(tempDir, List.of());

        assertThat(result.relativePaths()).containsExactly("a.py", "b.ts", "src/a/deep.rs", "src/z.ts");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scan_repeated_returnsIdenticalOrder() throws Exception {
        for (int i = 0; i < 30; i++) {
            createFile("dir" + (i % 4) + "/file" + i + ".ts", "");
        }

        List<String> first = scanner.scan(tempDir, List.of()).relativePaths();
        List<String> second = scanner.scan(tempDir, List.of()).relativePaths();

        assertThat(first).hasSize(30).isSorted().isEqualTo(second);
    }

    @Test
    void scan_unsupportedExtensions_areIgnored() throws Exception {
        createFile("README.md", "# readme");
        createFile("main.go", "package main");
        createFile("App.TS", "");

        ScanResult result = scanner.scan(tempDir, List.of());

        assertThat(result.relativePaths()).containsExactly("App.TS");
    }

    @Test
    void scan_excludePattern_prunesSubtree() throws Exception {
        createFile("a.ts", "");
        createFile("excluded/c.ts", "");
        createFile("excluded/nested/d.ts", "");

        ScanResult result = scanner.scan(tempDir, List.of("excluded/**"));

        assertThat(result.relativePaths()).containsExactly("a.ts");
    }

    @Test
    void scan_excludedUnreadableDirectory_isNeverOpened() throws Exception {
        createFile("a.ts", "");
        Path locked = createDirectory("excluded");
        createFile("excluded/c.ts", "");
        assumeTrue(setPermissions(locked, "---------"));
        try {
            assumeFalse(Files.isReadable(locked), "running with privileges that ignore permissions");

            ScanResult result = scanner.scan(tempDir, List.of("excluded/**"));

            assertThat(result.relativePaths()).containsExactly("a.ts");
            assertThat(result.warnings()).isEmpty();
        } finally {
            setPermissions(locked, "rwxr-xr-x");
        }
    }

    @Test
    void scan_unreadableDirectory_reportsPermissionWarning() throws Exception {
        createFile("a.ts", "");
        Path locked = createDirectory("locked");
        createFile("locked/b.ts", "");
        assumeTrue(setPermissions(locked, "---------"));
        try {
            assumeFalse(Files.isReadable(locked), "running with privileges that ignore permissions");

            ScanResult result = scanner.scan(tempDir, List.of());

            assertThat(result.relativePaths()).containsExactly("a.ts");
            assertThat(result.warnings())
                .extracting(AnalysisWarning::path, AnalysisWarning::kind)
                .containsExactly(tuple("locked", WarningKind.PERMISSION_DENIED));
        } finally {
            setPermissions(locked, "rwxr-xr-x");
        }
    }

    @Test
    void scan_defaultExcludes_skipDependencyAndBuildDirectories() throws Exception {
        createFile("src/app.ts", "");
        createFile("node_modules/lib/index.ts", "");
        createFile("web/node_modules/lib/index.ts", "");
        createFile("target/gen.ts", "");
        createFile("dist/bundle.ts", "");

        ScanResult result = scanner.scan(tempDir, AnalysisConfig.defaults());

        assertThat(result.relativePaths()).containsExactly("src/app.ts");
    }

    @Test
    void scan_hiddenEntries_areSkipped() throws Exception {
        createFile(".hidden/a.ts", "");
        createFile(".eslintrc.ts", "");
        createFile("visible.ts", "");

        ScanResult result = scanner.scan(tempDir, List.of());

        assertThat(result.relativePaths()).containsExactly("visible.ts");
    }

    @Test
    void scan_gitignore_excludesMatchingEntries() throws Exception {
        createFile(".gitignore", "generated/\n*.gen.ts\n");
        createFile("web/.gitignore", "/local.ts\n");
        createFile("generated/a.ts", "");
        createFile("src/b.gen.ts", "");
        createFile("src/c.ts", "");
        createFile("web/local.ts", "");
        createFile("web/src/local.ts", "");

        ScanResult result = scanner.scan(tempDir, AnalysisConfig.defaults().withExcludePatterns(List.of()));

        assertThat(result.relativePaths()).containsExactly("src/c.ts", "web/src/local.ts");
    }

    @Test
    void scan_gitignoreDisabled_listsEverything() throws Exception {
        createFile(".gitignore", "*.ts\n");
        createFile("a.ts", "");

        ScanResult result = scanner.scan(tempDir, AnalysisConfig.defaults().withRespectGitignore(false));

        assertThat(result.relativePaths()).containsExactly("a.ts");
    }

    @Test
    void scan_fileOverSizeLimit_isSkippedWithWarning() throws Exception {
        createFile("small.ts", "let a = 1;");
        createFile("big.ts", "x".repeat(2048));

        ScanResult result = scanner.scan(tempDir, AnalysisConfig.defaults().withMaxFileSizeBytes(1024));

        assertThat(result.relativePaths()).containsExactly("small.ts");
        assertThat(result.warnings()).singleElement()
            .satisfies(w -> {
                assertThat(w.path()).isEqualTo("big.ts");
                assertThat(w.kind()).isEqualTo(WarningKind.FILE_TOO_LARGE);
            });
    }

    @Test
    void scan_symlinks_areNotFollowed() throws Exception {
        Path outside = Files.createTempDirectory("code-viz-outside");
        Files.writeString(outside.resolve("linked.ts"), "");
        createFile("real.ts", "");
        try {
            Files.createSymbolicLink(tempDir.resolve("linkdir"), outside);
            Files.createSymbolicLink(tempDir.resolve("link.ts"), tempDir.resolve("real.ts"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
        }

        ScanResult result = scanner.scan(tempDir, List.of());

        assertThat(result.relativePaths()).containsExactly("real.ts");
    }

    @Test
    void scan_rootIsSymlink_walksLinkTarget() throws Exception {
        createFile("project/src/a.ts", "");
        createFile("project/b.rs", "");
        Path link = tempDir.resolve("project-link");
        try {
            Files.createSymbolicLink(link, tempDir.resolve("project"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
        }

        ScanResult result = scanner.scan(link, List.of());

        assertThat(result.relativePaths()).containsExactly("b.rs", "src/a.ts");
        assertThat(result.root()).isEqualTo(tempDir.resolve("project").toRealPath());
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scan_emptyRoot_returnsNoFiles() throws Exception {
        ScanResult result = scanner.scan(tempDir, List.of());

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scan_missingRoot_throwsNotFound() {
        Path missing = tempDir.resolve("does-not-exist");

        assertThatThrownBy(() -> scanner.scan(missing, List.of()))
            .isInstanceOf(ScanException.class)
            .satisfies(e -> assertThat(((ScanException) e).getReason()).isEqualTo(ScanException.Reason.NOT_FOUND));
    }

    @Test
    void scan_fileAsRoot_throwsNotADirectory() throws Exception {
        Path file = createFile("a.ts", "");

        assertThatThrownBy(() -> scanner.scan(file, List.of()))
            .isInstanceOf(ScanException.class)
            .satisfies(e -> assertThat(((ScanException) e).getReason())
                .isEqualTo(ScanException.Reason.NOT_A_DIRECTORY));
    }

    @Test
    void scan_invalidPattern_throwsBeforeWalking() {
        assertThatThrownBy(() -> scanner.scan(tempDir, List.of("src/[oops")))
            .isInstanceOf(ScanException.class)
            .satisfies(e -> assertThat(((ScanException) e).getReason())
                .isEqualTo(ScanException.Reason.INVALID_PATTERN));
    }

    private static boolean setPermissions(Path path, String permissions) {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(permissions));
            return true;
        } catch (UnsupportedOperationException | IOException e) {
            return false;
        }
    }
}

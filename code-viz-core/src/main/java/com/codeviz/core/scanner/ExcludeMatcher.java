package com.codeviz.core.scanner;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiled set of exclusion globs, matched against root-relative paths.
 *
 * <p>Patterns use the platform glob syntax ({@code *}, {@code ?}, {@code **},
 * {@code [...]}, {@code {a,b}}), with three differences so that patterns behave as
 * users expect:
 * <ul>
 *   <li>{@code *} also crosses directory separators, so {@code *.min.js} excludes
 *       minified files at any depth</li>
 *   <li>a leading {@code **&#47;} also matches at the root ({@code **&#47;node_modules/**}
 *       matches {@code node_modules})</li>
 *   <li>a trailing {@code /**} also matches the directory itself, so the whole
 *       subtree can be pruned before it is opened</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ExcludeMatcher {

    private static final String ANY_PREFIX = "**/";
    private static final String ANY_SUFFIX = "/**";

    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    private ExcludeMatcher(List<String> patterns, List<PathMatcher> matchers) {
        this.patterns = patterns;
        this.matchers = matchers;
    }

    /**
     * Compiles the given patterns.
     *
     * @param patterns glob patterns, may be empty
     * @return compiled matcher
     * @throws ScanException with reason {@code INVALID_PATTERN} if any pattern is malformed
     */
    public static ExcludeMatcher compile(List<String> patterns) throws ScanException {
        FileSystem fileSystem = FileSystems.getDefault();
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                for (String variant : expand(pattern)) {
                    matchers.add(fileSystem.getPathMatcher("glob:" + crossSeparators(variant)));
                }
            } catch (IllegalArgumentException e) {
                throw new ScanException(ScanException.Reason.INVALID_PATTERN,
                    "Invalid exclude pattern '" + pattern + "': " + e.getMessage(), e);
            }
        }
        return new ExcludeMatcher(List.copyOf(patterns), List.copyOf(matchers));
    }

    /**
     * Matcher that excludes nothing.
     *
     * @return empty matcher
     */
    public static ExcludeMatcher none() {
        return new ExcludeMatcher(List.of(), List.of());
    }

    /**
     * Tests a root-relative path.
     *
     * @param relativePath path relative to the scan root
     * @return true if any pattern matches
     */
    public boolean matches(Path relativePath) {
        if (relativePath.toString().isEmpty()) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * Expands one pattern into the globs that together implement the
     * leading-{@code **&#47;} and trailing-{@code /**} rules.
     */
    static Set<String> expand(String pattern) {
        String normalized = pattern.strip();
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("pattern is empty");
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(normalized);
        if (normalized.startsWith(ANY_PREFIX) && normalized.length() > ANY_PREFIX.length()) {
            variants.add(normalized.substring(ANY_PREFIX.length()));
        }
        List<String> current = new ArrayList<>(variants);
        for (String variant : current) {
            if (variant.endsWith(ANY_SUFFIX) && variant.length() > ANY_SUFFIX.length()) {
                variants.add(variant.substring(0, variant.length() - ANY_SUFFIX.length()));
            }
        }
        return variants;
    }

    /**
     * Rewrites every {@code *} outside a character class as {@code **}, the platform
     * wildcard that matches across {@code /}.
     */
    static String crossSeparators(String glob) {
        StringBuilder out = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                out.append(c).append(glob.charAt(++i));
            } else if (inClass) {
                out.append(c);
                inClass = c != ']';
            } else if (c == '[') {
                out.append(c);
                inClass = true;
            } else if (c == '*') {
                while (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    i++;
                }
                out.append("**");
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}

package com.codeviz.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Rules read from one {@code .gitignore} file, scoped to the directory that contains it.
 *
 * <p>Supported syntax: blank lines and {@code #} comments are ignored, {@code !}
 * re-includes, a trailing {@code /} restricts the rule to directories, and a
 * leading or embedded {@code /} anchors the pattern to the rule's directory.
 * Unanchored patterns are matched against the entry name at any depth.
 *
 * @since 1.0.0
 */
public final class GitIgnoreRules {

    private static final Logger log = LoggerFactory.getLogger(GitIgnoreRules.class);

    /** File name the scanner looks for in every directory. */
    public static final String FILE_NAME = ".gitignore";

    /**
     * Outcome of testing an entry against a rule set.
     */
    public enum Verdict {
        /** No rule matched; an outer rule set decides. */
        NONE,
        IGNORED,
        /** Matched by a negated rule. */
        INCLUDED
    }

    private record Rule(PathMatcher matcher, boolean negated, boolean directoryOnly, boolean anchored) {
    }

    private final Path baseDirectory;
    private final List<Rule> rules;

    private GitIgnoreRules(Path baseDirectory, List<Rule> rules) {
        this.baseDirectory = baseDirectory;
        this.rules = rules;
    }

    /**
     * Parses the lines of a {@code .gitignore} file.
     *
     * @param baseDirectory directory of the file, relative to the scan root (empty path for the root)
     * @param lines file content
     * @return parsed rules; malformed lines are logged and dropped
     */
    public static GitIgnoreRules parse(Path baseDirectory, List<String> lines) {
        FileSystem fileSystem = FileSystems.getDefault();
        List<Rule> rules = new ArrayList<>();
        for (String rawLine : lines) {
            String line = stripTrailingSpaces(rawLine);
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            boolean negated = false;
            if (line.startsWith("!")) {
                negated = true;
                line = line.substring(1);
            } else if (line.startsWith("\\#") || line.startsWith("\\!")) {
                line = line.substring(1);
            }

            boolean directoryOnly = false;
            if (line.endsWith("/")) {
                directoryOnly = true;
                line = line.substring(0, line.length() - 1);
            }

            boolean anchored = line.contains("/");
            if (line.startsWith("/")) {
                line = line.substring(1);
            }
            if (line.isEmpty()) {
                continue;
            }

            try {
                PathMatcher matcher = fileSystem.getPathMatcher("glob:" + line);
                rules.add(new Rule(matcher, negated, directoryOnly, anchored));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring malformed pattern '{}' in {}/{}: {}",
                    rawLine, baseDirectory, FILE_NAME, e.getDescription());
            }
        }
        return new GitIgnoreRules(baseDirectory, List.copyOf(rules));
    }

    /**
     * Tests a root-relative entry. Later rules override earlier ones.
     *
     * @param relativePath entry path relative to the scan root
     * @param directory whether the entry is a directory
     * @return verdict of the last matching rule, or {@link Verdict#NONE}
     */
    public Verdict evaluate(Path relativePath, boolean directory) {
        boolean atRoot = baseDirectory.toString().isEmpty();
        if (rules.isEmpty() || (!atRoot && !relativePath.startsWith(baseDirectory))) {
            return Verdict.NONE;
        }
        Path local = atRoot ? relativePath : baseDirectory.relativize(relativePath);
        Path name = local.getFileName();
        if (name == null) {
            return Verdict.NONE;
        }

        Verdict verdict = Verdict.NONE;
        for (Rule rule : rules) {
            if (rule.directoryOnly() && !directory) {
                continue;
            }
            boolean matched = rule.anchored() ? rule.matcher().matches(local) : rule.matcher().matches(name);
            if (matched) {
                verdict = rule.negated() ? Verdict.INCLUDED : Verdict.IGNORED;
            }
        }
        return verdict;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    private static String stripTrailingSpaces(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}

package com.codeviz.core.metrics;

import com.codeviz.core.model.FileMetrics;
import com.codeviz.core.parser.LanguageParser;
import com.codeviz.core.parser.SourceRange;
import com.codeviz.core.parser.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Computes {@link FileMetrics} for one file.
 *
 * <p>Pure with respect to I/O: the content and metadata arrive in a {@link SourceFile}.
 * Files with syntax errors are still measured from the engine's best-effort tree.
 *
 * @since 1.0.0
 */
public class MetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(MetricsCalculator.class);

    /**
     * Measures a file.
     *
     * @param path root-relative path to record in the result
     * @param source content and metadata
     * @param parser parser for the file's language
     * @return metrics
     * @throws MetricsException if the parser cannot produce a tree
     */
    public FileMetrics calculate(String path, SourceFile source, LanguageParser parser) throws MetricsException {
        return calculate(path, source, parser, 0);
    }

    /**
     * Measures a file, asking the parser to abort once {@code timeoutMillis} is spent.
     *
     * @param path root-relative path to record in the result
     * @param source content and metadata
     * @param parser parser for the file's language
     * @param timeoutMillis parse time limit; {@code 0} means none
     * @return metrics
     * @throws MetricsException with reason {@code TIMED_OUT} if the parser aborted,
     *         {@code PARSE_FAILED} if it cannot produce a tree
     */
    public FileMetrics calculate(String path, SourceFile source, LanguageParser parser, long timeoutMillis)
            throws MetricsException {
        SyntaxTree tree;
        List<SourceRange> comments;
        int functionCount;
        try {
            tree = parser.parse(source.content(), timeoutMillis);
            comments = parser.findCommentRanges(tree);
            functionCount = parser.countFunctions(tree);
        } catch (LanguageParser.ParseTimeoutException e) {
            throw new MetricsException(path, MetricsException.Reason.TIMED_OUT,
                "Parsing " + path + " was aborted: " + e.getMessage(), e);
        } catch (LanguageParser.ParseException e) {
            throw new MetricsException(path, MetricsException.Reason.PARSE_FAILED,
                "Failed to parse " + path + ": " + e.getMessage(), e);
        }

        if (tree.hasErrors()) {
            log.debug("{} has syntax errors; measuring recovered tree", path);
        }

        int loc = LineCounter.countCodeLines(source.content(), comments);
        return new FileMetrics(
            path,
            parser.getLanguage(),
            loc,
            source.sizeBytes(),
            functionCount,
            source.lastModified()
        );
    }
}

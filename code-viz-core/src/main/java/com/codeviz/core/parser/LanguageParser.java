package com.codeviz.core.parser;

import java.util.List;
import java.util.Set;

/**
 * Language-aware syntax analyzer used by the metrics calculator.
 *
 * <p>Each supported language has one implementation, registered through
 * {@link java.util.ServiceLoader} under
 * {@code META-INF/services/com.codeviz.core.parser.LanguageParser}. Adding a language
 * means adding an implementation and a service entry; nothing else changes.
 *
 * <p><b>Thread Safety:</b></p>
 * <p>Implementations are shared by all worker threads of an analysis run. Parsing
 * engines that are not thread-safe must be held per thread (see
 * {@link com.codeviz.core.parser.base.AbstractTreeSitterParser}). A {@link SyntaxTree}
 * is only queried on the thread that produced it.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * LanguageParser parser = registry.getParser("typescript");
 * SyntaxTree tree = parser.parse(source);
 * List<SourceRange> comments = parser.findCommentRanges(tree);
 * int functions = parser.countFunctions(tree);
 * }</pre>
 *
 * @see ParserRegistry
 * @since 1.0.0
 */
public interface LanguageParser {

    /**
     * Gets the language this parser supports.
     *
     * @return language tag (e.g., "typescript", "rust", "java")
     */
    String getLanguage();

    /**
     * Gets the file extensions handled by this parser.
     *
     * @return lower-case extensions without the leading dot
     */
    Set<String> getExtensions();

    /**
     * Alternative names that resolve to this parser's language.
     *
     * @return lower-case aliases, possibly empty
     */
    default Set<String> getAliases() {
        return Set.of();
    }

    /**
     * Checks if this parser can be used (i.e., its engine loads on this platform).
     *
     * @return true if parser is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Parses source text.
     *
     * <p>Syntax errors do not fail the parse: the engine returns a best-effort tree
     * and {@link SyntaxTree#hasErrors()} reports them.
     *
     * @param source complete file content
     * @return syntax tree
     * @throws ParseException if the engine cannot produce a tree at all
     */
    SyntaxTree parse(String source);

    /**
     * Parses source text, giving up once the time limit is spent.
     *
     * <p>Engines that can abort a parse override this. The default parses without a
     * limit; callers that need a hard bound must enforce it themselves.
     *
     * @param source complete file content
     * @param timeoutMillis time limit in milliseconds; {@code 0} means none
     * @return syntax tree
     * @throws ParseTimeoutException if the engine aborted the parse at the limit
     * @throws ParseException if the engine cannot produce a tree at all
     */
    default SyntaxTree parse(String source, long timeoutMillis) {
        return parse(source);
    }

    /**
     * Finds every comment in a tree produced by this parser.
     *
     * @param tree tree returned by {@link #parse(String)}
     * @return comment ranges ordered by position
     */
    List<SourceRange> findCommentRanges(SyntaxTree tree);

    /**
     * Counts function and method definitions, including anonymous ones where the
     * language has them.
     *
     * @param tree tree returned by {@link #parse(String)}
     * @return number of functions
     */
    int countFunctions(SyntaxTree tree);

    /**
     * Exception thrown when a parsing engine fails to produce a tree.
     */
    class ParseException extends RuntimeException {
        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public ParseException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a parse was aborted because it reached its time limit.
     */
    class ParseTimeoutException extends ParseException {
        public ParseTimeoutException(String message) {
            super(message);
        }
    }
}

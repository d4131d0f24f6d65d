package com.codeviz.core.parser.base;

import com.codeviz.core.parser.LanguageParser;
import com.codeviz.core.parser.SourceRange;
import com.codeviz.core.parser.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCapture;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;
import org.treesitter.TSTree;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Base class for parsers backed by a tree-sitter grammar.
 *
 * <p>Subclasses supply the grammar and two queries: one capturing comment nodes,
 * one capturing function nodes. Every capture counts, so a query should list each
 * node type once.
 *
 * <p><b>Thread Safety:</b></p>
 * <p>{@link TSParser} and {@link TSQuery} are not thread-safe. Each worker thread gets
 * its own parser and compiled queries, created on first use and reused for every
 * file that thread parses.</p>
 *
 * @since 1.0.0
 */
public abstract class AbstractTreeSitterParser implements LanguageParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    private final ThreadLocal<TSLanguage> threadLanguage = ThreadLocal.withInitial(this::createLanguage);
    private final ThreadLocal<TSParser> threadParser = ThreadLocal.withInitial(this::createParser);
    private final ThreadLocal<TSQuery> threadCommentQuery =
        ThreadLocal.withInitial(() -> compileQuery("comment", getCommentQuery()));
    private final ThreadLocal<TSQuery> threadFunctionQuery =
        ThreadLocal.withInitial(() -> compileQuery("function", getFunctionQuery()));

    protected AbstractTreeSitterParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Creates the grammar. Called once per thread.
     *
     * @return tree-sitter language
     */
    protected abstract TSLanguage createLanguage();

    /**
     * @return query whose captures are comment nodes
     */
    protected abstract String getCommentQuery();

    /**
     * @return query whose captures are function nodes
     */
    protected abstract String getFunctionQuery();

    @Override
    public boolean isAvailable() {
        try {
            threadParser.get();
            threadCommentQuery.get();
            threadFunctionQuery.get();
            return true;
        } catch (ParseException | LinkageError e) {
            log.warn("{} parser not available: {}", getLanguage(), e.getMessage());
            return false;
        }
    }

    @Override
    public SyntaxTree parse(String source) {
        return parse(source, 0);
    }

    /**
     * Parses with the engine's own time limit, so a pathological file releases its
     * worker thread instead of holding it until the parse ends.
     */
    @Override
    public SyntaxTree parse(String source, long timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis must not be negative: " + timeoutMillis);
        }
        TSTree tree;
        try {
            TSParser parser = threadParser.get();
            parser.setTimeoutMicros(TimeUnit.MILLISECONDS.toMicros(timeoutMillis));
            tree = parser.parseString(null, source);
        } catch (LinkageError e) {
            throw new ParseException("Tree-sitter engine for " + getLanguage() + " failed to load", e);
        }
        if (tree == null) {
            if (timeoutMillis > 0) {
                // an aborted parser resumes the old parse on its next call, start over instead
                threadParser.remove();
                throw new ParseTimeoutException(
                    "Tree-sitter " + getLanguage() + " parse exceeded " + timeoutMillis + " ms");
            }
            throw new ParseException("Tree-sitter produced no tree for " + getLanguage() + " source");
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new ParseException("Tree-sitter produced an empty tree for " + getLanguage() + " source");
        }
        return new TreeSitterSyntaxTree(getLanguage(), source, tree, root);
    }

    @Override
    public List<SourceRange> findCommentRanges(SyntaxTree tree) {
        TreeSitterSyntaxTree syntaxTree = requireOwnTree(tree);
        List<SourceRange> ranges = new ArrayList<>();
        forEachCapture(threadCommentQuery.get(), syntaxTree, node -> ranges.add(syntaxTree.toRange(node)));
        ranges.sort(SourceRange.BY_START);
        return ranges;
    }

    @Override
    public int countFunctions(SyntaxTree tree) {
        TreeSitterSyntaxTree syntaxTree = requireOwnTree(tree);
        int[] count = {0};
        forEachCapture(threadFunctionQuery.get(), syntaxTree, node -> count[0]++);
        return count[0];
    }

    private void forEachCapture(TSQuery query, TreeSitterSyntaxTree tree, Consumer<TSNode> action) {
        TSQueryCursor cursor = new TSQueryCursor();
        cursor.exec(query, tree.getRootNode());
        TSQueryMatch match = new TSQueryMatch();
        while (cursor.nextMatch(match)) {
            for (TSQueryCapture capture : match.getCaptures()) {
                TSNode node = capture.getNode();
                if (node != null && !node.isNull()) {
                    action.accept(node);
                }
            }
        }
    }

    private TreeSitterSyntaxTree requireOwnTree(SyntaxTree tree) {
        if (tree instanceof TreeSitterSyntaxTree syntaxTree && getLanguage().equals(syntaxTree.getLanguage())) {
            return syntaxTree;
        }
        throw new IllegalArgumentException("Tree was not produced by the " + getLanguage() + " parser");
    }

    private TSParser createParser() {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(threadLanguage.get())) {
            throw new ParseException("Incompatible tree-sitter grammar for " + getLanguage());
        }
        log.debug("Created {} tree-sitter parser for thread {}", getLanguage(), Thread.currentThread().getName());
        return parser;
    }

    private TSQuery compileQuery(String kind, String source) {
        try {
            return new TSQuery(threadLanguage.get(), source);
        } catch (RuntimeException e) {
            throw new ParseException("Invalid " + kind + " query for " + getLanguage() + ": " + source, e);
        }
    }
}

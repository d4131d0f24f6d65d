package com.codeviz.core.parser.impl.javascript;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterTypescript;

import java.util.Set;

/**
 * TypeScript with JSX ({@code .tsx}).
 *
 * <p>No published grammar artifact ships the TSX dialect, so these files are parsed
 * with the TypeScript grammar. Type annotations, functions and comments are
 * recognised as in {@code .ts}; JSX elements come out as error nodes, which
 * {@link com.codeviz.core.parser.SyntaxTree#hasErrors()} reports and which may hide
 * functions nested inside markup.
 *
 * @since 1.0.0
 */
public class TsxParser extends AbstractTreeSitterParser {

    @Override
    public String getLanguage() {
        return Languages.TSX;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("tsx");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterTypescript();
    }

    @Override
    protected String getCommentQuery() {
        return TypeScriptParser.COMMENT_QUERY;
    }

    @Override
    protected String getFunctionQuery() {
        return TypeScriptParser.FUNCTION_QUERY;
    }
}

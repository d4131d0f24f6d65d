package com.codeviz.core.parser.impl.javascript;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterTypescript;

import java.util.Set;

/**
 * TypeScript parser ({@code .ts}, {@code .mts}, {@code .cts}).
 *
 * <p>Counts function declarations, arrow functions and class or object methods.
 *
 * @since 1.0.0
 */
public class TypeScriptParser extends AbstractTreeSitterParser {

    /** Shared by the JavaScript family of grammars. */
    static final String FUNCTION_QUERY = """
        (function_declaration) @function
        (arrow_function) @function
        (method_definition) @function
        """;

    static final String COMMENT_QUERY = "(comment) @comment";

    @Override
    public String getLanguage() {
        return Languages.TYPESCRIPT;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("ts", "mts", "cts");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("ts");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterTypescript();
    }

    @Override
    protected String getCommentQuery() {
        return COMMENT_QUERY;
    }

    @Override
    protected String getFunctionQuery() {
        return FUNCTION_QUERY;
    }
}

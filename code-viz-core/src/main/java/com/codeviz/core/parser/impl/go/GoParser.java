package com.codeviz.core.parser.impl.go;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterGo;

import java.util.Set;

/**
 * Go parser ({@code .go}). Counts functions, methods and function literals.
 *
 * @since 1.0.0
 */
public class GoParser extends AbstractTreeSitterParser {

    @Override
    public String getLanguage() {
        return Languages.GO;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("go");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("golang");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterGo();
    }

    @Override
    protected String getCommentQuery() {
        return "(comment) @comment";
    }

    @Override
    protected String getFunctionQuery() {
        return """
            (function_declaration) @function
            (method_declaration) @function
            (func_literal) @function
            """;
    }
}

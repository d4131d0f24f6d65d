package com.codeviz.core.parser.impl.javascript;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;

import java.util.Set;

/**
 * JavaScript parser, JSX included ({@code .js}, {@code .jsx}, {@code .mjs}, {@code .cjs}).
 *
 * @since 1.0.0
 */
public class JavaScriptParser extends AbstractTreeSitterParser {

    @Override
    public String getLanguage() {
        return Languages.JAVASCRIPT;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("js", "jsx", "mjs", "cjs");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("js", "jsx");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterJavascript();
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

package com.codeviz.core.parser.impl.rust;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterRust;

import java.util.Set;

/**
 * Rust parser ({@code .rs}). Free functions, methods and trait default methods are
 * all {@code function_item} nodes; closures are not counted.
 *
 * @since 1.0.0
 */
public class RustParser extends AbstractTreeSitterParser {

    @Override
    public String getLanguage() {
        return Languages.RUST;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("rs");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("rs");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterRust();
    }

    @Override
    protected String getCommentQuery() {
        return """
            (line_comment) @comment
            (block_comment) @comment
            """;
    }

    @Override
    protected String getFunctionQuery() {
        return "(function_item) @function";
    }
}

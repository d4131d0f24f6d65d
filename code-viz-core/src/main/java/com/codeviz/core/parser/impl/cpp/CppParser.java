package com.codeviz.core.parser.impl.cpp;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCpp;

import java.util.Set;

/**
 * C++ parser. Headers ({@code .h}, {@code .hpp}, {@code .hh}) go through the same
 * grammar, so plain C headers are parsed as C++.
 *
 * <p>Only definitions (declarations with a body) are counted; prototypes are not.
 *
 * @since 1.0.0
 */
public class CppParser extends AbstractTreeSitterParser {

    @Override
    public String getLanguage() {
        return Languages.CPP;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("cpp", "cc", "cxx", "hpp", "hh", "h");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("c++", "cc", "cxx", "hpp", "h");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterCpp();
    }

    @Override
    protected String getCommentQuery() {
        return "(comment) @comment";
    }

    @Override
    protected String getFunctionQuery() {
        return "(function_definition) @function";
    }
}

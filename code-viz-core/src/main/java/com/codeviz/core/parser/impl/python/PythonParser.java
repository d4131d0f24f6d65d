package com.codeviz.core.parser.impl.python;

import com.codeviz.core.parser.base.AbstractTreeSitterParser;
import com.codeviz.core.util.Languages;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

import java.util.Set;

/**
 * Python parser ({@code .py}).
 *
 * <p>Docstrings are string expressions, not comments, so they count as code.
 * Lambdas are not counted as functions.
 *
 * @since 1.0.0
 */
public class PythonParser extends AbstractTreeSitterParser {

    @Override
    public String getLanguage() {
        return Languages.PYTHON;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("py");
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("py");
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterPython();
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

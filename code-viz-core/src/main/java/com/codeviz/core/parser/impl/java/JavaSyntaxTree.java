package com.codeviz.core.parser.impl.java;

import com.codeviz.core.parser.SyntaxTree;
import com.codeviz.core.util.Languages;
import com.github.javaparser.ast.CompilationUnit;

/**
 * JavaParser compilation unit; {@code hasErrors} is set when JavaParser recovered
 * from problems.
 *
 * @param compilationUnit parsed unit
 * @param source parsed text
 * @param hasErrors whether parse problems were reported
 */
record JavaSyntaxTree(
    CompilationUnit compilationUnit,
    String source,
    boolean hasErrors
) implements SyntaxTree {

    @Override
    public String getLanguage() {
        return Languages.JAVA;
    }

    @Override
    public String getSource() {
        return source;
    }
}

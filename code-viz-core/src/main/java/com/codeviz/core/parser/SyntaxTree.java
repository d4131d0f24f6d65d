package com.codeviz.core.parser;

/**
 * Result of parsing one file: an engine-specific tree that the producing
 * {@link LanguageParser} can query for comments and functions.
 *
 * @since 1.0.0
 */
public interface SyntaxTree {

    /**
     * @return language tag of the parser that produced the tree
     */
    String getLanguage();

    /**
     * @return the parsed source text
     */
    String getSource();

    /**
     * Whether the engine had to recover from syntax errors.
     *
     * @return true if the tree contains error nodes
     */
    boolean hasErrors();
}

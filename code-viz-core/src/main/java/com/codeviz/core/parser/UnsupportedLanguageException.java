package com.codeviz.core.parser;

/**
 * Thrown when no registered parser handles a language or file extension.
 *
 * @since 1.0.0
 */
public class UnsupportedLanguageException extends RuntimeException {

    private final String language;

    public UnsupportedLanguageException(String language) {
        super("Unsupported language: " + language);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}

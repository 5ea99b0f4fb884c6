package com.umlcodegen.core.generator;

import java.util.Collection;

/**
 * Thrown when a language key matches no registered generator.
 */
public class UnsupportedLanguageException extends IllegalArgumentException {

    private final String language;

    public UnsupportedLanguageException(String language, Collection<String> supported) {
        super("Unsupported language: '" + language + "'. Supported languages: " + String.join(", ", supported));
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}

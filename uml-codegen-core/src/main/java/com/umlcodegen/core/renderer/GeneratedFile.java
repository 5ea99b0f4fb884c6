package com.umlcodegen.core.renderer;

import java.util.Objects;

/**
 * Represents a generated source file to be rendered.
 *
 * @param relativePath relative path for the file (e.g., "java/model.java")
 * @param content file content
 * @param language language key of the generator that produced the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String language
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}

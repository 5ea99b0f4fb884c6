package com.umlcodegen.core.model;

import java.util.Objects;

/**
 * Input line that contributed nothing to the parsed diagram.
 *
 * @param lineNumber 1-based line number in the original input
 * @param text trimmed line text
 * @param reason short reason, e.g. "unrecognized line"
 */
public record SkippedLine(
    int lineNumber,
    String text,
    String reason
) {
    /**
     * Compact constructor with validation.
     */
    public SkippedLine {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}

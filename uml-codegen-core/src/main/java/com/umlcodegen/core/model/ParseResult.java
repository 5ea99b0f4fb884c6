package com.umlcodegen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Parsed diagram together with the lines the parser could not use.
 *
 * @param diagram parsed diagram
 * @param skippedLines skipped lines in input order
 */
public record ParseResult(
    ClassDiagram diagram,
    List<SkippedLine> skippedLines
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(diagram, "diagram must not be null");
        skippedLines = skippedLines == null ? List.of() : List.copyOf(skippedLines);
    }

    /**
     * Returns whether every non-blank line was used.
     *
     * @return true if nothing was skipped
     */
    public boolean isClean() {
        return skippedLines.isEmpty();
    }

    /**
     * Returns the line numbers of the skipped lines.
     *
     * @return 1-based line numbers
     */
    public List<Integer> skippedLineNumbers() {
        return skippedLines.stream().map(SkippedLine::lineNumber).toList();
    }
}

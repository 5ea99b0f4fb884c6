package com.umlcodegen.core.model;

import java.util.Locale;

/**
 * Member visibility as written in a class diagram.
 *
 * <p>PlantUML marks visibility with a single leading symbol. A member without a
 * symbol is public.
 */
public enum Visibility {
    /** {@code +} */
    PUBLIC("+"),

    /** {@code -} */
    PRIVATE("-"),

    /** {@code #} */
    PROTECTED("#"),

    /** {@code ~} */
    PACKAGE("~");

    private final String symbol;

    Visibility(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the PlantUML symbol for this visibility.
     *
     * @return single-character symbol
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Returns the lowercase keyword ({@code public}, {@code private}, {@code protected}, {@code package}).
     *
     * @return keyword
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a PlantUML visibility symbol to a visibility.
     *
     * @param symbol symbol text, may be null or empty
     * @return matching visibility, {@link #PUBLIC} when the symbol is absent or unknown
     */
    public static Visibility fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return PUBLIC;
        }
        String trimmed = symbol.trim();
        for (Visibility visibility : values()) {
            if (visibility.symbol.equals(trimmed)) {
                return visibility;
            }
        }
        return PUBLIC;
    }
}

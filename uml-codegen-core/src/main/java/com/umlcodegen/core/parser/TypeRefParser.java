package com.umlcodegen.core.parser;

import java.util.ArrayList;
import java.util.List;

import com.umlcodegen.core.model.TypeRef;

/**
 * Parses type text such as {@code Map<String, List<Integer>>} into a {@link TypeRef}.
 *
 * <p>Parsing is best-effort. Text whose angle brackets do not balance, or that carries
 * anything after the closing bracket, is kept as a simple type named by the raw text.
 */
public final class TypeRefParser {

    private TypeRefParser() {
        // Utility class
    }

    /**
     * Parses type text.
     *
     * @param text type text, may be null or blank
     * @return parsed type, {@link TypeRef#OBJECT} for null or blank text
     */
    public static TypeRef parse(String text) {
        if (text == null || text.isBlank()) {
            return TypeRef.OBJECT;
        }
        String trimmed = text.trim();
        int open = trimmed.indexOf('<');
        if (open <= 0 || !trimmed.endsWith(">") || !isBalanced(trimmed)) {
            return TypeRef.simple(trimmed);
        }

        String base = trimmed.substring(0, open).trim();
        String inner = trimmed.substring(open + 1, trimmed.length() - 1);
        if (closesBeforeEnd(trimmed, open)) {
            return TypeRef.simple(trimmed);
        }

        List<TypeRef> arguments = new ArrayList<>();
        for (String argument : splitTopLevel(inner)) {
            if (argument.isEmpty()) {
                return TypeRef.simple(trimmed);
            }
            arguments.add(parse(argument));
        }
        return TypeRef.generic(base, arguments);
    }

    /**
     * Splits text on commas that are not nested inside angle brackets.
     *
     * <p>{@code "a: Map<String, List<Integer>>, b: int"} yields two parts. Parts are
     * trimmed; a blank input yields an empty list.
     *
     * @param text text to split
     * @return top-level parts
     */
    public static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return parts;
        }

        StringBuilder buffer = new StringBuilder();
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(buffer.toString().trim());
                buffer.setLength(0);
                continue;
            }
            buffer.append(c);
        }
        parts.add(buffer.toString().trim());
        return parts;
    }

    private static boolean isBalanced(String text) {
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * Returns true when the bracket opened at {@code open} closes before the last character,
     * as in {@code List<A>, Set<B>}.
     */
    private static boolean closesBeforeEnd(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    return i != text.length() - 1;
                }
            }
        }
        return true;
    }
}

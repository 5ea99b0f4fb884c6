package com.umlcodegen.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips diagram markers and comments from PlantUML text.
 *
 * <p>The result keeps one entry per input line: removed content becomes an empty line, so
 * list index + 1 is still the line number of the original input.
 */
public final class PlantUmlSanitizer {

    private static final Pattern BLOCK_COMMENT_PATTERN =
        Pattern.compile("/\\*[\\s\\S]*?\\*/|/'[\\s\\S]*?'/");

    private static final String COMMENT_PREFIX = "'";
    private static final String START_MARKER = "@startuml";
    private static final String END_MARKER = "@enduml";

    private PlantUmlSanitizer() {
        // Utility class
    }

    /**
     * Sanitizes diagram text into trimmed lines.
     *
     * @param text raw diagram text, may be null
     * @return trimmed lines, one per input line
     */
    public static List<String> sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        String withoutBlocks = stripBlockComments(normalized);

        List<String> lines = new ArrayList<>();
        for (String line : withoutBlocks.split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.startsWith(START_MARKER)
                || trimmed.startsWith(END_MARKER)
                || trimmed.startsWith(COMMENT_PREFIX)) {
                lines.add("");
            } else {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    /**
     * Replaces block comments with as many line breaks as they span.
     */
    private static String stripBlockComments(String text) {
        Matcher matcher = BLOCK_COMMENT_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String lineBreaks = "\n".repeat((int) matcher.group().chars().filter(c -> c == '\n').count());
            matcher.appendReplacement(sb, lineBreaks);
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}

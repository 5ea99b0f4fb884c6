package com.umlcodegen.core.parser;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the PlantUML class-diagram subset.
 *
 * <p>All patterns expect a trimmed line.
 *
 * @since 1.0.0
 */
public final class PlantUmlPatterns {

    // Structure
    public static final Pattern PACKAGE_PATTERN =
        Pattern.compile("^(?:package|namespace)\\s+\"?([^\"{}]+?)\"?\\s*(\\{)?\\s*$");

    public static final Pattern CLASS_PATTERN =
        Pattern.compile("^(?:(abstract)\\s+(?:class\\s+)?|class\\s+)(\\w+)\\s*(?:<([\\w\\s,]+)>)?");

    public static final Pattern INTERFACE_PATTERN =
        Pattern.compile("^interface\\s+(\\w+)\\s*(?:<([\\w\\s,]+)>)?");

    public static final Pattern ENUM_PATTERN =
        Pattern.compile("^enum\\s+(\\w+)");

    public static final Pattern SEPARATOR_PATTERN =
        Pattern.compile("^(?:-{2,}|\\.{2,}|={2,}|_{2,})(?:.*?(?:-{2,}|\\.{2,}|={2,}|_{2,}))?$");

    public static final Pattern NOTE_START_PATTERN =
        Pattern.compile("^note\\b.*");

    public static final Pattern NOTE_END_PATTERN =
        Pattern.compile("^end\\s*note$");

    // Members
    public static final Pattern MODIFIER_PATTERN =
        Pattern.compile("\\{\\s*(\\w+)\\s*\\}");

    public static final Pattern VISIBILITY_PATTERN =
        Pattern.compile("^([+\\-#~])\\s*");

    public static final Pattern METHOD_PATTERN =
        Pattern.compile("^(\\w+)\\s*\\((.*)\\)\\s*(?::\\s*(.+?))?\\s*$");

    public static final Pattern ATTRIBUTE_PATTERN =
        Pattern.compile("^(\\w+)\\s*(?::\\s*([^=]+?))?\\s*(?:=.*)?$");

    // Relationships
    public static final Pattern QUOTED_TEXT_PATTERN =
        Pattern.compile("\"([^\"]*)\"");

    public static final Pattern ENTITY_REFERENCE_PATTERN =
        Pattern.compile("^[\\w.$]+$");

    private PlantUmlPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}

package com.umlcodegen.core.parser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.umlcodegen.core.model.Relationship;
import com.umlcodegen.core.model.RelationshipType;

/**
 * Parses relationship lines into relationships stored in canonical direction.
 *
 * <p>Arrows are tried in a fixed order so that an arrow is never mistaken for a shorter
 * arrow it contains. The aggregation and composition heads must touch the arrow and be
 * separated from the class name, so {@code Repo-->Item} stays a plain association.
 *
 * <p>The first quoted text on the line is the label. Without a quoted label, text after a
 * colon following the arrow is used instead.
 */
public final class RelationshipParser {

    /**
     * Arrow spelling with its relationship type.
     *
     * @param pattern arrow pattern
     * @param type relationship type
     * @param reversed true when the right-hand name is the canonical source
     */
    private record Arrow(Pattern pattern, RelationshipType type, boolean reversed) {
        static Arrow of(String regex, RelationshipType type, boolean reversed) {
            return new Arrow(Pattern.compile(regex), type, reversed);
        }
    }

    // Longer arrows first; separated aggregation/composition heads before plain arrows
    private static final List<Arrow> ARROWS = List.of(
        Arrow.of("<\\|--", RelationshipType.INHERITANCE, false),
        Arrow.of("--\\|>", RelationshipType.INHERITANCE, true),
        Arrow.of("<\\|\\.\\.", RelationshipType.IMPLEMENTATION, false),
        Arrow.of("\\.\\.\\|>", RelationshipType.IMPLEMENTATION, true),
        Arrow.of("(?<=^|\\s)o-->", RelationshipType.AGGREGATION, false),
        Arrow.of("<--o(?=\\s|$)", RelationshipType.AGGREGATION, true),
        Arrow.of("\\*-->", RelationshipType.COMPOSITION, false),
        Arrow.of("<--\\*", RelationshipType.COMPOSITION, true),
        Arrow.of("\\.\\.>", RelationshipType.DEPENDENCY, false),
        Arrow.of("<\\.\\.", RelationshipType.DEPENDENCY, true),
        Arrow.of("-->", RelationshipType.ASSOCIATION, false),
        Arrow.of("<--", RelationshipType.ASSOCIATION, true)
    );

    private RelationshipParser() {
        // Utility class
    }

    /**
     * Returns whether the line contains any known arrow.
     *
     * @param line trimmed line
     * @return true if an arrow is present
     */
    public static boolean containsArrow(String line) {
        String unquoted = PlantUmlPatterns.QUOTED_TEXT_PATTERN.matcher(line).replaceAll(" ");
        return ARROWS.stream().anyMatch(arrow -> arrow.pattern().matcher(unquoted).find());
    }

    /**
     * Parses a relationship line.
     *
     * @param line trimmed line
     * @return relationship in canonical direction, empty if the line is not one
     */
    public static Optional<Relationship> parse(String line) {
        Matcher quoted = PlantUmlPatterns.QUOTED_TEXT_PATTERN.matcher(line);
        String label = quoted.find() ? quoted.group(1).trim() : null;
        String unquoted = PlantUmlPatterns.QUOTED_TEXT_PATTERN.matcher(line).replaceAll(" ");

        for (Arrow arrow : ARROWS) {
            Matcher matcher = arrow.pattern().matcher(unquoted);
            if (!matcher.find()) {
                continue;
            }

            String left = unquoted.substring(0, matcher.start());
            String right = unquoted.substring(matcher.end());

            int colon = right.indexOf(':');
            if (colon >= 0) {
                if (label == null) {
                    label = right.substring(colon + 1).trim();
                }
                right = right.substring(0, colon);
            }

            String leftName = left.replaceAll("\\s+", "");
            String rightName = right.replaceAll("\\s+", "");
            if (!isEntityReference(leftName) || !isEntityReference(rightName)) {
                return Optional.empty();
            }

            return Optional.of(arrow.reversed()
                ? new Relationship(rightName, leftName, arrow.type(), label)
                : new Relationship(leftName, rightName, arrow.type(), label));
        }
        return Optional.empty();
    }

    private static boolean isEntityReference(String name) {
        return PlantUmlPatterns.ENTITY_REFERENCE_PATTERN.matcher(name).matches();
    }
}

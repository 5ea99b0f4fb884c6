package com.umlcodegen.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

import com.umlcodegen.core.model.Attribute;
import com.umlcodegen.core.model.Method;
import com.umlcodegen.core.model.Parameter;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.model.Visibility;

/**
 * Parses member lines of class and interface bodies.
 *
 * <p>A member line is split in two steps. {@link #split(String)} pulls out the
 * {@code {modifier}} tags, which may appear anywhere and in any order. The remaining text
 * is then matched as a method ({@code name(params)[: returnType]}) or as an attribute
 * ({@code name[: type]}), each with an optional leading visibility symbol.
 */
public final class MemberParser {

    private static final Set<String> STATIC_MODIFIERS = Set.of("static", "classifier");
    private static final Set<String> FINAL_MODIFIERS = Set.of("final", "readonly");
    private static final String ABSTRACT_MODIFIER = "abstract";

    private MemberParser() {
        // Utility class
    }

    /**
     * Member text with its modifier tags removed.
     *
     * @param text line text without modifier tags, trimmed
     * @param modifiers lowercase modifier names found on the line
     */
    public record MemberLine(String text, Set<String> modifiers) {
        public MemberLine {
            text = text == null ? "" : text.trim();
            modifiers = modifiers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(modifiers));
        }

        boolean isStatic() {
            return modifiers.stream().anyMatch(STATIC_MODIFIERS::contains);
        }

        boolean isFinal() {
            return modifiers.stream().anyMatch(FINAL_MODIFIERS::contains);
        }

        boolean isAbstract() {
            return modifiers.contains(ABSTRACT_MODIFIER);
        }

        boolean hasModifiers() {
            return !modifiers.isEmpty();
        }

        MemberLine withText(String newText) {
            return new MemberLine(newText, modifiers);
        }
    }

    /**
     * Extracts the modifier tags of a line.
     *
     * @param line trimmed body line
     * @return text without tags plus the tags found
     */
    public static MemberLine split(String line) {
        Set<String> modifiers = new LinkedHashSet<>();
        Matcher matcher = PlantUmlPatterns.MODIFIER_PATTERN.matcher(line);
        while (matcher.find()) {
            modifiers.add(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        String text = PlantUmlPatterns.MODIFIER_PATTERN.matcher(line).replaceAll(" ");
        return new MemberLine(text.replaceAll("\\s+", " "), modifiers);
    }

    /**
     * Returns whether the line starts with a visibility symbol.
     *
     * @param member member line
     * @return true for {@code +}, {@code -}, {@code #} or {@code ~}
     */
    public static boolean hasVisibility(MemberLine member) {
        return PlantUmlPatterns.VISIBILITY_PATTERN.matcher(member.text()).find();
    }

    /**
     * Parses a method or constructor.
     *
     * <p>A method named like its owner and declared without a return type is a constructor:
     * the returned method has a null return type.
     *
     * @param member member line
     * @param ownerName name of the enclosing entity
     * @return parsed method, empty if the text is not a method
     */
    public static Optional<Method> parseMethod(MemberLine member, String ownerName) {
        Visibility visibility = visibilityOf(member.text());
        Matcher matcher = PlantUmlPatterns.METHOD_PATTERN.matcher(stripVisibility(member.text()));
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String name = matcher.group(1);
        List<Parameter> parameters = parseParameters(matcher.group(2));
        String returnType = matcher.group(3);

        if (returnType == null && name.equals(ownerName)) {
            return Optional.of(Method.constructor(ownerName, parameters, visibility));
        }

        return Optional.of(new Method(
            name,
            returnType == null ? TypeRef.VOID : TypeRefParser.parse(returnType),
            parameters,
            visibility,
            member.isStatic(),
            member.isAbstract()
        ));
    }

    /**
     * Parses an attribute.
     *
     * @param member member line
     * @return parsed attribute, empty if the text is not an attribute
     */
    public static Optional<Attribute> parseAttribute(MemberLine member) {
        Visibility visibility = visibilityOf(member.text());
        Matcher matcher = PlantUmlPatterns.ATTRIBUTE_PATTERN.matcher(stripVisibility(member.text()));
        if (!matcher.matches()) {
            return Optional.empty();
        }

        return Optional.of(new Attribute(
            matcher.group(1),
            TypeRefParser.parse(matcher.group(2)),
            visibility,
            member.isStatic(),
            member.isFinal()
        ));
    }

    /**
     * Parses a parameter list such as {@code a: Map<String, List<Integer>>, b: int}.
     *
     * <p>Each parameter is split on its first colon; a parameter without a type gets
     * {@link TypeRef#OBJECT}. Blank entries are dropped.
     *
     * @param text text between the parentheses
     * @return ordered parameters
     */
    public static List<Parameter> parseParameters(String text) {
        List<Parameter> parameters = new ArrayList<>();
        for (String token : TypeRefParser.splitTopLevel(text)) {
            int colon = token.indexOf(':');
            String name = colon < 0 ? token : token.substring(0, colon).trim();
            if (name.isEmpty()) {
                continue;
            }
            TypeRef type = colon < 0 ? TypeRef.OBJECT : TypeRefParser.parse(token.substring(colon + 1));
            parameters.add(new Parameter(name, type));
        }
        return parameters;
    }

    private static Visibility visibilityOf(String text) {
        Matcher matcher = PlantUmlPatterns.VISIBILITY_PATTERN.matcher(text);
        return matcher.find() ? Visibility.fromSymbol(matcher.group(1)) : Visibility.PUBLIC;
    }

    private static String stripVisibility(String text) {
        return PlantUmlPatterns.VISIBILITY_PATTERN.matcher(text).replaceFirst("").trim();
    }
}

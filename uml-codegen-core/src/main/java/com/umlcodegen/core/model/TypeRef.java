package com.umlcodegen.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured type reference parsed from the free-form type text of a diagram.
 *
 * <p>A type is either simple ({@code int}, {@code String}, {@code Order[]}) or generic,
 * with a base name and an ordered list of type arguments that are themselves type
 * references. {@code Map<String, List<Integer>>} becomes {@code Map} with the arguments
 * {@code String} and {@code List<Integer>}.
 *
 * <p>{@link #toString()} renders the canonical text form, so a type written as
 * {@code Map<String, List<Integer>>} renders back unchanged.
 *
 * @param name base type name, never null
 * @param arguments generic type arguments, empty for simple types
 */
public record TypeRef(
    String name,
    List<TypeRef> arguments
) {
    /** Default type for attributes and parameters declared without a type. */
    public static final TypeRef OBJECT = simple("Object");

    /** Default return type for methods declared without one. */
    public static final TypeRef VOID = simple("void");

    /**
     * Compact constructor with validation.
     */
    public TypeRef {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * Creates a type without type arguments.
     *
     * @param name type name
     * @return simple type
     */
    public static TypeRef simple(String name) {
        return new TypeRef(name, List.of());
    }

    /**
     * Creates a generic type.
     *
     * @param name base type name
     * @param arguments type arguments
     * @return generic type
     */
    public static TypeRef generic(String name, List<TypeRef> arguments) {
        return new TypeRef(name, arguments);
    }

    /**
     * Returns whether this type carries type arguments.
     *
     * @return true for generic types such as {@code List<String>}
     */
    public boolean isGeneric() {
        return !arguments.isEmpty();
    }

    /**
     * Checks the base name against candidates, ignoring case.
     *
     * @param candidates names to compare with
     * @return true if the base name equals any candidate
     */
    public boolean isNamed(String... candidates) {
        for (String candidate : candidates) {
            if (name.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the base name in lowercase, the key used by the per-language type tables.
     *
     * @return lowercase base name
     */
    public String lookupKey() {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return arguments.stream()
            .map(TypeRef::toString)
            .collect(Collectors.joining(", ", name + "<", ">"));
    }
}

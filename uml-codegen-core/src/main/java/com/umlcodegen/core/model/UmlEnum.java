package com.umlcodegen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumeration declared in a diagram.
 *
 * @param name enum name
 * @param packageName enclosing package, or null
 * @param values value names in declaration order (live list)
 */
public record UmlEnum(
    String name,
    String packageName,
    List<String> values
) implements UmlEntity {
    /**
     * Compact constructor with validation.
     */
    public UmlEnum {
        Objects.requireNonNull(name, "name must not be null");
        values = values == null ? new ArrayList<>() : values;
    }

    /**
     * Creates an enum without values.
     *
     * @param name enum name
     * @param packageName enclosing package, or null
     */
    public UmlEnum(String name, String packageName) {
        this(name, packageName, null);
    }
}

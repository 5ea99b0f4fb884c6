package com.umlcodegen.core.model;

import java.util.Objects;

/**
 * Method or constructor parameter.
 *
 * @param name parameter name
 * @param type parameter type, {@link TypeRef#OBJECT} when the diagram omits it
 */
public record Parameter(
    String name,
    TypeRef type
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = TypeRef.OBJECT;
        }
    }
}

package com.umlcodegen.core.model;

import java.util.Objects;

/**
 * Attribute (field) of a class.
 *
 * @param name attribute name
 * @param type attribute type, {@link TypeRef#OBJECT} when the diagram omits it
 * @param visibility declared visibility
 * @param isStatic whether the attribute carries {@code {static}}
 * @param isFinal whether the attribute carries {@code {final}}
 */
public record Attribute(
    String name,
    TypeRef type,
    Visibility visibility,
    boolean isStatic,
    boolean isFinal
) {
    /**
     * Compact constructor with validation.
     */
    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = TypeRef.OBJECT;
        }
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
    }
}

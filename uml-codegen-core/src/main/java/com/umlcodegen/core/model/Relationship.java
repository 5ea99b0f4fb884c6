package com.umlcodegen.core.model;

import java.util.Objects;

/**
 * Directed, typed edge between two entities, stored in canonical direction.
 *
 * <p>Canonical direction per type: inheritance points from child to parent,
 * implementation from class to interface, association/aggregation/composition from the
 * owning side to the owned side, and dependency from the dependent to the dependency.
 *
 * <p>Source and target are names only. They are resolved against the diagram when code
 * is generated; an unknown name simply does not resolve.
 *
 * @param sourceClass source entity name
 * @param targetClass target entity name
 * @param type relationship type
 * @param label optional label, null when absent
 */
public record Relationship(
    String sourceClass,
    String targetClass,
    RelationshipType type,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(sourceClass, "sourceClass must not be null");
        Objects.requireNonNull(targetClass, "targetClass must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (label != null && label.isBlank()) {
            label = null;
        }
    }
}

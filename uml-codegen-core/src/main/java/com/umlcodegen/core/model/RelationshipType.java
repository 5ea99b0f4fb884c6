package com.umlcodegen.core.model;

/**
 * Types of relationships between diagram entities.
 *
 * <p>Relationships are always stored in canonical direction, see {@link Relationship}.
 */
public enum RelationshipType {
    /** Source extends target (child to parent) */
    INHERITANCE,

    /** Source class implements target interface */
    IMPLEMENTATION,

    /** Source references target */
    ASSOCIATION,

    /** Source aggregates target (shared ownership) */
    AGGREGATION,

    /** Source is composed of target (exclusive ownership) */
    COMPOSITION,

    /** Source depends on target */
    DEPENDENCY;

    /**
     * Returns whether this relationship implies the source holds a reference to the target.
     *
     * @return true for association, aggregation and composition
     */
    public boolean isStructural() {
        return this == ASSOCIATION || this == AGGREGATION || this == COMPOSITION;
    }
}

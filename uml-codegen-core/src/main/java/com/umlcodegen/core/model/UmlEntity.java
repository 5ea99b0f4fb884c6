package com.umlcodegen.core.model;

/**
 * Common view of the three declarable entity kinds: classes, interfaces and enums.
 */
public interface UmlEntity {

    /**
     * Returns the entity name, unique within one diagram by convention.
     *
     * @return entity name
     */
    String name();

    /**
     * Returns the enclosing package, or null for entities declared outside any package.
     *
     * @return package name or null
     */
    String packageName();
}

package com.umlcodegen.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Intermediate representation of one parsed class diagram.
 *
 * <p>Built in a single pass by the parser and handed to a generator. All collections are
 * live and keep insertion order; the member order of each package drives output order.
 * Name uniqueness is not enforced: lookups return the first match.
 *
 * @param classes declared classes
 * @param interfaces declared interfaces
 * @param enums declared enums
 * @param relationships relationships in canonical direction
 * @param packages package name to the names of the entities declared in it
 */
public record ClassDiagram(
    List<UmlClass> classes,
    List<UmlInterface> interfaces,
    List<UmlEnum> enums,
    List<Relationship> relationships,
    Map<String, List<String>> packages
) {
    /**
     * Compact constructor with validation.
     */
    public ClassDiagram {
        classes = classes == null ? new ArrayList<>() : classes;
        interfaces = interfaces == null ? new ArrayList<>() : interfaces;
        enums = enums == null ? new ArrayList<>() : enums;
        relationships = relationships == null ? new ArrayList<>() : relationships;
        packages = packages == null ? new LinkedHashMap<>() : packages;
    }

    /**
     * Creates an empty diagram.
     */
    public ClassDiagram() {
        this(null, null, null, null, null);
    }

    /**
     * Finds a class by name.
     *
     * @param name class name
     * @return first class with that name
     */
    public Optional<UmlClass> findClass(String name) {
        return classes.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /**
     * Finds an interface by name.
     *
     * @param name interface name
     * @return first interface with that name
     */
    public Optional<UmlInterface> findInterface(String name) {
        return interfaces.stream().filter(i -> i.name().equals(name)).findFirst();
    }

    /**
     * Finds an enum by name.
     *
     * @param name enum name
     * @return first enum with that name
     */
    public Optional<UmlEnum> findEnum(String name) {
        return enums.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    /**
     * Resolves a name against classes, then interfaces, then enums.
     *
     * @param name entity name
     * @return first entity with that name
     */
    public Optional<UmlEntity> findEntity(String name) {
        Optional<UmlEntity> found = findClass(name).map(UmlEntity.class::cast);
        if (found.isEmpty()) {
            found = findInterface(name).map(UmlEntity.class::cast);
        }
        if (found.isEmpty()) {
            found = findEnum(name).map(UmlEntity.class::cast);
        }
        return found;
    }

    /**
     * Returns the total number of declared entities.
     *
     * @return classes + interfaces + enums
     */
    public int entityCount() {
        return classes.size() + interfaces.size() + enums.size();
    }
}

package com.umlcodegen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Class declared in a diagram.
 *
 * <p>The member lists are live: the parser fills them while it reads the class body, and
 * callers may append synthetic members between parsing and generation.
 *
 * @param name class name
 * @param isAbstract whether the class was declared {@code abstract}
 * @param packageName enclosing package, or null
 * @param attributes ordered attributes
 * @param methods ordered methods, constructors excluded
 * @param constructors ordered constructors
 * @param generics generic parameter names, e.g. {@code [K, V]}
 */
public record UmlClass(
    String name,
    boolean isAbstract,
    String packageName,
    List<Attribute> attributes,
    List<Method> methods,
    List<Method> constructors,
    List<String> generics
) implements UmlEntity {
    /**
     * Compact constructor with validation.
     */
    public UmlClass {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? new ArrayList<>() : attributes;
        methods = methods == null ? new ArrayList<>() : methods;
        constructors = constructors == null ? new ArrayList<>() : constructors;
        generics = generics == null ? new ArrayList<>() : generics;
    }

    /**
     * Creates an empty class.
     *
     * @param name class name
     * @param isAbstract whether the class is abstract
     * @param packageName enclosing package, or null
     */
    public UmlClass(String name, boolean isAbstract, String packageName) {
        this(name, isAbstract, packageName, null, null, null, null);
    }
}

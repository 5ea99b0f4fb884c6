package com.umlcodegen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interface declared in a diagram. Interfaces carry methods only.
 *
 * @param name interface name
 * @param packageName enclosing package, or null
 * @param methods ordered methods (live list)
 * @param generics generic parameter names
 */
public record UmlInterface(
    String name,
    String packageName,
    List<Method> methods,
    List<String> generics
) implements UmlEntity {
    /**
     * Compact constructor with validation.
     */
    public UmlInterface {
        Objects.requireNonNull(name, "name must not be null");
        methods = methods == null ? new ArrayList<>() : methods;
        generics = generics == null ? new ArrayList<>() : generics;
    }

    /**
     * Creates an empty interface.
     *
     * @param name interface name
     * @param packageName enclosing package, or null
     */
    public UmlInterface(String name, String packageName) {
        this(name, packageName, null, null);
    }
}

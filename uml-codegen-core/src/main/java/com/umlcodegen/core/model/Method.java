package com.umlcodegen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Method or constructor of a class or interface.
 *
 * <p>Constructors share this shape and are told apart by a null {@code returnType};
 * owners keep them in a separate list.
 *
 * @param name method name (the owner's name for constructors)
 * @param returnType return type, null for constructors
 * @param parameters ordered parameters
 * @param visibility declared visibility
 * @param isStatic whether the method carries {@code {static}}
 * @param isAbstract whether the method carries {@code {abstract}}
 */
public record Method(
    String name,
    TypeRef returnType,
    List<Parameter> parameters,
    Visibility visibility,
    boolean isStatic,
    boolean isAbstract
) {
    /**
     * Compact constructor with validation.
     */
    public Method {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? new ArrayList<>() : parameters;
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
    }

    /**
     * Creates a constructor record for the given owner.
     *
     * @param ownerName name of the owning entity
     * @param parameters constructor parameters
     * @param visibility declared visibility
     * @return method record with no return type
     */
    public static Method constructor(String ownerName, List<Parameter> parameters, Visibility visibility) {
        return new Method(ownerName, null, parameters, visibility, false, false);
    }

    /**
     * Returns whether this record describes a constructor.
     *
     * @return true if there is no return type
     */
    public boolean isConstructor() {
        return returnType == null;
    }

    /**
     * Returns whether the method returns nothing.
     *
     * @return true for constructors and {@code void} methods
     */
    public boolean returnsVoid() {
        return returnType == null || returnType.isNamed("void");
    }
}

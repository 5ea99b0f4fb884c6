package com.umlcodegen.core.generator;

import java.util.Set;

import com.umlcodegen.core.model.TypeRef;

/**
 * Coarse classification of source types, used to pick placeholder return values.
 */
public enum TypeCategory {
    BOOLEAN,
    NUMERIC,
    CHARACTER,
    TEXT,
    VOID,
    OTHER;

    private static final Set<String> BOOLEAN_TYPES = Set.of("boolean", "bool");
    private static final Set<String> NUMERIC_TYPES = Set.of(
        "int", "integer", "long", "short", "byte", "float", "double", "number", "decimal");
    private static final Set<String> CHARACTER_TYPES = Set.of("char", "character");
    private static final Set<String> TEXT_TYPES = Set.of("string", "str");
    private static final Set<String> VOID_TYPES = Set.of("void", "unit");

    /**
     * Classifies a type by its base name, ignoring case. Generic types are always OTHER.
     *
     * @param type source type, null is treated as void
     * @return category
     */
    public static TypeCategory of(TypeRef type) {
        if (type == null) {
            return VOID;
        }
        if (type.isGeneric()) {
            return OTHER;
        }
        String key = type.lookupKey();
        if (BOOLEAN_TYPES.contains(key)) {
            return BOOLEAN;
        }
        if (NUMERIC_TYPES.contains(key)) {
            return NUMERIC;
        }
        if (CHARACTER_TYPES.contains(key)) {
            return CHARACTER;
        }
        if (TEXT_TYPES.contains(key)) {
            return TEXT;
        }
        if (VOID_TYPES.contains(key)) {
            return VOID;
        }
        return OTHER;
    }
}

package com.umlcodegen.core.generator;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.Relationship;
import com.umlcodegen.core.model.RelationshipType;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.model.UmlClass;
import com.umlcodegen.core.model.UmlInterface;

/**
 * Lookups and text helpers shared by all generators.
 *
 * <p>Each generator holds one instance configured with its indent size.
 */
public final class GeneratorSupport {

    private final int indentSize;

    public GeneratorSupport(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public int indentSize() {
        return indentSize;
    }

    /**
     * Finds the parent class of a class.
     *
     * <p>Only the first inheritance relationship with this class as source is considered.
     *
     * @param umlClass child class
     * @param diagram enclosing diagram
     * @return parent class, empty if none is declared or the target is not a class
     */
    public Optional<UmlClass> findParentClass(UmlClass umlClass, ClassDiagram diagram) {
        return diagram.relationships().stream()
            .filter(r -> r.type() == RelationshipType.INHERITANCE && r.sourceClass().equals(umlClass.name()))
            .findFirst()
            .flatMap(r -> diagram.findClass(r.targetClass()));
    }

    /**
     * Finds the interfaces a class implements, in relationship order.
     *
     * @param umlClass implementing class
     * @param diagram enclosing diagram
     * @return resolved interfaces; unknown targets are left out
     */
    public List<UmlInterface> findImplementedInterfaces(UmlClass umlClass, ClassDiagram diagram) {
        return diagram.relationships().stream()
            .filter(r -> r.type() == RelationshipType.IMPLEMENTATION && r.sourceClass().equals(umlClass.name()))
            .map(r -> diagram.findInterface(r.targetClass()))
            .flatMap(Optional::stream)
            .toList();
    }

    /**
     * Finds association, aggregation and composition relationships owned by a class.
     *
     * @param umlClass owning class
     * @param diagram enclosing diagram
     * @return matching relationships in declaration order
     */
    public List<Relationship> findAssociations(UmlClass umlClass, ClassDiagram diagram) {
        return diagram.relationships().stream()
            .filter(r -> r.type().isStructural() && r.sourceClass().equals(umlClass.name()))
            .toList();
    }

    /**
     * Prefixes every non-empty line with {@code level * indentSize} spaces.
     *
     * @param text single or multi-line text
     * @param level indentation level
     * @return indented text, line breaks preserved
     */
    public String indent(String text, int level) {
        String prefix = " ".repeat(indentSize * Math.max(0, level));
        return Arrays.stream(text.split("\n", -1))
            .map(line -> line.isEmpty() ? line : prefix + line)
            .collect(Collectors.joining("\n"));
    }

    /**
     * Indents text by one level.
     *
     * @param text text to indent
     * @return indented text
     */
    public String indent(String text) {
        return indent(text, 1);
    }

    /**
     * Describes a type whose arguments were erased by the target mapping.
     *
     * @param type source type
     * @return {@code " (original type: Map<String, Integer>)"} for generic types, otherwise empty
     */
    public static String originalTypeNote(TypeRef type) {
        return type != null && type.isGeneric() ? " (original type: " + type + ")" : "";
    }
}

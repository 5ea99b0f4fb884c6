package com.umlcodegen.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.umlcodegen.core.generator.CodeGenerator;
import com.umlcodegen.core.generator.GeneratorSupport;
import com.umlcodegen.core.generator.TypeCategory;
import com.umlcodegen.core.model.Attribute;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.Method;
import com.umlcodegen.core.model.Parameter;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.model.UmlClass;
import com.umlcodegen.core.model.UmlEnum;
import com.umlcodegen.core.model.UmlInterface;

/**
 * Generates Python 3 source with type hints from class diagrams.
 *
 * <p>Abstract classes and interfaces derive from {@code ABC}; abstract methods get
 * {@code @abstractmethod}, static ones {@code @staticmethod}. Static attributes become
 * class variables, instance attributes are assigned in {@code __init__}. Python has no
 * packages inside a module, so a package is marked with a comment. Enum values start at 1.
 */
public class PythonGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PythonGenerator.class);

    private static final String GENERATOR_ID = "python";
    private static final String GENERATOR_DISPLAY_NAME = "Python";
    private static final String FILE_EXTENSION = "py";
    private static final int INDENT_SIZE = 4;

    private static final String HEADER = """
        # Generated Python code from PlantUML class diagram

        from abc import ABC, abstractmethod
        from enum import Enum
        from typing import Any, Dict, Iterable, List, Optional, Set


        """;

    private final GeneratorSupport support = new GeneratorSupport(INDENT_SIZE);

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public int indentSize() {
        return INDENT_SIZE;
    }

    @Override
    public String generateHeader(ClassDiagram diagram) {
        log.debug("Generating Python for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generatePackageStart(String packageName) {
        return "# Package: " + packageName + "\n\n";
    }

    @Override
    public String generatePackageEnd(String packageName) {
        return "\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        List<String> bases = new ArrayList<>();
        support.findParentClass(umlClass, diagram).ifPresent(p -> bases.add(p.name()));
        support.findImplementedInterfaces(umlClass, diagram).forEach(i -> bases.add(i.name()));
        if (umlClass.isAbstract() && bases.isEmpty()) {
            bases.add("ABC");
        }
        boolean hasParent = support.findParentClass(umlClass, diagram).isPresent();

        StringBuilder code = new StringBuilder();
        code.append("class ").append(umlClass.name());
        if (!bases.isEmpty()) {
            code.append('(').append(String.join(", ", bases)).append(')');
        }
        code.append(":\n");
        code.append(support.indent("\"\"\"" + umlClass.name() + " class\"\"\"")).append("\n\n");

        List<Attribute> staticAttributes = umlClass.attributes().stream().filter(Attribute::isStatic).toList();
        List<Attribute> instanceAttributes = umlClass.attributes().stream().filter(a -> !a.isStatic()).toList();

        for (Attribute attribute : staticAttributes) {
            code.append(support.indent(attribute.name() + ": " + mapType(attribute.type()) + " = "
                + defaultValue(attribute.type()) + "  # Static attribute")).append('\n');
        }
        if (!staticAttributes.isEmpty()) {
            code.append('\n');
        }

        // Python has a single initializer: the first declared constructor, or one per attribute
        if (!instanceAttributes.isEmpty() || !umlClass.constructors().isEmpty() || hasParent) {
            List<String> parameters = new ArrayList<>();
            parameters.add("self");
            if (!umlClass.constructors().isEmpty()) {
                umlClass.constructors().get(0).parameters()
                    .forEach(p -> parameters.add(p.name() + ": " + mapType(p.type()) + " = None"));
            } else {
                instanceAttributes.forEach(a -> parameters.add(a.name() + ": " + mapType(a.type()) + " = None"));
            }
            List<String> parameterNames = umlClass.constructors().isEmpty()
                ? instanceAttributes.stream().map(Attribute::name).toList()
                : umlClass.constructors().get(0).parameters().stream().map(Parameter::name).toList();

            code.append(support.indent("def __init__(" + String.join(", ", parameters) + "):")).append('\n');
            code.append(support.indent("\"\"\"Initialize a new " + umlClass.name() + " instance\"\"\"", 2)).append('\n');
            if (hasParent) {
                code.append(support.indent("super().__init__()", 2)).append('\n');
            }
            for (Attribute attribute : instanceAttributes) {
                String value = parameterNames.contains(attribute.name()) ? attribute.name() : "None";
                code.append(support.indent("self." + attribute.name() + " = " + value, 2)).append('\n');
            }
            code.append('\n');
        }

        for (Method method : umlClass.methods()) {
            code.append(method(method, method.isAbstract()));
        }

        if (umlClass.attributes().isEmpty() && umlClass.methods().isEmpty()
            && umlClass.constructors().isEmpty() && !hasParent) {
            code.append(support.indent("pass")).append("\n\n");
        }
        code.append('\n');
        return code.toString();
    }

    @Override
    public String generateInterface(UmlInterface umlInterface, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("class ").append(umlInterface.name()).append("(ABC):\n");
        code.append(support.indent("\"\"\"" + umlInterface.name() + " interface\"\"\"")).append("\n\n");
        for (Method method : umlInterface.methods()) {
            code.append(method(method, true));
        }
        if (umlInterface.methods().isEmpty()) {
            code.append(support.indent("pass")).append("\n\n");
        }
        code.append('\n');
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("class ").append(umlEnum.name()).append("(Enum):\n");
        code.append(support.indent("\"\"\"" + umlEnum.name() + " enum\"\"\"")).append("\n\n");
        List<String> values = umlEnum.values();
        for (int i = 0; i < values.size(); i++) {
            code.append(support.indent(values.get(i) + " = " + (i + 1))).append('\n');
        }
        if (values.isEmpty()) {
            code.append(support.indent("pass")).append('\n');
        }
        code.append("\n\n");
        return code.toString();
    }

    private String method(Method method, boolean signatureOnly) {
        StringBuilder code = new StringBuilder();
        if (signatureOnly) {
            code.append(support.indent("@abstractmethod")).append('\n');
        }
        if (method.isStatic()) {
            code.append(support.indent("@staticmethod")).append('\n');
        }

        List<String> parameters = new ArrayList<>();
        if (!method.isStatic()) {
            parameters.add("self");
        }
        method.parameters().forEach(p -> parameters.add(p.name() + ": " + mapType(p.type())));

        code.append(support.indent("def " + method.name() + "(" + String.join(", ", parameters) + ") -> "
            + mapType(method.returnType()) + ":")).append('\n');
        code.append(support.indent(docstring(method), 2)).append('\n');
        if (signatureOnly) {
            code.append(support.indent("pass", 2)).append("\n\n");
        } else {
            code.append(support.indent("# TODO: Implement method", 2)).append('\n');
            code.append(support.indent(method.returnsVoid() ? "pass" : "return " + defaultValue(method.returnType()), 2))
                .append("\n\n");
        }
        return code.toString();
    }

    private String docstring(Method method) {
        StringBuilder doc = new StringBuilder("\"\"\"").append(method.name());
        if (!method.parameters().isEmpty()) {
            doc.append("\n\nArgs:\n");
            doc.append(method.parameters().stream()
                .map(p -> "    " + p.name() + ": A " + mapType(p.type()) + GeneratorSupport.originalTypeNote(p.type()))
                .collect(Collectors.joining("\n")));
        }
        if (!method.returnsVoid()) {
            doc.append("\n\nReturns:\n    ").append(mapType(method.returnType()))
                .append(GeneratorSupport.originalTypeNote(method.returnType()));
        }
        if (!method.parameters().isEmpty() || !method.returnsVoid()) {
            doc.append('\n');
        }
        return doc.append("\"\"\"").toString();
    }

    String mapType(TypeRef type) {
        if (type == null) {
            return "None";
        }
        if (type.isGeneric()) {
            return switch (type.lookupKey()) {
                case "list", "arraylist", "collection" -> "List[Any]";
                case "map", "hashmap", "dict" -> "Dict[Any, Any]";
                case "set", "hashset" -> "Set[Any]";
                case "iterable" -> "Iterable[Any]";
                case "optional" -> "Optional[Any]";
                default -> "Any";
            };
        }
        return switch (type.lookupKey()) {
            case "boolean", "bool" -> "bool";
            case "integer", "int", "long", "byte", "short" -> "int";
            case "float", "double" -> "float";
            case "string", "char", "character", "str" -> "str";
            case "void" -> "None";
            case "object", "any" -> "Any";
            case "list" -> "List";
            case "map", "hashmap" -> "Dict";
            case "set", "hashset" -> "Set";
            default -> type.name();
        };
    }

    private static String defaultValue(TypeRef type) {
        return switch (TypeCategory.of(type)) {
            case BOOLEAN -> "False";
            case NUMERIC -> type.isNamed("float", "double") ? "0.0" : "0";
            case CHARACTER -> "' '";
            case TEXT -> "\"\"";
            default -> "None";
        };
    }
}

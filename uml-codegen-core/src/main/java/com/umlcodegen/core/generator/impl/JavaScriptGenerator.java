package com.umlcodegen.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

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
import com.umlcodegen.core.model.UmlEntity;
import com.umlcodegen.core.model.UmlEnum;
import com.umlcodegen.core.model.UmlInterface;

/**
 * Generates ES2022 JavaScript (CommonJS) from class diagrams.
 *
 * <p>JavaScript has no packages, so entities are emitted in declaration order. Types only
 * appear in JSDoc. Interfaces become base classes that refuse direct instantiation and
 * whose methods throw; classes document them with {@code @implements}. Enums become frozen
 * objects numbered from 0. A {@code module.exports} footer exports every entity.
 */
public class JavaScriptGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaScriptGenerator.class);

    private static final String GENERATOR_ID = "javascript";
    private static final String GENERATOR_DISPLAY_NAME = "JavaScript";
    private static final String FILE_EXTENSION = "js";
    private static final int INDENT_SIZE = 2;

    private static final String HEADER = "// Generated JavaScript code from PlantUML class diagram\n\n";

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
    public boolean supportsPackages() {
        return false;
    }

    @Override
    public String generateHeader(ClassDiagram diagram) {
        log.debug("Generating JavaScript for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generateFooter(ClassDiagram diagram) {
        List<String> names = Stream.of(diagram.classes(), diagram.interfaces(), diagram.enums())
            .flatMap(List::stream)
            .map(UmlEntity::name)
            .distinct()
            .toList();
        if (names.isEmpty()) {
            return "";
        }
        return "module.exports = { " + String.join(", ", names) + " };\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        Optional<UmlClass> parent = support.findParentClass(umlClass, diagram);
        List<UmlInterface> interfaces = support.findImplementedInterfaces(umlClass, diagram);
        List<Attribute> staticAttributes = umlClass.attributes().stream().filter(Attribute::isStatic).toList();
        List<Attribute> instanceAttributes = umlClass.attributes().stream().filter(a -> !a.isStatic()).toList();

        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlClass.name()).append(" class\n");
        if (umlClass.isAbstract()) {
            code.append(" * @abstract\n");
        }
        for (UmlInterface umlInterface : interfaces) {
            code.append(" * @implements {").append(umlInterface.name()).append("}\n");
        }
        code.append(" */\n");
        code.append("class ").append(umlClass.name());
        parent.ifPresent(p -> code.append(" extends ").append(p.name()));
        code.append(" {\n");

        for (Attribute attribute : staticAttributes) {
            code.append(support.indent("/** @type {" + mapType(attribute.type()) + "} */")).append('\n');
            code.append(support.indent("static " + attribute.name() + " = " + defaultValue(attribute.type()) + ";"))
                .append('\n');
        }
        if (!staticAttributes.isEmpty()) {
            code.append('\n');
        }

        List<Parameter> parameters = umlClass.constructors().isEmpty()
            ? instanceAttributes.stream().map(a -> new Parameter(a.name(), a.type())).toList()
            : umlClass.constructors().get(0).parameters();
        List<String> parameterNames = parameters.stream().map(Parameter::name).toList();

        StringBuilder constructor = new StringBuilder();
        constructor.append(jsDoc(umlClass.name() + " constructor", parameters, null));
        constructor.append("constructor(")
            .append(parameterNames.stream().map(name -> name + " = null").collect(Collectors.joining(", ")))
            .append(") {\n");
        if (parent.isPresent()) {
            constructor.append(support.indent("super();")).append('\n');
        }
        if (umlClass.isAbstract()) {
            constructor.append(support.indent(instantiationGuard(umlClass.name(), "abstract class"))).append('\n');
        }
        for (Attribute attribute : instanceAttributes) {
            String value = parameterNames.contains(attribute.name()) ? attribute.name() : "null";
            constructor.append(support.indent("this." + attribute.name() + " = " + value + ";")).append('\n');
        }
        constructor.append("}\n\n");
        code.append(support.indent(constructor.toString()));

        for (Method method : umlClass.methods()) {
            code.append(support.indent(method(method, method.isAbstract())));
        }

        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateInterface(UmlInterface umlInterface, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlInterface.name()).append(" interface\n * @interface\n */\n");
        code.append("class ").append(umlInterface.name()).append(" {\n");
        code.append(support.indent("constructor() {\n"
            + support.indent(instantiationGuard(umlInterface.name(), "interface")) + "\n}\n\n"));
        for (Method method : umlInterface.methods()) {
            code.append(support.indent(method(method, true)));
        }
        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlEnum.name()).append(" enum\n * @readonly\n * @enum {number}\n */\n");
        code.append("const ").append(umlEnum.name()).append(" = Object.freeze({\n");
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < umlEnum.values().size(); i++) {
            entries.add(umlEnum.values().get(i) + ": " + i);
        }
        if (!entries.isEmpty()) {
            code.append(support.indent(String.join(",\n", entries))).append('\n');
        }
        code.append("});\n\n");
        return code.toString();
    }

    private String method(Method method, boolean signatureOnly) {
        StringBuilder code = new StringBuilder();
        code.append(jsDoc(method.name(), method.parameters(), method.returnsVoid() ? null : method.returnType()));
        code.append(method.isStatic() ? "static " : "")
            .append(method.name()).append('(')
            .append(method.parameters().stream().map(Parameter::name).collect(Collectors.joining(", ")))
            .append(") {\n");
        if (signatureOnly) {
            code.append(support.indent("throw new Error('Method " + method.name() + "() must be implemented');"))
                .append('\n');
        } else {
            code.append(support.indent("// TODO: Implement method")).append('\n');
            if (!method.returnsVoid()) {
                code.append(support.indent("return " + defaultValue(method.returnType()) + ";")).append('\n');
            }
        }
        return code.append("}\n\n").toString();
    }

    private String jsDoc(String summary, List<Parameter> parameters, TypeRef returnType) {
        StringBuilder doc = new StringBuilder("/**\n * ").append(summary).append('\n');
        for (Parameter parameter : parameters) {
            doc.append(" * @param {").append(mapType(parameter.type())).append("} ").append(parameter.name())
                .append(GeneratorSupport.originalTypeNote(parameter.type())).append('\n');
        }
        if (returnType != null) {
            doc.append(" * @returns {").append(mapType(returnType)).append('}')
                .append(GeneratorSupport.originalTypeNote(returnType)).append('\n');
        }
        return doc.append(" */\n").toString();
    }

    private static String instantiationGuard(String name, String kind) {
        return "if (new.target === " + name + ") {\n"
            + "  throw new TypeError('Cannot instantiate " + kind + " " + name + " directly');\n"
            + "}";
    }

    /**
     * Maps a diagram type to a JSDoc type expression.
     */
    String mapType(TypeRef type) {
        if (type == null) {
            return "undefined";
        }
        if (type.isGeneric()) {
            return switch (type.lookupKey()) {
                case "list", "arraylist", "collection", "iterable" -> "Array<*>";
                case "map", "hashmap" -> "Map<*, *>";
                case "set", "hashset" -> "Set<*>";
                default -> "*";
            };
        }
        return switch (type.lookupKey()) {
            case "boolean", "bool" -> "boolean";
            case "integer", "int", "long", "float", "double", "byte", "short", "number" -> "number";
            case "string", "char", "character" -> "string";
            case "void" -> "undefined";
            case "object" -> "Object";
            case "list" -> "Array";
            case "map", "hashmap" -> "Map";
            case "date" -> "Date";
            default -> type.name();
        };
    }

    private static String defaultValue(TypeRef type) {
        return switch (TypeCategory.of(type)) {
            case BOOLEAN -> "false";
            case NUMERIC -> "0";
            case CHARACTER -> "' '";
            case TEXT -> "''";
            default -> "null";
        };
    }
}

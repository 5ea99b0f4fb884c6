package com.umlcodegen.core.generator.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
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
import com.umlcodegen.core.model.Visibility;

/**
 * Generates Ruby source from class diagrams.
 *
 * <p>Packages become modules ({@code a.b} → {@code module A::B}). Interfaces become modules
 * whose methods raise {@code NotImplementedError}; implementing classes {@code include}
 * them. Instance attributes get {@code attr_accessor} (final: {@code attr_reader}), static
 * attributes class variables, static final attributes constants. Enums become modules of
 * constants numbered from 1. Types only appear in YARD comments.
 */
public class RubyGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RubyGenerator.class);

    private static final String GENERATOR_ID = "ruby";
    private static final String GENERATOR_DISPLAY_NAME = "Ruby";
    private static final String FILE_EXTENSION = "rb";
    private static final int INDENT_SIZE = 2;

    private static final String HEADER = "# Generated Ruby code from PlantUML class diagram\n\n";

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
        log.debug("Generating Ruby for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generatePackageStart(String packageName) {
        return "module " + moduleName(packageName) + "\n";
    }

    @Override
    public String generatePackageEnd(String packageName) {
        return "end # module " + moduleName(packageName) + "\n\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("# ").append(umlClass.name()).append(" class\n");
        if (umlClass.isAbstract()) {
            code.append("# This is an abstract class\n");
        }
        code.append("class ").append(umlClass.name());
        Optional<UmlClass> parent = support.findParentClass(umlClass, diagram);
        parent.ifPresent(p -> code.append(" < ").append(p.name()));
        code.append('\n');

        List<UmlInterface> interfaces = support.findImplementedInterfaces(umlClass, diagram);
        for (UmlInterface umlInterface : interfaces) {
            code.append(support.indent("include " + umlInterface.name())).append('\n');
        }
        if (!interfaces.isEmpty()) {
            code.append('\n');
        }

        List<Attribute> staticAttributes = umlClass.attributes().stream().filter(Attribute::isStatic).toList();
        for (Attribute attribute : staticAttributes) {
            if (attribute.isFinal()) {
                code.append(support.indent(attribute.name().toUpperCase(Locale.ROOT) + " = nil.freeze # Constant"))
                    .append('\n');
            } else {
                code.append(support.indent("@@" + attribute.name() + " = nil # Class variable")).append('\n');
            }
        }
        for (Attribute attribute : staticAttributes) {
            String value = attribute.isFinal() ? attribute.name().toUpperCase(Locale.ROOT) : "@@" + attribute.name();
            code.append('\n').append(support.indent("def self." + attribute.name())).append('\n');
            code.append(support.indent(value, 2)).append('\n');
            code.append(support.indent("end")).append('\n');
        }
        if (!staticAttributes.isEmpty()) {
            code.append('\n');
        }

        List<Attribute> instanceAttributes = umlClass.attributes().stream().filter(a -> !a.isStatic()).toList();
        List<String> accessors = instanceAttributes.stream().filter(a -> !a.isFinal()).map(a -> ":" + a.name()).toList();
        List<String> readers = instanceAttributes.stream().filter(Attribute::isFinal).map(a -> ":" + a.name()).toList();
        if (!accessors.isEmpty()) {
            code.append(support.indent("attr_accessor " + String.join(", ", accessors))).append('\n');
        }
        if (!readers.isEmpty()) {
            code.append(support.indent("attr_reader " + String.join(", ", readers))).append('\n');
        }
        if (!instanceAttributes.isEmpty()) {
            code.append('\n');
        }

        if (!umlClass.constructors().isEmpty() || !instanceAttributes.isEmpty()) {
            List<String> parameterNames = umlClass.constructors().isEmpty()
                ? instanceAttributes.stream().map(Attribute::name).toList()
                : umlClass.constructors().get(0).parameters().stream().map(Parameter::name).toList();

            code.append(support.indent("def initialize("
                + parameterNames.stream().map(name -> name + " = nil").collect(Collectors.joining(", ")) + ")"))
                .append('\n');
            if (parent.isPresent()) {
                code.append(support.indent("super()", 2)).append('\n');
            }
            for (Attribute attribute : instanceAttributes) {
                String value = parameterNames.contains(attribute.name()) ? attribute.name() : "nil";
                code.append(support.indent("@" + attribute.name() + " = " + value, 2)).append('\n');
            }
            code.append(support.indent("end")).append("\n\n");
        }

        for (Method method : umlClass.methods()) {
            code.append(method(method, method.isAbstract()));
        }

        code.append("end\n\n");
        return code.toString();
    }

    @Override
    public String generateInterface(UmlInterface umlInterface, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("# ").append(umlInterface.name()).append(" interface\n");
        code.append("module ").append(umlInterface.name()).append('\n');
        for (Method method : umlInterface.methods()) {
            code.append(method(method, true));
        }
        code.append("end\n\n");
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("# ").append(umlEnum.name()).append(" enum\n");
        code.append("module ").append(umlEnum.name()).append('\n');
        List<String> values = umlEnum.values();
        for (int i = 0; i < values.size(); i++) {
            code.append(support.indent(values.get(i) + " = " + (i + 1))).append('\n');
        }
        if (!values.isEmpty()) {
            code.append('\n');
        }
        code.append(support.indent("def self.values")).append('\n');
        code.append(support.indent("[" + String.join(", ", values) + "]", 2)).append('\n');
        code.append(support.indent("end")).append('\n');
        code.append("end\n\n");
        return code.toString();
    }

    private String method(Method method, boolean signatureOnly) {
        StringBuilder code = new StringBuilder();
        code.append(support.indent("# " + method.name() + " method")).append('\n');
        for (Parameter parameter : method.parameters()) {
            code.append(support.indent("# @param " + parameter.name() + " [" + mapType(parameter.type()) + "]"
                + GeneratorSupport.originalTypeNote(parameter.type()))).append('\n');
        }
        if (!method.returnsVoid()) {
            code.append(support.indent("# @return [" + mapType(method.returnType()) + "]"
                + GeneratorSupport.originalTypeNote(method.returnType()))).append('\n');
        }

        String prefix = method.isStatic() ? "self." : "";
        code.append(support.indent("def " + prefix + method.name() + "("
            + method.parameters().stream().map(Parameter::name).collect(Collectors.joining(", ")) + ")")).append('\n');
        if (signatureOnly) {
            String owner = method.isStatic() ? "name" : "self.class.name";
            code.append(support.indent("raise NotImplementedError, \"#{" + owner + "}#" + method.name()
                + " must be implemented\"", 2)).append('\n');
        } else {
            code.append(support.indent("# TODO: Implement method", 2)).append('\n');
            if (!method.returnsVoid()) {
                code.append(support.indent("return " + defaultValue(method.returnType()), 2)).append('\n');
            }
        }
        code.append(support.indent("end")).append('\n');

        if (!method.isStatic() && (method.visibility() == Visibility.PRIVATE || method.visibility() == Visibility.PROTECTED)) {
            code.append(support.indent(method.visibility().keyword() + " :" + method.name())).append('\n');
        }
        code.append('\n');
        return code.toString();
    }

    private static String moduleName(String packageName) {
        return Arrays.stream(packageName.split("\\."))
            .map(String::trim)
            .filter(part -> !part.isEmpty())
            .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
            .collect(Collectors.joining("::"));
    }

    /**
     * Maps a diagram type to the Ruby class named in YARD comments.
     */
    String mapType(TypeRef type) {
        if (type == null) {
            return "nil";
        }
        if (type.isGeneric()) {
            return switch (type.lookupKey()) {
                case "list", "arraylist", "collection", "iterable" -> "Array";
                case "map", "hashmap" -> "Hash";
                case "set", "hashset" -> "Set";
                default -> "Object";
            };
        }
        return switch (type.lookupKey()) {
            case "boolean", "bool" -> "Boolean";
            case "integer", "int", "long", "byte", "short" -> "Integer";
            case "float", "double" -> "Float";
            case "string", "char", "character" -> "String";
            case "void" -> "nil";
            case "object" -> "Object";
            case "list" -> "Array";
            case "map", "hashmap" -> "Hash";
            default -> type.name();
        };
    }

    private static String defaultValue(TypeRef type) {
        return switch (TypeCategory.of(type)) {
            case BOOLEAN -> "false";
            case NUMERIC -> type.isNamed("float", "double") ? "0.0" : "0";
            case CHARACTER -> "' '";
            case TEXT -> "\"\"";
            default -> "nil";
        };
    }
}

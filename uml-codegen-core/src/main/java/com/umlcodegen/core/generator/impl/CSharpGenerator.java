package com.umlcodegen.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
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
 * Generates C# source from class diagrams.
 *
 * <p>Packages become namespaces. Attributes become auto-properties, except final
 * attributes which become {@code readonly} fields. {@code package} visibility maps to
 * {@code internal}. Enum values get explicit ordinals from 0.
 */
public class CSharpGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CSharpGenerator.class);

    private static final String GENERATOR_ID = "csharp";
    private static final String GENERATOR_DISPLAY_NAME = "C#";
    private static final String FILE_EXTENSION = "cs";
    private static final int INDENT_SIZE = 4;

    private static final String HEADER = """
        // Generated C# code from PlantUML class diagram
        using System;
        using System.Collections.Generic;

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
        log.debug("Generating C# for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generatePackageStart(String packageName) {
        return "namespace " + packageName + "\n{\n";
    }

    @Override
    public String generatePackageEnd(String packageName) {
        return "}\n\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append(summary(umlClass.name() + " class", 0));
        code.append(umlClass.isAbstract() ? "public abstract class " : "public class ")
            .append(umlClass.name())
            .append(typeParameters(umlClass.generics()));

        Optional<UmlClass> parent = support.findParentClass(umlClass, diagram);
        List<String> bases = new ArrayList<>();
        parent.ifPresent(p -> bases.add(p.name()));
        support.findImplementedInterfaces(umlClass, diagram).forEach(i -> bases.add(i.name()));
        if (!bases.isEmpty()) {
            code.append(" : ").append(String.join(", ", bases));
        }
        code.append("\n{\n");

        for (Attribute attribute : umlClass.attributes()) {
            String prefix = visibility(attribute.visibility()) + " " + (attribute.isStatic() ? "static " : "");
            String type = mapType(attribute.type());
            String note = GeneratorSupport.originalTypeNote(attribute.type());
            if (!note.isEmpty()) {
                code.append(support.indent("//" + note)).append('\n');
            }
            if (attribute.isFinal()) {
                code.append(support.indent(prefix + "readonly " + type + " " + attribute.name() + ";")).append('\n');
            } else {
                code.append(support.indent(prefix + type + " " + attribute.name() + " { get; set; }")).append('\n');
            }
        }
        if (!umlClass.attributes().isEmpty()) {
            code.append('\n');
        }

        List<Method> constructors = new ArrayList<>(umlClass.constructors());
        if (constructors.isEmpty() && !umlClass.isAbstract()) {
            constructors.add(Method.constructor(umlClass.name(), List.of(), Visibility.PUBLIC));
        }
        for (Method constructor : constructors) {
            code.append(summary("Creates a new " + umlClass.name(), 1));
            code.append(support.indent(visibility(constructor.visibility()) + " " + umlClass.name()
                + "(" + parameters(constructor.parameters()) + ")"
                + (parent.isPresent() ? " : base()" : ""))).append('\n');
            code.append(support.indent("{")).append('\n');
            code.append(support.indent("// TODO: Implement constructor", 2)).append('\n');
            code.append(support.indent("}")).append("\n\n");
        }

        for (Method method : umlClass.methods()) {
            code.append(methodSummary(method));
            String signature = visibility(method.visibility()) + " "
                + (method.isStatic() ? "static " : "")
                + (method.isAbstract() ? "abstract " : "")
                + mapType(method.returnType()) + " " + method.name() + "(" + parameters(method.parameters()) + ")";
            if (method.isAbstract()) {
                code.append(support.indent(signature + ";")).append("\n\n");
                continue;
            }
            code.append(support.indent(signature)).append('\n');
            code.append(support.indent("{")).append('\n');
            code.append(support.indent("// TODO: Implement method", 2)).append('\n');
            if (!method.returnsVoid()) {
                code.append(support.indent("return " + defaultValue(method.returnType()) + ";", 2)).append('\n');
            }
            code.append(support.indent("}")).append("\n\n");
        }

        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateInterface(UmlInterface umlInterface, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append(summary(umlInterface.name() + " interface", 0));
        code.append("public interface ").append(umlInterface.name())
            .append(typeParameters(umlInterface.generics()))
            .append("\n{\n");
        for (Method method : umlInterface.methods()) {
            code.append(methodSummary(method));
            code.append(support.indent(mapType(method.returnType()) + " " + method.name()
                + "(" + parameters(method.parameters()) + ");")).append("\n\n");
        }
        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append(summary(umlEnum.name() + " enum", 0));
        code.append("public enum ").append(umlEnum.name()).append("\n{\n");
        List<String> values = umlEnum.values();
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            entries.add(values.get(i) + " = " + i);
        }
        if (!entries.isEmpty()) {
            code.append(support.indent(String.join(",\n", entries))).append('\n');
        }
        code.append("}\n\n");
        return code.toString();
    }

    private String summary(String text, int level) {
        return support.indent("/// <summary>\n/// " + text + "\n/// </summary>", level) + "\n";
    }

    private String methodSummary(Method method) {
        StringBuilder doc = new StringBuilder("/// <summary>\n/// ").append(method.name()).append("\n/// </summary>");
        for (Parameter parameter : method.parameters()) {
            doc.append("\n/// <param name=\"").append(parameter.name()).append("\">")
                .append(mapType(parameter.type())).append(GeneratorSupport.originalTypeNote(parameter.type()))
                .append("</param>");
        }
        if (!method.returnsVoid()) {
            doc.append("\n/// <returns>").append(mapType(method.returnType()))
                .append(GeneratorSupport.originalTypeNote(method.returnType())).append("</returns>");
        }
        return support.indent(doc.toString()) + "\n";
    }

    private String parameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(p -> mapType(p.type()) + " " + p.name())
            .collect(Collectors.joining(", "));
    }

    private static String typeParameters(List<String> generics) {
        return generics.isEmpty() ? "" : "<" + String.join(", ", generics) + ">";
    }

    private static String visibility(Visibility visibility) {
        return switch (visibility) {
            case PRIVATE -> "private";
            case PROTECTED -> "protected";
            case PACKAGE -> "internal";
            default -> "public";
        };
    }

    String mapType(TypeRef type) {
        if (type == null) {
            return "void";
        }
        if (type.isGeneric()) {
            return switch (type.lookupKey()) {
                case "list", "arraylist" -> "List<object>";
                case "map", "hashmap", "dictionary" -> "Dictionary<object, object>";
                case "set", "hashset" -> "HashSet<object>";
                case "collection" -> "ICollection<object>";
                case "iterable" -> "IEnumerable<object>";
                default -> type.name() + type.arguments().stream()
                    .map(argument -> "object")
                    .collect(Collectors.joining(", ", "<", ">"));
            };
        }
        return switch (type.lookupKey()) {
            case "boolean", "bool" -> "bool";
            case "integer", "int" -> "int";
            case "long" -> "long";
            case "float" -> "float";
            case "double" -> "double";
            case "string" -> "string";
            case "char", "character" -> "char";
            case "byte" -> "byte";
            case "short" -> "short";
            case "void" -> "void";
            case "object" -> "object";
            case "date", "datetime" -> "DateTime";
            case "list" -> "List<object>";
            case "map", "hashmap" -> "Dictionary<object, object>";
            default -> type.name();
        };
    }

    private static String defaultValue(TypeRef type) {
        return switch (TypeCategory.of(type)) {
            case BOOLEAN -> "false";
            case NUMERIC -> "0";
            case CHARACTER -> "' '";
            case TEXT -> "\"\"";
            default -> "null";
        };
    }
}

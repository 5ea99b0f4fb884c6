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
 * Generates TypeScript source from class diagrams.
 *
 * <p>Packages become namespaces. TypeScript has no package visibility, so it maps to
 * {@code protected}. A class allows one constructor implementation: several declared
 * constructors become overload signatures over a variadic implementation. Placeholder
 * bodies for object types return {@code null as any}.
 */
public class TypeScriptGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TypeScriptGenerator.class);

    private static final String GENERATOR_ID = "typescript";
    private static final String GENERATOR_DISPLAY_NAME = "TypeScript";
    private static final String FILE_EXTENSION = "ts";
    private static final int INDENT_SIZE = 2;

    private static final String HEADER = "// Generated TypeScript code from PlantUML class diagram\n\n";

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
        log.debug("Generating TypeScript for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generatePackageStart(String packageName) {
        return "export namespace " + packageName + " {\n\n";
    }

    @Override
    public String generatePackageEnd(String packageName) {
        return "}\n\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlClass.name()).append(" class\n */\n");
        code.append(umlClass.isAbstract() ? "export abstract class " : "export class ")
            .append(umlClass.name())
            .append(typeParameters(umlClass.generics()));

        Optional<UmlClass> parent = support.findParentClass(umlClass, diagram);
        parent.ifPresent(p -> code.append(" extends ").append(p.name()));
        List<UmlInterface> interfaces = support.findImplementedInterfaces(umlClass, diagram);
        if (!interfaces.isEmpty()) {
            code.append(" implements ")
                .append(interfaces.stream().map(UmlInterface::name).collect(Collectors.joining(", ")));
        }
        code.append(" {\n");

        for (Attribute attribute : umlClass.attributes()) {
            String note = GeneratorSupport.originalTypeNote(attribute.type());
            if (!note.isEmpty()) {
                code.append(support.indent("/**" + note + " */")).append('\n');
            }
            code.append(support.indent(visibility(attribute.visibility()) + " "
                + (attribute.isStatic() ? "static " : "")
                + (attribute.isFinal() ? "readonly " : "")
                + attribute.name() + (attribute.isFinal()
                    ? ": " + mapType(attribute.type()) + " = " + defaultValue(attribute.type())
                    : "!: " + mapType(attribute.type()))
                + ";")).append('\n');
        }
        if (!umlClass.attributes().isEmpty()) {
            code.append('\n');
        }

        code.append(constructors(umlClass, parent.isPresent()));

        for (Method method : umlClass.methods()) {
            code.append(support.indent(doc(method)));
            String signature = visibility(method.visibility()) + " "
                + (method.isStatic() ? "static " : "")
                + (method.isAbstract() ? "abstract " : "")
                + method.name() + "(" + parameters(method.parameters()) + "): " + mapType(method.returnType());
            if (method.isAbstract()) {
                code.append(support.indent(signature + ";")).append("\n\n");
                continue;
            }
            code.append(support.indent(signature + " {")).append('\n');
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
        code.append("/**\n * ").append(umlInterface.name()).append(" interface\n */\n");
        code.append("export interface ").append(umlInterface.name())
            .append(typeParameters(umlInterface.generics()))
            .append(" {\n");
        for (Method method : umlInterface.methods()) {
            code.append(support.indent(doc(method)));
            code.append(support.indent(method.name() + "(" + parameters(method.parameters()) + "): "
                + mapType(method.returnType()) + ";")).append("\n\n");
        }
        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlEnum.name()).append(" enum\n */\n");
        code.append("export enum ").append(umlEnum.name()).append(" {\n");
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < umlEnum.values().size(); i++) {
            entries.add(umlEnum.values().get(i) + " = " + i);
        }
        if (!entries.isEmpty()) {
            code.append(support.indent(String.join(",\n", entries))).append('\n');
        }
        code.append("}\n\n");
        return code.toString();
    }

    private String constructors(UmlClass umlClass, boolean hasParent) {
        List<Method> declared = umlClass.constructors();
        if (declared.isEmpty() && umlClass.isAbstract()) {
            return "";
        }

        StringBuilder code = new StringBuilder();
        String implementation;
        if (declared.size() > 1) {
            for (Method constructor : declared) {
                code.append(support.indent(visibility(constructor.visibility()) + " constructor("
                    + parameters(constructor.parameters()) + ");")).append('\n');
            }
            implementation = "constructor(...args: any[])";
        } else if (declared.size() == 1) {
            Method constructor = declared.get(0);
            implementation = visibility(constructor.visibility()) + " constructor("
                + parameters(constructor.parameters()) + ")";
        } else {
            implementation = "constructor()";
        }

        code.append(support.indent(implementation + " {")).append('\n');
        if (hasParent) {
            code.append(support.indent("super();", 2)).append('\n');
        }
        code.append(support.indent("// TODO: Implement constructor", 2)).append('\n');
        code.append(support.indent("}")).append("\n\n");
        return code.toString();
    }

    private String doc(Method method) {
        StringBuilder doc = new StringBuilder("/**\n * ").append(method.name()).append('\n');
        for (Parameter parameter : method.parameters()) {
            doc.append(" * @param ").append(parameter.name())
                .append(GeneratorSupport.originalTypeNote(parameter.type())).append('\n');
        }
        if (!method.returnsVoid() && method.returnType().isGeneric()) {
            doc.append(" * @returns").append(GeneratorSupport.originalTypeNote(method.returnType())).append('\n');
        }
        return doc.append(" */\n").toString();
    }

    private String parameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(p -> p.name() + ": " + mapType(p.type()))
            .collect(Collectors.joining(", "));
    }

    private static String typeParameters(List<String> generics) {
        return generics.isEmpty() ? "" : "<" + String.join(", ", generics) + ">";
    }

    private static String visibility(Visibility visibility) {
        return switch (visibility) {
            case PRIVATE -> "private";
            case PROTECTED, PACKAGE -> "protected";
            default -> "public";
        };
    }

    String mapType(TypeRef type) {
        if (type == null) {
            return "void";
        }
        if (type.isGeneric()) {
            return switch (type.lookupKey()) {
                case "list", "arraylist", "collection", "iterable" -> "any[]";
                case "map", "hashmap" -> "Map<any, any>";
                case "set", "hashset" -> "Set<any>";
                default -> "any";
            };
        }
        return switch (type.lookupKey()) {
            case "boolean", "bool" -> "boolean";
            case "integer", "int", "long", "float", "double", "byte", "short", "number" -> "number";
            case "string", "char", "character" -> "string";
            case "void" -> "void";
            case "object" -> "any";
            case "list" -> "any[]";
            case "map", "hashmap" -> "Map<any, any>";
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
            default -> "null as any";
        };
    }
}

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
 * Generates Kotlin source from class diagrams.
 *
 * <p>The first declared constructor becomes the primary constructor: parameters named like an
 * instance attribute turn into properties, the other attributes become body properties. Later
 * constructors become secondary constructors delegating to it with default arguments, except
 * one with the primary's parameter types, which is dropped. A class without constructors
 * gets its instance attributes as primary constructor properties with default values. Static attributes and methods move into a
 * {@code companion object}. Concrete classes are {@code open} so diagram subclasses compile.
 * Types without a natural default value are nullable.
 */
public class KotlinGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(KotlinGenerator.class);

    private static final String GENERATOR_ID = "kotlin";
    private static final String GENERATOR_DISPLAY_NAME = "Kotlin";
    private static final String FILE_EXTENSION = "kt";
    private static final int INDENT_SIZE = 4;

    private static final String HEADER = "// Generated Kotlin code from PlantUML class diagram\n\n";

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
        log.debug("Generating Kotlin for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generatePackageStart(String packageName) {
        return "package " + packageName + "\n\n";
    }

    @Override
    public String generatePackageEnd(String packageName) {
        return "\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        List<Attribute> instanceAttributes = umlClass.attributes().stream().filter(a -> !a.isStatic()).toList();
        List<Attribute> staticAttributes = umlClass.attributes().stream().filter(Attribute::isStatic).toList();
        List<Method> staticMethods = umlClass.methods().stream().filter(Method::isStatic).toList();
        List<Method> instanceMethods = umlClass.methods().stream().filter(m -> !m.isStatic()).toList();

        Optional<Method> primary = umlClass.constructors().stream().findFirst();
        List<Attribute> bodyProperties = new ArrayList<>();
        List<Method> secondaryConstructors = new ArrayList<>();
        List<String> primaryParameters = new ArrayList<>();

        if (primary.isPresent()) {
            Method constructor = primary.get();
            for (Parameter parameter : constructor.parameters()) {
                Optional<Attribute> attribute = instanceAttributes.stream()
                    .filter(a -> a.name().equals(parameter.name()))
                    .findFirst();
                primaryParameters.add(attribute
                    .map(a -> visibility(a.visibility()) + (a.isFinal() ? "val " : "var "))
                    .orElse("") + parameter.name() + ": " + valueType(parameter.type()));
            }
            instanceAttributes.stream()
                .filter(a -> constructor.parameters().stream().noneMatch(p -> p.name().equals(a.name())))
                .forEach(bodyProperties::add);

            List<String> primarySignature = signature(constructor);
            for (Method other : umlClass.constructors().subList(1, umlClass.constructors().size())) {
                if (signature(other).equals(primarySignature)) {
                    log.debug("Dropping constructor of {} that clashes with the primary constructor", umlClass.name());
                } else {
                    secondaryConstructors.add(other);
                }
            }
        } else {
            instanceAttributes.forEach(a -> primaryParameters.add(property(a)));
        }
        Optional<UmlClass> parent = support.findParentClass(umlClass, diagram);

        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlClass.name()).append(" class\n */\n");
        code.append(umlClass.isAbstract() ? "abstract class " : "open class ")
            .append(umlClass.name())
            .append(typeParameters(umlClass.generics()));

        if (primary.isPresent() && primary.get().visibility() != Visibility.PUBLIC) {
            code.append(' ').append(visibility(primary.get().visibility())).append("constructor");
        }
        if (!primaryParameters.isEmpty()) {
            code.append("(\n")
                .append(primaryParameters.stream().map(support::indent).collect(Collectors.joining(",\n")))
                .append("\n)");
        } else if (primary.isPresent()) {
            code.append("()");
        }

        List<String> supertypes = new ArrayList<>();
        parent.ifPresent(p -> supertypes.add(p.name() + "()"));
        support.findImplementedInterfaces(umlClass, diagram).forEach(i -> supertypes.add(i.name()));
        if (!supertypes.isEmpty()) {
            code.append(" : ").append(String.join(", ", supertypes));
        }
        code.append(" {\n");

        if (!staticAttributes.isEmpty() || !staticMethods.isEmpty()) {
            StringBuilder companion = new StringBuilder("companion object {\n");
            for (Attribute attribute : staticAttributes) {
                companion.append(support.indent(property(attribute))).append('\n');
            }
            if (!staticAttributes.isEmpty() && !staticMethods.isEmpty()) {
                companion.append('\n');
            }
            for (Method method : staticMethods) {
                companion.append(support.indent(function(method, false)));
            }
            companion.append("}\n\n");
            code.append(support.indent(companion.toString()));
        }

        for (Attribute attribute : bodyProperties) {
            code.append(support.indent(property(attribute))).append('\n');
        }
        if (!bodyProperties.isEmpty()) {
            code.append('\n');
        }

        if (primary.isPresent()) {
            code.append(support.indent("init {")).append('\n');
            code.append(support.indent("// TODO: Implement constructor", 2)).append('\n');
            code.append(support.indent("}")).append("\n\n");
        }

        for (Method constructor : secondaryConstructors) {
            String delegation = primary.get().parameters().stream()
                .map(p -> defaultValue(p.type()))
                .collect(Collectors.joining(", ", " : this(", ")"));
            code.append(support.indent(visibility(constructor.visibility()) + "constructor("
                + parameters(constructor.parameters()) + ")" + delegation + " {")).append('\n');
            code.append(support.indent("// TODO: Implement constructor", 2)).append('\n');
            code.append(support.indent("}")).append("\n\n");
        }

        for (Method method : instanceMethods) {
            code.append(support.indent(function(method, method.isAbstract())));
        }

        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateInterface(UmlInterface umlInterface, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlInterface.name()).append(" interface\n */\n");
        code.append("interface ").append(umlInterface.name())
            .append(typeParameters(umlInterface.generics()))
            .append(" {\n");
        for (Method method : umlInterface.methods()) {
            code.append(support.indent(doc(method)));
            code.append(support.indent("fun " + method.name() + "(" + parameters(method.parameters()) + ")"
                + returnClause(method))).append("\n\n");
        }
        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlEnum.name()).append(" enum\n */\n");
        code.append("enum class ").append(umlEnum.name()).append(" {\n");
        if (!umlEnum.values().isEmpty()) {
            code.append(support.indent(String.join(",\n", umlEnum.values()))).append('\n');
        }
        code.append("}\n\n");
        return code.toString();
    }

    private String function(Method method, boolean signatureOnly) {
        StringBuilder code = new StringBuilder(doc(method));
        String signature = visibility(method.visibility()) + (signatureOnly ? "abstract " : "")
            + "fun " + method.name() + "(" + parameters(method.parameters()) + ")" + returnClause(method);
        if (signatureOnly) {
            return code.append(signature).append("\n\n").toString();
        }
        code.append(signature).append(" {\n");
        code.append(support.indent("// TODO: Implement method")).append('\n');
        if (!method.returnsVoid()) {
            code.append(support.indent("return " + defaultValue(method.returnType()))).append('\n');
        }
        return code.append("}\n\n").toString();
    }

    private String property(Attribute attribute) {
        return visibility(attribute.visibility()) + (attribute.isFinal() ? "val " : "var ") + attribute.name()
            + ": " + valueType(attribute.type()) + " = " + defaultValue(attribute.type());
    }

    /**
     * Parameter types as Kotlin sees them for overload resolution.
     */
    private List<String> signature(Method constructor) {
        return constructor.parameters().stream().map(p -> mapType(p.type())).toList();
    }

    private String doc(Method method) {
        StringBuilder doc = new StringBuilder("/**\n * ").append(method.name()).append('\n');
        for (Parameter parameter : method.parameters()) {
            doc.append(" * @param ").append(parameter.name()).append(' ').append(mapType(parameter.type()))
                .append(GeneratorSupport.originalTypeNote(parameter.type())).append('\n');
        }
        if (!method.returnsVoid()) {
            doc.append(" * @return ").append(mapType(method.returnType()))
                .append(GeneratorSupport.originalTypeNote(method.returnType())).append('\n');
        }
        return doc.append(" */\n").toString();
    }

    private String returnClause(Method method) {
        return method.returnsVoid() ? "" : ": " + valueType(method.returnType());
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
            case PRIVATE -> "private ";
            case PROTECTED -> "protected ";
            case PACKAGE -> "internal ";
            default -> "";
        };
    }

    /**
     * Type of a property or return value: nullable when its default is {@code null}.
     */
    private String valueType(TypeRef type) {
        String mapped = mapType(type);
        return "null".equals(defaultValue(type)) ? mapped + "?" : mapped;
    }

    String mapType(TypeRef type) {
        if (type == null) {
            return "Unit";
        }
        if (type.isGeneric()) {
            return switch (type.lookupKey()) {
                case "list", "arraylist", "collection" -> "List<Any>";
                case "map", "hashmap" -> "Map<Any, Any>";
                case "set", "hashset" -> "Set<Any>";
                case "iterable" -> "Iterable<Any>";
                default -> type.name() + type.arguments().stream()
                    .map(argument -> "Any")
                    .collect(Collectors.joining(", ", "<", ">"));
            };
        }
        return switch (type.lookupKey()) {
            case "boolean", "bool" -> "Boolean";
            case "integer", "int" -> "Int";
            case "long" -> "Long";
            case "float" -> "Float";
            case "double" -> "Double";
            case "string" -> "String";
            case "char", "character" -> "Char";
            case "byte" -> "Byte";
            case "short" -> "Short";
            case "void" -> "Unit";
            case "object" -> "Any";
            case "list" -> "List<Any>";
            case "map", "hashmap" -> "Map<Any, Any>";
            case "array" -> "Array<Any>";
            default -> type.name();
        };
    }

    private static String defaultValue(TypeRef type) {
        return switch (TypeCategory.of(type)) {
            case BOOLEAN -> "false";
            case NUMERIC -> switch (type.lookupKey()) {
                case "long" -> "0L";
                case "float" -> "0.0f";
                case "double" -> "0.0";
                default -> "0";
            };
            case CHARACTER -> "' '";
            case TEXT -> "\"\"";
            default -> "null";
        };
    }
}

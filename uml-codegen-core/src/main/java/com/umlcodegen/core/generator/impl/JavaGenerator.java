package com.umlcodegen.core.generator.impl;

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
 * Generates Java source from class diagrams.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>Packages:</b> {@code package p;} before the package's types</li>
 *   <li><b>Classes:</b> {@code extends}/{@code implements} from the diagram's relationships,
 *       a default constructor when none is declared and the class is concrete,
 *       {@code super()} in constructors of subclasses</li>
 *   <li><b>Visibility:</b> {@code package} maps to package-private (no modifier)</li>
 *   <li><b>Generics:</b> nested type arguments are erased to {@code Object}; the Javadoc of
 *       the member keeps the original type</li>
 * </ul>
 */
public class JavaGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "java";
    private static final String GENERATOR_DISPLAY_NAME = "Java";
    private static final String FILE_EXTENSION = "java";
    private static final int INDENT_SIZE = 4;

    private static final String HEADER = "// Generated Java code from PlantUML class diagram\n\n";
    private static final String CONSTRUCTOR_PLACEHOLDER = "// TODO: Implement constructor\n";
    private static final String METHOD_PLACEHOLDER = "// TODO: Implement method\n";

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
        log.debug("Generating Java for {} entities", diagram.entityCount());
        return HEADER;
    }

    @Override
    public String generatePackageStart(String packageName) {
        return "package " + packageName + ";\n\n";
    }

    @Override
    public String generatePackageEnd(String packageName) {
        return "\n";
    }

    @Override
    public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlClass.name()).append(" class\n */\n");
        code.append(umlClass.isAbstract() ? "public abstract class " : "public class ")
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
            String declaration = modifiers(attribute.visibility())
                + (attribute.isStatic() ? "static " : "")
                + (attribute.isFinal() ? "final " : "")
                + mapType(attribute.type()) + " " + attribute.name()
                + (attribute.isFinal() ? " = " + defaultValue(attribute.type()) : "") + ";";
            String note = GeneratorSupport.originalTypeNote(attribute.type());
            if (!note.isEmpty()) {
                code.append(support.indent("/**" + note + " */")).append('\n');
            }
            code.append(support.indent(declaration)).append('\n');
        }
        if (!umlClass.attributes().isEmpty()) {
            code.append('\n');
        }

        if (!umlClass.constructors().isEmpty()) {
            for (Method constructor : umlClass.constructors()) {
                code.append(constructor(umlClass, constructor, parent.isPresent(), "Constructor"));
            }
        } else if (!umlClass.isAbstract()) {
            Method defaultConstructor = Method.constructor(umlClass.name(), List.of(), Visibility.PUBLIC);
            code.append(constructor(umlClass, defaultConstructor, parent.isPresent(), "Default constructor"));
        }

        for (Method method : umlClass.methods()) {
            code.append(methodDoc(method));
            String signature = modifiers(method.visibility())
                + (method.isStatic() ? "static " : "")
                + (method.isAbstract() ? "abstract " : "")
                + mapType(method.returnType()) + " " + method.name() + "(" + parameters(method.parameters()) + ")";
            if (method.isAbstract()) {
                code.append(support.indent(signature + ";")).append("\n\n");
            } else {
                code.append(support.indent(signature + " {")).append('\n');
                code.append(support.indent(METHOD_PLACEHOLDER, 2));
                if (!method.returnsVoid()) {
                    code.append(support.indent("return " + defaultValue(method.returnType()) + ";", 2)).append('\n');
                }
                code.append(support.indent("}")).append("\n\n");
            }
        }

        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateInterface(UmlInterface umlInterface, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlInterface.name()).append(" interface\n */\n");
        code.append("public interface ").append(umlInterface.name())
            .append(typeParameters(umlInterface.generics()))
            .append(" {\n");

        for (Method method : umlInterface.methods()) {
            code.append(methodDoc(method));
            code.append(support.indent(mapType(method.returnType()) + " " + method.name()
                + "(" + parameters(method.parameters()) + ");")).append("\n\n");
        }

        code.append("}\n\n");
        return code.toString();
    }

    @Override
    public String generateEnum(UmlEnum umlEnum, ClassDiagram diagram) {
        StringBuilder code = new StringBuilder();
        code.append("/**\n * ").append(umlEnum.name()).append(" enum\n */\n");
        code.append("public enum ").append(umlEnum.name()).append(" {\n");
        if (!umlEnum.values().isEmpty()) {
            code.append(support.indent(String.join(",\n", umlEnum.values()) + ";")).append('\n');
        }
        code.append("}\n\n");
        return code.toString();
    }

    private String constructor(UmlClass owner, Method constructor, boolean hasParent, String description) {
        StringBuilder code = new StringBuilder();
        code.append(support.indent("/**\n * " + description + " for " + owner.name() + "\n */")).append('\n');
        code.append(support.indent(modifiers(constructor.visibility()) + owner.name()
            + "(" + parameters(constructor.parameters()) + ") {")).append('\n');
        if (hasParent) {
            code.append(support.indent("super();", 2)).append('\n');
        }
        code.append(support.indent(CONSTRUCTOR_PLACEHOLDER, 2));
        code.append(support.indent("}")).append("\n\n");
        return code.toString();
    }

    private String methodDoc(Method method) {
        StringBuilder doc = new StringBuilder("/**\n * ").append(method.name()).append('\n');
        for (Parameter parameter : method.parameters()) {
            doc.append(" * @param ").append(parameter.name()).append(' ').append(mapType(parameter.type()))
                .append(GeneratorSupport.originalTypeNote(parameter.type())).append('\n');
        }
        if (!method.returnsVoid()) {
            doc.append(" * @return ").append(mapType(method.returnType()))
                .append(GeneratorSupport.originalTypeNote(method.returnType())).append('\n');
        }
        doc.append(" */");
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

    private static String modifiers(Visibility visibility) {
        return visibility == Visibility.PACKAGE ? "" : visibility.keyword() + " ";
    }

    /**
     * Maps a diagram type to Java. Simple types pass through; generic types keep their
     * container and erase the arguments to {@code Object}.
     */
    String mapType(TypeRef type) {
        if (type == null) {
            return "void";
        }
        if (!type.isGeneric()) {
            return type.name();
        }
        return switch (type.lookupKey()) {
            case "list" -> "List<Object>";
            case "arraylist" -> "ArrayList<Object>";
            case "map", "hashmap" -> "Map<Object, Object>";
            case "set", "hashset" -> "Set<Object>";
            case "collection" -> "Collection<Object>";
            case "iterable" -> "Iterable<Object>";
            default -> type.name() + type.arguments().stream()
                .map(argument -> "Object")
                .collect(Collectors.joining(", ", "<", ">"));
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

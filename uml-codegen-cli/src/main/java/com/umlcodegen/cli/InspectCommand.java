package com.umlcodegen.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umlcodegen.core.UmlTranspiler;
import com.umlcodegen.core.model.Attribute;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.Method;
import com.umlcodegen.core.model.Parameter;
import com.umlcodegen.core.model.ParseResult;
import com.umlcodegen.core.model.Relationship;
import com.umlcodegen.core.model.SkippedLine;
import com.umlcodegen.core.model.UmlClass;
import com.umlcodegen.core.model.UmlEnum;
import com.umlcodegen.core.model.UmlInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to print the parsed intermediate model of a diagram as JSON.
 *
 * <p>Types are printed in their canonical text form ({@code Map<String, List<Integer>>}),
 * relationships in canonical direction.
 */
@Command(
    name = "inspect",
    description = "Print the parsed model of a PlantUML diagram as JSON",
    mixinStandardHelpOptions = true
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(
        index = "0",
        description = "Diagram file or '-' for stdin"
    )
    private String input;

    @Option(
        names = {"--skipped"},
        description = "Include the lines the parser skipped"
    )
    private boolean includeSkipped;

    private final UmlTranspiler transpiler = new UmlTranspiler();

    @Override
    public Integer call() {
        try {
            List<DiagramInput> diagrams = DiagramInput.read(input, DiagramInput.STDIN);
            if (diagrams.size() != 1) {
                System.err.println("✗ Inspect expects exactly one diagram, found " + diagrams.size());
                return 1;
            }

            ParseResult result = transpiler.parseWithDiagnostics(diagrams.get(0).text());
            System.out.println(toJson(result));
            return 0;

        } catch (Exception e) {
            log.debug("Inspect failed", e);
            System.err.println("✗ Inspect failed: " + e.getMessage());
            return 1;
        }
    }

    String toJson(ParseResult result) throws IOException {
        ClassDiagram diagram = result.diagram();
        ObjectNode root = JSON_MAPPER.createObjectNode();

        ArrayNode classes = root.putArray("classes");
        diagram.classes().forEach(umlClass -> classes.add(classNode(umlClass)));

        ArrayNode interfaces = root.putArray("interfaces");
        diagram.interfaces().forEach(umlInterface -> interfaces.add(interfaceNode(umlInterface)));

        ArrayNode enums = root.putArray("enums");
        diagram.enums().forEach(umlEnum -> enums.add(enumNode(umlEnum)));

        ArrayNode relationships = root.putArray("relationships");
        diagram.relationships().forEach(relationship -> relationships.add(relationshipNode(relationship)));

        ObjectNode packages = root.putObject("packages");
        for (Map.Entry<String, List<String>> entry : diagram.packages().entrySet()) {
            ArrayNode members = packages.putArray(entry.getKey());
            entry.getValue().forEach(members::add);
        }

        if (includeSkipped) {
            ArrayNode skipped = root.putArray("skippedLines");
            for (SkippedLine line : result.skippedLines()) {
                skipped.addObject()
                    .put("line", line.lineNumber())
                    .put("text", line.text())
                    .put("reason", line.reason());
            }
        }

        return JSON_MAPPER.writeValueAsString(root);
    }

    private ObjectNode classNode(UmlClass umlClass) {
        ObjectNode node = JSON_MAPPER.createObjectNode()
            .put("name", umlClass.name())
            .put("abstract", umlClass.isAbstract())
            .put("package", umlClass.packageName());
        ArrayNode generics = node.putArray("generics");
        umlClass.generics().forEach(generics::add);

        ArrayNode attributes = node.putArray("attributes");
        umlClass.attributes().forEach(attribute -> attributes.add(attributeNode(attribute)));

        ArrayNode constructors = node.putArray("constructors");
        umlClass.constructors().forEach(constructor -> constructors.add(methodNode(constructor)));

        ArrayNode methods = node.putArray("methods");
        umlClass.methods().forEach(method -> methods.add(methodNode(method)));
        return node;
    }

    private ObjectNode interfaceNode(UmlInterface umlInterface) {
        ObjectNode node = JSON_MAPPER.createObjectNode()
            .put("name", umlInterface.name())
            .put("package", umlInterface.packageName());
        ArrayNode generics = node.putArray("generics");
        umlInterface.generics().forEach(generics::add);

        ArrayNode methods = node.putArray("methods");
        umlInterface.methods().forEach(method -> methods.add(methodNode(method)));
        return node;
    }

    private ObjectNode enumNode(UmlEnum umlEnum) {
        ObjectNode node = JSON_MAPPER.createObjectNode()
            .put("name", umlEnum.name())
            .put("package", umlEnum.packageName());
        ArrayNode values = node.putArray("values");
        umlEnum.values().forEach(values::add);
        return node;
    }

    private ObjectNode attributeNode(Attribute attribute) {
        return JSON_MAPPER.createObjectNode()
            .put("name", attribute.name())
            .put("type", attribute.type().toString())
            .put("visibility", attribute.visibility().keyword())
            .put("static", attribute.isStatic())
            .put("final", attribute.isFinal());
    }

    private ObjectNode methodNode(Method method) {
        ObjectNode node = JSON_MAPPER.createObjectNode()
            .put("name", method.name())
            .put("visibility", method.visibility().keyword())
            .put("static", method.isStatic())
            .put("abstract", method.isAbstract());
        if (!method.isConstructor()) {
            node.put("returnType", method.returnType().toString());
        }

        ArrayNode parameters = node.putArray("parameters");
        for (Parameter parameter : method.parameters()) {
            parameters.addObject()
                .put("name", parameter.name())
                .put("type", parameter.type().toString());
        }
        return node;
    }

    private ObjectNode relationshipNode(Relationship relationship) {
        return JSON_MAPPER.createObjectNode()
            .put("source", relationship.sourceClass())
            .put("target", relationship.targetClass())
            .put("type", relationship.type().name().toLowerCase(Locale.ROOT))
            .put("label", relationship.label());
    }
}

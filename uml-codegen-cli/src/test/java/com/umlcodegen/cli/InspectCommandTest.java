package com.umlcodegen.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umlcodegen.core.UmlTranspiler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link InspectCommand}.
 */
class InspectCommandTest {

    private static final String LIBRARY_DIAGRAM = """
        @startuml
        package library {
          abstract class Item<T> {
            #title: String
            +{static} {final} LIMIT: int
            +Item(title: String)
            +{abstract} describe(): String
          }
          class Book
        }
        interface Lendable {
          +lend(to: Member): void
        }
        enum Genre {
          FICTION, SCIENCE
        }
        Book <|-- Item
        Book <|.. Lendable
        Book --> Genre : genre
        bogus line here
        @enduml
        """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void call_withDiagram_printsModelAsJson() throws IOException {
        // Given
        Path diagram = tempDir.resolve("library.puml");
        Files.writeString(diagram, LIBRARY_DIAGRAM);

        // When
        int exitCode = new CommandLine(new InspectCommand()).execute(diagram.toString());

        // Then
        assertThat(exitCode).isZero();
        JsonNode root = MAPPER.readTree(out.toString(StandardCharsets.UTF_8));

        JsonNode item = root.get("classes").get(0);
        assertThat(item.get("name").asText()).isEqualTo("Item");
        assertThat(item.get("abstract").asBoolean()).isTrue();
        assertThat(item.get("package").asText()).isEqualTo("library");
        assertThat(item.get("generics").get(0).asText()).isEqualTo("T");

        JsonNode title = item.get("attributes").get(0);
        assertThat(title.get("visibility").asText()).isEqualTo("protected");
        assertThat(title.get("type").asText()).isEqualTo("String");
        assertThat(item.get("attributes").get(1).get("static").asBoolean()).isTrue();
        assertThat(item.get("attributes").get(1).get("final").asBoolean()).isTrue();

        JsonNode constructor = item.get("constructors").get(0);
        assertThat(constructor.has("returnType")).isFalse();
        assertThat(constructor.get("parameters").get(0).get("name").asText()).isEqualTo("title");
        assertThat(item.get("methods").get(0).get("abstract").asBoolean()).isTrue();
        assertThat(item.get("methods").get(0).get("returnType").asText()).isEqualTo("String");

        assertThat(root.get("interfaces").get(0).get("package").isNull()).isTrue();
        assertThat(root.get("enums").get(0).get("values")).extracting(JsonNode::asText)
            .containsExactly("FICTION", "SCIENCE");
        assertThat(root.get("relationships")).extracting(node -> node.get("type").asText())
            .containsExactly("inheritance", "implementation", "association");
        assertThat(root.get("relationships").get(2).get("label").asText()).isEqualTo("genre");
        assertThat(root.get("packages").get("library")).extracting(JsonNode::asText)
            .containsExactly("Item", "Book");
        assertThat(root.has("skippedLines")).isFalse();
    }

    @Test
    void toJson_withSkippedOption_listsSkippedLines() throws IOException {
        InspectCommand command = new InspectCommand();
        new CommandLine(command).parseArgs("--skipped", "unused.puml");

        String json = command.toJson(new UmlTranspiler().parseWithDiagnostics(LIBRARY_DIAGRAM));

        JsonNode skipped = MAPPER.readTree(json).get("skippedLines");
        assertThat(skipped).hasSize(1);
        assertThat(skipped.get(0).get("line").asInt()).isEqualTo(20);
        assertThat(skipped.get(0).get("text").asText()).isEqualTo("bogus line here");
        assertThat(skipped.get(0).get("reason").asText()).isEqualTo("unrecognized statement");
    }

    @Test
    void call_withDirectoryOfSeveralDiagrams_fails() throws IOException {
        Files.writeString(tempDir.resolve("a.puml"), "class A");
        Files.writeString(tempDir.resolve("b.puml"), "class B");

        int exitCode = new CommandLine(new InspectCommand()).execute(tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
            .contains("✗ Inspect expects exactly one diagram, found 2");
    }
}

package com.umlcodegen.core.generator.impl;

import com.umlcodegen.core.generator.CodeGenerator;
import com.umlcodegen.core.generator.GeneratorRegistry;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.parser.PlantUmlParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Checks every registered generator against one shared diagram covering all entity kinds.
 */
class GeneratorCompletenessTest {

    private static final String LIBRARY_DIAGRAM = """
        @startuml
        package library {
          interface Borrowable {
            +borrow(member: Member): boolean
            +returnItem(): void
          }

          abstract class Item {
            #title: String
            #tags: List<String>
            +{abstract} describe(): String
          }

          class Book {
            -isbn: String
            -pages: int
            +{static} {final} MAX_LOANS: int
            +Book(isbn: String)
            +getIsbn(): String
          }
        }

        class Member {
          -name: String
          -loans: Map<String, Book>
        }

        enum Genre {
          FICTION
          SCIENCE
          HISTORY
        }

        Book <|-- Item
        Book <|.. Borrowable
        Member o--> Book : borrows
        @enduml
        """;

    static List<CodeGenerator> generators() {
        return GeneratorRegistry.load().generators();
    }

    @Test
    void registry_discoversAllSevenLanguages() {
        assertThat(generators()).extracting(CodeGenerator::getId)
            .containsExactlyInAnyOrder("java", "csharp", "python", "ruby", "kotlin", "javascript", "typescript");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("generators")
    void generate_withFullDiagram_mentionsEveryEntityAndEnumValue(CodeGenerator generator) {
        // Given
        ClassDiagram diagram = new PlantUmlParser().parse(LIBRARY_DIAGRAM);

        // When
        String code = generator.generate(diagram);

        // Then
        assertThat(code).startsWith(generator.generateHeader(diagram));
        assertThat(code).contains("Borrowable", "Item", "Book", "Member", "Genre");
        assertThat(code).contains("FICTION", "SCIENCE", "HISTORY");
        assertThat(code).contains("borrow", "returnItem", "describe", "getIsbn");
        assertThat(code).contains("isbn", "pages", "MAX_LOANS", "title", "name", "loans");
    }

    private static final String ACCOUNT_DIAGRAM = """
        @startuml
        abstract class Account {
          -owner: String
          -balance: double
          +Account(owner: String)
          +{abstract} fee(): double
          +getOwner(): String
        }
        @enduml
        """;

    static Stream<Arguments> memberRenderings() {
        return Stream.of(
            Arguments.of("java", "    public Account(String owner) {",
                "    public abstract double fee();", "    public String getOwner() {", "return \"\";"),
            Arguments.of("csharp", "    public Account(string owner)",
                "    public abstract double fee();", "    public string getOwner()", "return \"\";"),
            Arguments.of("python", "    def __init__(self, owner: str = None):",
                "    def fee(self) -> float:", "    def getOwner(self) -> str:", "return \"\""),
            Arguments.of("ruby", "  def initialize(owner = nil)",
                "  def fee()", "  def getOwner()", "return \"\""),
            Arguments.of("kotlin", "abstract class Account(\n    private var owner: String\n)",
                "    abstract fun fee(): Double", "    fun getOwner(): String {", "return \"\""),
            Arguments.of("javascript", "  constructor(owner = null) {",
                "  fee() {", "  getOwner() {", "return '';"),
            Arguments.of("typescript", "  public constructor(owner: string) {",
                "  public abstract fee(): number;", "  public getOwner(): string {", "return '';"));
    }

    @Test
    void memberRenderings_coverEveryRegisteredGenerator() {
        assertThat(memberRenderings().map(arguments -> (String) arguments.get()[0]))
            .containsExactlyInAnyOrderElementsOf(GeneratorRegistry.load().languages());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("memberRenderings")
    void generate_withConstructorAbstractAndConcreteMethod_rendersEachMemberKind(
            String language, String constructor, String abstractMethod, String concreteMethod, String defaultReturn) {
        // Given
        ClassDiagram diagram = new PlantUmlParser().parse(ACCOUNT_DIAGRAM);
        CodeGenerator generator = GeneratorRegistry.load().find(language).orElseThrow();

        // When
        String code = generator.generate(diagram);

        // Then
        assertThat(code).contains("Account", "owner", "balance", constructor, abstractMethod, concreteMethod);

        String abstractPart = code.substring(code.indexOf(abstractMethod), code.indexOf(concreteMethod));
        assertThat(abstractPart).doesNotContain("TODO: Implement method");

        String concretePart = code.substring(code.indexOf(concreteMethod));
        assertThat(concretePart).contains("TODO: Implement method", defaultReturn);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("generators")
    void generate_withSameDiagram_isDeterministic(CodeGenerator generator) {
        PlantUmlParser parser = new PlantUmlParser();

        String first = generator.generate(parser.parse(LIBRARY_DIAGRAM));
        String second = generator.generate(parser.parse(LIBRARY_DIAGRAM));

        assertThat(first).isEqualTo(second);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("generators")
    void generate_withEmptyDiagram_returnsHeaderOnly(CodeGenerator generator) {
        ClassDiagram empty = new ClassDiagram();

        assertThat(generator.generate(empty)).isEqualTo(generator.generateHeader(empty));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("generators")
    void metadata_isPresent(CodeGenerator generator) {
        assertThat(generator.getId()).isNotBlank().isLowerCase();
        assertThat(generator.getDisplayName()).isNotBlank();
        assertThat(generator.getFileExtension()).isNotBlank().doesNotStartWith(".");
        assertThat(generator.indentSize()).isPositive();
    }
}

package com.umlcodegen.core.generator.impl;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.parser.PlantUmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link JavaGenerator}.
 */
class JavaGeneratorTest {

    private JavaGenerator generator;
    private PlantUmlParser parser;

    @BeforeEach
    void setUp() {
        generator = new JavaGenerator();
        parser = new PlantUmlParser();
    }

    @Test
    void metadata_isJava() {
        assertThat(generator.getId()).isEqualTo("java");
        assertThat(generator.getDisplayName()).isEqualTo("Java");
        assertThat(generator.getFileExtension()).isEqualTo("java");
        assertThat(generator.indentSize()).isEqualTo(4);
        assertThat(generator.supportsPackages()).isTrue();
    }

    @Test
    void generate_withUserClass_producesFieldsConstructorAndMethods() {
        // Given
        ClassDiagram diagram = parser.parse("""
            @startuml
            class User {
              -name: String
              -age: int
              +getName(): String
              +setName(name: String): void
            }
            @enduml
            """);

        // When
        String code = generator.generate(diagram);

        // Then
        assertThat(code).startsWith("// Generated Java code from PlantUML class diagram\n\n");
        assertThat(code).contains(
            "public class User {\n",
            "    private String name;\n",
            "    private int age;\n",
            " * Default constructor for User\n",
            "    public User() {\n        // TODO: Implement constructor\n    }\n",
            "    public String getName() {\n        // TODO: Implement method\n        return \"\";\n    }\n",
            "    public void setName(String name) {\n",
            "     * @param name String\n",
            "     * @return String\n");
        assertThat(code).doesNotContain("return null;");
    }

    @Test
    void generate_withInheritanceAndInterface_emitsExtendsImplementsAndSuper() {
        ClassDiagram diagram = parser.parse("""
            interface Drawable {
              +draw(): void
            }
            class Shape
            class Circle
            Circle <|-- Shape
            Circle <|.. Drawable
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "public interface Drawable {\n",
            "    void draw();\n",
            "public class Circle extends Shape implements Drawable {\n",
            "        super();\n");
        assertThat(code).contains("public class Shape {\n");
    }

    @Test
    void generate_withUnknownParent_leavesExtendsOut() {
        ClassDiagram diagram = parser.parse("""
            class Circle
            Circle <|-- Missing
            """);

        assertThat(generator.generate(diagram))
            .contains("public class Circle {\n")
            .doesNotContain("extends")
            .doesNotContain("super();");
    }

    @Test
    void generate_withAbstractClass_declaresAbstractMethodAndNoDefaultConstructor() {
        ClassDiagram diagram = parser.parse("""
            abstract class Shape {
              +{abstract} area(): double
              #describe(): String
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "public abstract class Shape {\n",
            "    public abstract double area();\n",
            "    protected String describe() {\n");
        assertThat(code).doesNotContain("Default constructor");
    }

    @Test
    void generate_withDeclaredConstructors_emitsEachConstructor() {
        ClassDiagram diagram = parser.parse("""
            class Account {
              +Account()
              +Account(owner: String, balance: double)
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    public Account() {\n",
            "    public Account(String owner, double balance) {\n",
            " * Constructor for Account\n");
        assertThat(code).doesNotContain("Default constructor");
    }

    @Test
    void generate_withModifiersAndPackageVisibility_keepsModifiers() {
        ClassDiagram diagram = parser.parse("""
            class Config {
              +{static} {final} MAX: int
              ~label: String
              +{static} create(): Config
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    public static final int MAX = 0;\n",
            "    String label;\n",
            "    public static Config create() {\n",
            "        return null;\n");
    }

    @Test
    void generate_withFinalFields_initializesThemWithDefaults() {
        ClassDiagram diagram = parser.parse("""
            class Invoice {
              -{final} number: long
              +{final} customer: Customer
              -total: double
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    private final long number = 0L;\n",
            "    public final Customer customer = null;\n",
            "    private double total;\n");
    }

    @Test
    void generate_withGenericTypes_erasesArgumentsAndNotesOriginal() {
        ClassDiagram diagram = parser.parse("""
            class Repository<T> {
              -items: List<String>
              +index(): Map<String, Integer>
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "public class Repository<T> {\n",
            "    /** (original type: List<String>) */\n",
            "    private List<Object> items;\n",
            "     * @return Map<Object, Object> (original type: Map<String, Integer>)\n",
            "    public Map<Object, Object> index() {\n");
    }

    @Test
    void generate_withEnum_listsValues() {
        ClassDiagram diagram = parser.parse("""
            enum Color {
              RED
              GREEN
            }
            """);

        assertThat(generator.generate(diagram))
            .contains("public enum Color {\n    RED,\n    GREEN;\n}\n");
    }

    @Test
    void generate_withPackage_emitsPackageDeclaration() {
        ClassDiagram diagram = parser.parse("""
            package shop {
              class Order
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains("package shop;\n\n/**\n * Order class\n */\npublic class Order {\n");
    }

    @Test
    void generate_withPrimitiveReturnTypes_returnsMatchingDefaults() {
        ClassDiagram diagram = parser.parse("""
            class Numbers {
              +count(): long
              +ratio(): float
              +mean(): double
              +valid(): boolean
              +initial(): char
              +size(): int
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "        return 0L;\n",
            "        return 0.0f;\n",
            "        return 0.0;\n",
            "        return false;\n",
            "        return ' ';\n",
            "        return 0;\n");
    }

    @Test
    void mapType_withCollections_erasesToObject() {
        TypeRef string = TypeRef.simple("String");

        assertThat(generator.mapType(TypeRef.generic("List", List.of(string)))).isEqualTo("List<Object>");
        assertThat(generator.mapType(TypeRef.generic("ArrayList", List.of(string)))).isEqualTo("ArrayList<Object>");
        assertThat(generator.mapType(TypeRef.generic("HashMap", List.of(string, string))))
            .isEqualTo("Map<Object, Object>");
        assertThat(generator.mapType(TypeRef.generic("Set", List.of(string)))).isEqualTo("Set<Object>");
        assertThat(generator.mapType(TypeRef.generic("Pair", List.of(string, string)))).isEqualTo("Pair<Object, Object>");
    }

    @Test
    void mapType_withSimpleOrMissingType_passesThrough() {
        assertThat(generator.mapType(TypeRef.simple("Customer"))).isEqualTo("Customer");
        assertThat(generator.mapType(TypeRef.simple("int"))).isEqualTo("int");
        assertThat(generator.mapType(null)).isEqualTo("void");
    }
}

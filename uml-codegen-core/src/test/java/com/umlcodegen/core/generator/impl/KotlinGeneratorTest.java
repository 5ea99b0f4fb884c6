package com.umlcodegen.core.generator.impl;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.parser.PlantUmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link KotlinGenerator}.
 */
class KotlinGeneratorTest {

    private KotlinGenerator generator;
    private PlantUmlParser parser;

    @BeforeEach
    void setUp() {
        generator = new KotlinGenerator();
        parser = new PlantUmlParser();
    }

    @Test
    void generate_withUserClass_usesPrimaryConstructorProperties() {
        ClassDiagram diagram = parser.parse("""
            class User {
              -name: String
              -age: int
              +getName(): String
              +setName(name: String): void
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).startsWith("// Generated Kotlin code from PlantUML class diagram\n\n");
        assertThat(code).contains(
            "open class User(\n    private var name: String = \"\",\n    private var age: Int = 0\n) {\n",
            "    fun getName(): String {\n        // TODO: Implement method\n        return \"\"\n    }\n",
            "    fun setName(name: String) {\n        // TODO: Implement method\n    }\n",
            "     * @param name String\n");
    }

    @Test
    void generate_withReferenceTypedAttribute_makesItNullable() {
        ClassDiagram diagram = parser.parse("""
            class Order {
              -customer: Customer
              +{final} id: long
            }
            """);

        assertThat(generator.generate(diagram)).contains(
            "    private var customer: Customer? = null,\n",
            "    val id: Long = 0L\n");
    }

    @Test
    void generate_withParentAndInterface_callsParentConstructor() {
        ClassDiagram diagram = parser.parse("""
            interface Named {
              +label(): String
            }
            class Animal
            class Dog {
              -name: String
            }
            Dog <|-- Animal
            Dog <|.. Named
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "interface Named {\n",
            "    fun label(): String\n",
            "open class Animal {\n",
            ") : Animal(), Named {\n");
    }

    @Test
    void generate_withConstructorMatchingAttributes_promotesItToPrimaryConstructor() {
        // Given
        ClassDiagram diagram = parser.parse("""
            class User {
              -id: int
              -name: String
              -email: String
              +User(id: int, name: String)
              +User(key: int, label: String)
              +User(id: int)
            }
            """);

        // When
        String code = generator.generate(diagram);

        // Then
        assertThat(code).contains(
            "open class User(\n    private var id: Int,\n    private var name: String\n) {\n",
            "    private var email: String = \"\"\n\n",
            "    init {\n        // TODO: Implement constructor\n    }\n",
            "    constructor(id: Int) : this(0, \"\") {\n");
        assertThat(code).doesNotContain("constructor(key: Int, label: String)");
        assertThat(code).doesNotContain("constructor(id: Int, name: String)");
    }

    @Test
    void generate_withConstructorParameterWithoutAttribute_keepsPlainParameter() {
        ClassDiagram diagram = parser.parse("""
            class Base
            class Sub {
              +Sub(size: int)
            }
            Sub <|-- Base
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains("open class Sub(\n    size: Int\n) : Base() {\n");
        assertThat(code).doesNotContain("super()");
    }

    @Test
    void generate_withConstructorsAndProperties_delegatesToPrimary() {
        ClassDiagram diagram = parser.parse("""
            class Account {
              -owner: String
              -{final} customer: Customer
              +Account()
              +Account(owner: String)
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "open class Account() {\n",
            "    private var owner: String = \"\"\n    private val customer: Customer? = null\n",
            "    constructor(owner: String) : this() {\n");
        assertThat(code).doesNotContain("constructor() : this()");
    }

    @Test
    void generate_withPrivateConstructor_marksPrimaryConstructorPrivate() {
        ClassDiagram diagram = parser.parse("""
            class Registry {
              -Registry()
            }
            """);

        assertThat(generator.generate(diagram)).contains("open class Registry private constructor() {\n");
    }

    @Test
    void generate_withStaticMembers_usesCompanionObject() {
        ClassDiagram diagram = parser.parse("""
            class Config {
              +{static} {final} MAX: int
              +{static} create(): Config
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    companion object {\n        val MAX: Int = 0\n\n",
            "        fun create(): Config? {\n",
            "            return null\n");
    }

    @Test
    void generate_withAbstractClass_declaresAbstractFunction() {
        ClassDiagram diagram = parser.parse("""
            abstract class Shape {
              +{abstract} area(): double
            }
            """);

        assertThat(generator.generate(diagram)).contains(
            "abstract class Shape {\n",
            "    abstract fun area(): Double\n");
    }

    @Test
    void generate_withEnumAndPackage_emitsEnumClassInPackage() {
        ClassDiagram diagram = parser.parse("""
            package shop {
              enum Color {
                RED
                GREEN
              }
            }
            """);

        assertThat(generator.generate(diagram))
            .contains("package shop\n\n/**\n * Color enum\n */\nenum class Color {\n    RED,\n    GREEN\n}\n");
    }

    @Test
    void mapType_returnsKotlinTypes() {
        assertThat(generator.mapType(TypeRef.simple("int"))).isEqualTo("Int");
        assertThat(generator.mapType(TypeRef.simple("boolean"))).isEqualTo("Boolean");
        assertThat(generator.mapType(TypeRef.simple("void"))).isEqualTo("Unit");
        assertThat(generator.mapType(TypeRef.simple("Object"))).isEqualTo("Any");
        assertThat(generator.mapType(TypeRef.generic("ArrayList", List.of(TypeRef.simple("int"))))).isEqualTo("List<Any>");
        assertThat(generator.mapType(TypeRef.generic("Pair", List.of(TypeRef.simple("A"), TypeRef.simple("B")))))
            .isEqualTo("Pair<Any, Any>");
    }
}

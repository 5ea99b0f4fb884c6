package com.umlcodegen.core.generator.impl;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.parser.PlantUmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link TypeScriptGenerator}.
 */
class TypeScriptGeneratorTest {

    private TypeScriptGenerator generator;
    private PlantUmlParser parser;

    @BeforeEach
    void setUp() {
        generator = new TypeScriptGenerator();
        parser = new PlantUmlParser();
    }

    @Test
    void generate_withUserClass_declaresTypedMembers() {
        ClassDiagram diagram = parser.parse("""
            class User {
              -name: String
              -age: int
              +getName(): String
              +setName(name: String): void
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).startsWith("// Generated TypeScript code from PlantUML class diagram\n\n");
        assertThat(code).contains(
            "export class User {\n  private name!: string;\n  private age!: number;\n\n",
            "  constructor() {\n    // TODO: Implement constructor\n  }\n",
            "  public getName(): string {\n    // TODO: Implement method\n    return '';\n  }\n",
            "  public setName(name: string): void {\n    // TODO: Implement method\n  }\n");
    }

    @Test
    void generate_withSeveralConstructors_emitsOverloads() {
        ClassDiagram diagram = parser.parse("""
            class Account {
              +Account()
              +Account(owner: String)
            }
            """);

        assertThat(generator.generate(diagram)).contains(
            "  public constructor();\n  public constructor(owner: string);\n  constructor(...args: any[]) {\n");
    }

    @Test
    void generate_withSingleConstructor_keepsItsParameters() {
        ClassDiagram diagram = parser.parse("""
            class Account {
              +Account(owner: String)
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains("  public constructor(owner: string) {\n");
        assertThat(code).doesNotContain("...args");
    }

    @Test
    void generate_withParentAndInterface_extendsAndImplements() {
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
            "export class Circle extends Shape implements Drawable {\n",
            "    super();\n",
            "export interface Drawable {\n",
            "  draw(): void;\n");
    }

    @Test
    void generate_withAbstractClass_omitsConstructor() {
        ClassDiagram diagram = parser.parse("""
            abstract class Shape {
              +{abstract} area(): double
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "export abstract class Shape {\n",
            "  public abstract area(): number;\n");
        assertThat(code).doesNotContain("constructor(");
    }

    @Test
    void generate_withModifiersAndPackageVisibility_mapsToProtected() {
        ClassDiagram diagram = parser.parse("""
            class Config {
              +{static} {final} MAX: int
              ~label: String
              -items: List<Item>
              +{static} create(): Config
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "  public static readonly MAX: number = 0;\n",
            "  protected label!: string;\n",
            "  /** (original type: List<Item>) */\n  private items!: any[];\n",
            "  public static create(): Config {\n",
            "    return null as any;\n");
    }

    @Test
    void generate_withReadonlyFields_initializesThemWithDefaults() {
        ClassDiagram diagram = parser.parse("""
            class Invoice {
              -{final} number: long
              +{final} customer: Customer
              -total: double
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "  private readonly number: number = 0;\n",
            "  public readonly customer: Customer = null as any;\n",
            "  private total!: number;\n");
    }

    @Test
    void generate_withPackagedEnum_wrapsInNamespace() {
        ClassDiagram diagram = parser.parse("""
            package shop {
              enum Color {
                RED
                GREEN
              }
            }
            """);

        assertThat(generator.generate(diagram))
            .contains("export namespace shop {\n\n")
            .contains("export enum Color {\n  RED = 0,\n  GREEN = 1\n}\n\n}\n\n");
    }

    @Test
    void mapType_returnsTypeScriptTypes() {
        assertThat(generator.mapType(TypeRef.simple("long"))).isEqualTo("number");
        assertThat(generator.mapType(TypeRef.simple("boolean"))).isEqualTo("boolean");
        assertThat(generator.mapType(TypeRef.simple("Object"))).isEqualTo("any");
        assertThat(generator.mapType(TypeRef.simple("Customer"))).isEqualTo("Customer");
        assertThat(generator.mapType(TypeRef.generic("Set", List.of(TypeRef.simple("int"))))).isEqualTo("Set<any>");
        assertThat(generator.mapType(null)).isEqualTo("void");
    }
}

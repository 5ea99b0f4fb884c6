package com.umlcodegen.core.generator.impl;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.TypeRef;
import com.umlcodegen.core.parser.PlantUmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PythonGenerator}.
 */
class PythonGeneratorTest {

    private PythonGenerator generator;
    private PlantUmlParser parser;

    @BeforeEach
    void setUp() {
        generator = new PythonGenerator();
        parser = new PlantUmlParser();
    }

    @Test
    void generateHeader_importsAbcEnumAndTyping() {
        String header = generator.generateHeader(new ClassDiagram());

        assertThat(header).startsWith("# Generated Python code from PlantUML class diagram\n");
        assertThat(header).contains(
            "from abc import ABC, abstractmethod\n",
            "from enum import Enum\n",
            "from typing import Any, Dict, Iterable, List, Optional, Set\n");
    }

    @Test
    void generate_withUserClass_buildsInitializerFromAttributes() {
        ClassDiagram diagram = parser.parse("""
            class User {
              -name: String
              -age: int
              +getName(): String
              +setName(name: String): void
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "class User:\n    \"\"\"User class\"\"\"\n",
            "    def __init__(self, name: str = None, age: int = None):\n",
            "        self.name = name\n",
            "        self.age = age\n",
            "    def getName(self) -> str:\n",
            "        # TODO: Implement method\n        return \"\"\n",
            "    def setName(self, name: str) -> None:\n",
            "        pass\n");
    }

    @Test
    void generate_withDeclaredConstructor_usesItsParameters() {
        ClassDiagram diagram = parser.parse("""
            class Account {
              -owner: String
              -balance: double
              +Account(owner: String)
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    def __init__(self, owner: str = None):\n",
            "        self.owner = owner\n",
            "        self.balance = None\n");
    }

    @Test
    void generate_withParentAndInterface_listsBasesAndCallsSuper() {
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
            "class Drawable(ABC):\n",
            "    @abstractmethod\n    def draw(self) -> None:\n",
            "class Circle(Shape, Drawable):\n",
            "        super().__init__()\n");
    }

    @Test
    void generate_withAbstractClass_extendsAbc() {
        ClassDiagram diagram = parser.parse("""
            abstract class Shape {
              +{abstract} area(): float
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "class Shape(ABC):\n",
            "    @abstractmethod\n    def area(self) -> float:\n",
            "        pass\n");
    }

    @Test
    void generate_withStaticMembers_usesClassAttributeAndStaticmethod() {
        ClassDiagram diagram = parser.parse("""
            class Counter {
              +{static} total: int
              +{static} reset(): void
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    total: int = 0  # Static attribute\n",
            "    @staticmethod\n    def reset() -> None:\n");
    }

    @Test
    void generate_withEmptyClass_emitsPass() {
        ClassDiagram diagram = parser.parse("class Marker");

        assertThat(generator.generate(diagram)).contains("class Marker:\n    \"\"\"Marker class\"\"\"\n\n    pass\n");
    }

    @Test
    void generate_withEnum_numbersValuesFromOne() {
        ClassDiagram diagram = parser.parse("""
            enum Color {
              RED
              GREEN
            }
            """);

        assertThat(generator.generate(diagram))
            .contains("class Color(Enum):\n    \"\"\"Color enum\"\"\"\n\n    RED = 1\n    GREEN = 2\n");
    }

    @Test
    void generate_withPackage_emitsPackageComment() {
        ClassDiagram diagram = parser.parse("""
            package billing {
              class Invoice
            }
            """);

        assertThat(generator.generate(diagram)).contains("# Package: billing\n\nclass Invoice:\n");
    }

    @Test
    void generate_withDocumentedMethod_writesArgsAndReturns() {
        ClassDiagram diagram = parser.parse("""
            class Store {
              +find(ids: List<int>): Map<String, int>
            }
            """);

        String code = generator.generate(diagram);

        assertThat(code).contains(
            "    def find(self, ids: List[Any]) -> Dict[Any, Any]:\n",
            "            ids: A List[Any] (original type: List<int>)\n",
            "        Returns:\n            Dict[Any, Any] (original type: Map<String, int>)\n");
    }

    @Test
    void mapType_mapsPrimitivesToPythonTypes() {
        assertThat(generator.mapType(TypeRef.simple("boolean"))).isEqualTo("bool");
        assertThat(generator.mapType(TypeRef.simple("long"))).isEqualTo("int");
        assertThat(generator.mapType(TypeRef.simple("double"))).isEqualTo("float");
        assertThat(generator.mapType(TypeRef.simple("char"))).isEqualTo("str");
        assertThat(generator.mapType(TypeRef.simple("void"))).isEqualTo("None");
        assertThat(generator.mapType(TypeRef.simple("Object"))).isEqualTo("Any");
        assertThat(generator.mapType(TypeRef.simple("Customer"))).isEqualTo("Customer");
        assertThat(generator.mapType(TypeRef.generic("Set", List.of(TypeRef.simple("int"))))).isEqualTo("Set[Any]");
        assertThat(generator.mapType(TypeRef.generic("Box", List.of(TypeRef.simple("int"))))).isEqualTo("Any");
    }
}

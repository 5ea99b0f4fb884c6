package com.umlcodegen.core.generator;

import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.UmlClass;
import com.umlcodegen.core.model.UmlEnum;
import com.umlcodegen.core.model.UmlInterface;

/**
 * Interface for code generators that turn a class diagram into source code of one language.
 *
 * <p>A generator supplies rendering hooks; the traversal itself lives in
 * {@link DiagramWalker} and is the same for every language. Shared lookups (parent class,
 * implemented interfaces, associations) and indentation come from {@link GeneratorSupport}.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and selected by
 * their {@link #getId() id}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class GoGenerator implements CodeGenerator {
 *     private final GeneratorSupport support = new GeneratorSupport(4);
 *
 *     @Override
 *     public String getId() {
 *         return "go";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Go";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "go";
 *     }
 *
 *     @Override
 *     public String generateClass(UmlClass umlClass, ClassDiagram diagram) {
 *         return "type " + umlClass.name() + " struct {\n}\n\n";
 *     }
 *     ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.umlcodegen.core.generator.CodeGenerator}
 *
 * <p>Generators never fail on the content of a diagram. A name that does not resolve
 * (a relationship target that was never declared, an orphaned package entry) is left out
 * of the output.
 *
 * @see DiagramWalker
 * @see GeneratorSupport
 * @see GeneratorRegistry
 */
public interface CodeGenerator {

    /**
     * Returns the language key of this generator.
     *
     * <p>Used for selecting the generator on the command line and in configuration.
     * Lowercase (e.g., "java", "csharp", "typescript").
     *
     * @return unique language key
     */
    String getId();

    /**
     * Returns the human-readable language name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension of generated sources, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the number of spaces per indentation level.
     *
     * @return indent size, 4 unless overridden
     */
    default int indentSize() {
        return 4;
    }

    /**
     * Returns whether entities are grouped by package.
     *
     * <p>When false, packages are ignored and every entity is emitted in declaration order.
     *
     * @return true if the language has a package construct
     */
    default boolean supportsPackages() {
        return true;
    }

    /**
     * Text emitted once before everything else.
     *
     * @param diagram diagram being generated
     * @return header text
     */
    default String generateHeader(ClassDiagram diagram) {
        return "";
    }

    /**
     * Text emitted once after everything else.
     *
     * @param diagram diagram being generated
     * @return footer text
     */
    default String generateFooter(ClassDiagram diagram) {
        return "";
    }

    /**
     * Text opening a package.
     *
     * @param packageName package name as declared
     * @return opening text
     */
    default String generatePackageStart(String packageName) {
        return "";
    }

    /**
     * Text closing a package.
     *
     * @param packageName package name as declared
     * @return closing text
     */
    default String generatePackageEnd(String packageName) {
        return "";
    }

    /**
     * Renders one class.
     *
     * @param umlClass class to render
     * @param diagram enclosing diagram, for relationship lookups
     * @return class source
     */
    String generateClass(UmlClass umlClass, ClassDiagram diagram);

    /**
     * Renders one interface. Every method is rendered as a signature only.
     *
     * @param umlInterface interface to render
     * @param diagram enclosing diagram
     * @return interface source
     */
    String generateInterface(UmlInterface umlInterface, ClassDiagram diagram);

    /**
     * Renders one enum with a sequential ordinal per value.
     *
     * @param umlEnum enum to render
     * @param diagram enclosing diagram
     * @return enum source
     */
    String generateEnum(UmlEnum umlEnum, ClassDiagram diagram);

    /**
     * Generates source code for a whole diagram.
     *
     * @param diagram diagram to generate
     * @return generated source
     */
    default String generate(ClassDiagram diagram) {
        return new DiagramWalker(this).walk(diagram);
    }
}

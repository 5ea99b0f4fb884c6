package com.umlcodegen.core;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.umlcodegen.core.generator.CodeGenerator;
import com.umlcodegen.core.generator.GeneratorRegistry;
import com.umlcodegen.core.generator.UnsupportedLanguageException;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.ParseResult;
import com.umlcodegen.core.parser.PlantUmlParser;
import com.umlcodegen.core.renderer.GeneratedFile;

/**
 * Entry point that turns PlantUML class diagrams into source code.
 *
 * <p>Wires the {@link PlantUmlParser} to the generators of a {@link GeneratorRegistry}.
 * Only two inputs are rejected: blank diagram text and an unknown language key. Everything
 * else is handled best-effort by the parser and the generators.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * UmlTranspiler transpiler = new UmlTranspiler();
 * String java = transpiler.transpile(plantUml, "java");
 *
 * // or in two steps, to adjust the model in between
 * ClassDiagram diagram = transpiler.parse(plantUml);
 * diagram.findClass("User").ifPresent(c -> c.attributes().add(...));
 * String python = transpiler.generate(diagram, "python");
 * }</pre>
 */
public class UmlTranspiler {

    private static final Logger log = LoggerFactory.getLogger(UmlTranspiler.class);

    private final PlantUmlParser parser;
    private final GeneratorRegistry registry;

    /**
     * Creates a transpiler with every generator found on the classpath.
     */
    public UmlTranspiler() {
        this(new PlantUmlParser(), GeneratorRegistry.load());
    }

    public UmlTranspiler(PlantUmlParser parser, GeneratorRegistry registry) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Converts diagram text into source code of one language.
     *
     * @param source PlantUML text
     * @param language language key, any case
     * @return generated source
     * @throws IllegalArgumentException if the source is null or blank
     * @throws UnsupportedLanguageException if no generator has that key
     */
    public String transpile(String source, String language) {
        requireSource(source);
        CodeGenerator generator = registry.require(language);
        return generate(parse(source), generator);
    }

    /**
     * Parses diagram text.
     *
     * @param source PlantUML text
     * @return parsed diagram
     * @throws IllegalArgumentException if the source is null or blank
     */
    public ClassDiagram parse(String source) {
        return parseWithDiagnostics(source).diagram();
    }

    /**
     * Parses diagram text and reports skipped lines.
     *
     * @param source PlantUML text
     * @return parse result
     * @throws IllegalArgumentException if the source is null or blank
     */
    public ParseResult parseWithDiagnostics(String source) {
        requireSource(source);
        ParseResult result = parser.parseWithDiagnostics(source);
        ClassDiagram diagram = result.diagram();
        log.info("Parsed diagram: {} classes, {} interfaces, {} enums, {} relationships",
            diagram.classes().size(), diagram.interfaces().size(), diagram.enums().size(),
            diagram.relationships().size());
        if (!result.isClean()) {
            log.debug("{} lines skipped at {}", result.skippedLines().size(), result.skippedLineNumbers());
        }
        return result;
    }

    /**
     * Generates source code for a parsed diagram.
     *
     * @param diagram diagram, possibly adjusted after parsing
     * @param language language key, any case
     * @return generated source
     * @throws UnsupportedLanguageException if no generator has that key
     */
    public String generate(ClassDiagram diagram, String language) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        return generate(diagram, registry.require(language));
    }

    /**
     * Generates source code as a file named {@code <language>/<baseName>.<extension>}.
     *
     * @param diagram diagram to generate
     * @param language language key, any case
     * @param baseName file name without extension
     * @return generated file
     * @throws UnsupportedLanguageException if no generator has that key
     */
    public GeneratedFile generateFile(ClassDiagram diagram, String language, String baseName) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(baseName, "baseName must not be null");
        CodeGenerator generator = registry.require(language);
        String path = generator.getId() + "/" + baseName + "." + generator.getFileExtension();
        return new GeneratedFile(path, generate(diagram, generator), generator.getId());
    }

    /**
     * Returns the supported language keys in alphabetical order.
     *
     * @return language keys
     */
    public List<String> supportedLanguages() {
        return registry.languages();
    }

    public GeneratorRegistry registry() {
        return registry;
    }

    private String generate(ClassDiagram diagram, CodeGenerator generator) {
        String code = generator.generate(diagram);
        log.info("Generated {} code ({} entities, {} chars)",
            generator.getDisplayName(), diagram.entityCount(), code.length());
        return code;
    }

    private static void requireSource(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("PlantUML source must not be empty");
        }
    }
}

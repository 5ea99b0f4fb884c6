package com.umlcodegen.cli;

import com.umlcodegen.core.UmlTranspiler;
import com.umlcodegen.core.config.ConfigLoader;
import com.umlcodegen.core.config.ProjectConfig;
import com.umlcodegen.core.generator.CodeGenerator;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.ParseResult;
import com.umlcodegen.core.renderer.GeneratedFile;
import com.umlcodegen.core.renderer.GeneratedOutput;
import com.umlcodegen.core.renderer.OutputRenderer;
import com.umlcodegen.core.renderer.RenderContext;
import com.umlcodegen.core.renderer.impl.ConsoleRenderer;
import com.umlcodegen.core.renderer.impl.FileSystemRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to generate source code from PlantUML class diagrams.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Read the diagram from a file, every PlantUML file of a directory, or stdin</li>
 *   <li>Parse each diagram once</li>
 *   <li>Generate one file per diagram and language</li>
 *   <li>Write the files, or print them with {@code --stdout}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Default language from umlcodegen.yaml (java when absent)
 * umlcodegen transpile shop.puml
 *
 * # Several languages into a custom directory
 * umlcodegen transpile diagrams/ -l csharp -l ruby -o build/generated
 * }</pre>
 */
@Command(
    name = "transpile",
    description = "Generate source code from PlantUML class diagrams",
    mixinStandardHelpOptions = true
)
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    @Parameters(
        index = "0",
        description = "Diagram file, directory of diagrams, or '-' for stdin"
    )
    private String input;

    @Option(
        names = {"-l", "--language"},
        description = "Target language, repeatable (default: from config, else java)"
    )
    private List<String> languages = new ArrayList<>();

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--stdout"},
        description = "Print generated code instead of writing files"
    )
    private boolean stdout;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: umlcodegen.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    private final UmlTranspiler transpiler;

    public TranspileCommand() {
        this(new UmlTranspiler());
    }

    TranspileCommand(UmlTranspiler transpiler) {
        this.transpiler = transpiler;
    }

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            List<CodeGenerator> generators = selectGenerators(config);

            List<DiagramInput> diagrams = DiagramInput.read(input, config.output().fileName());
            if (diagrams.isEmpty()) {
                System.err.println("✗ No PlantUML files found in: " + input);
                return 1;
            }

            List<GeneratedFile> files = new ArrayList<>();
            for (DiagramInput diagram : diagrams) {
                files.addAll(transpile(diagram, generators));
            }

            GeneratedOutput output = new GeneratedOutput(files);
            if (stdout) {
                render(new ConsoleRenderer(), output, consoleContext(output));
            } else {
                String directory = outputDir != null ? outputDir.toString() : config.output().directory();
                render(new FileSystemRenderer(), output, new RenderContext(directory, Map.of()));
                System.out.println("✓ Generated " + files.size() + " file(s) in: " + directory);
            }
            return 0;

        } catch (Exception e) {
            log.debug("Transpile failed", e);
            System.err.println("✗ Transpile failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Resolves the requested language keys to generators, in request order.
     *
     * @param config project configuration
     * @return generators to run
     * @throws IllegalArgumentException if a language is unknown or disabled
     */
    private List<CodeGenerator> selectGenerators(ProjectConfig config) {
        List<String> requested = languages.isEmpty()
            ? List.of(config.generators().defaultLanguageKey())
            : languages;

        Map<String, CodeGenerator> generators = new LinkedHashMap<>();
        for (String language : requested) {
            CodeGenerator generator = transpiler.registry().require(language);
            if (!config.generators().isEnabled(generator.getId())) {
                throw new IllegalArgumentException(
                    "Language '" + generator.getId() + "' is disabled in configuration. Enabled: "
                        + String.join(", ", config.generators().enabled()));
            }
            generators.putIfAbsent(generator.getId(), generator);
        }
        log.debug("Selected generators: {}", generators.keySet());
        return List.copyOf(generators.values());
    }

    private List<GeneratedFile> transpile(DiagramInput diagram, List<CodeGenerator> generators) {
        log.info("Transpiling {}", diagram.source());
        ParseResult result = transpiler.parseWithDiagnostics(diagram.text());
        if (!result.isClean()) {
            log.warn("{}: skipped {} line(s) at {}", diagram.source(),
                result.skippedLines().size(), result.skippedLineNumbers());
        }

        ClassDiagram model = result.diagram();
        List<GeneratedFile> files = new ArrayList<>();
        for (CodeGenerator generator : generators) {
            files.add(transpiler.generateFile(model, generator.getId(), diagram.name()));
        }
        return files;
    }

    private RenderContext consoleContext(GeneratedOutput output) {
        // A single file is printed bare so it can be redirected into a source file
        boolean headers = output.files().size() > 1;
        return new RenderContext(".", Map.of("console.showHeaders", String.valueOf(headers)));
    }

    private void render(OutputRenderer renderer, GeneratedOutput output, RenderContext context) {
        log.debug("Rendering {} files with {}", output.files().size(), renderer.getId());
        renderer.render(output, context);
    }
}

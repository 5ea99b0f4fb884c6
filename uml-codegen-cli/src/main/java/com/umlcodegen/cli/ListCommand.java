package com.umlcodegen.cli;

import com.umlcodegen.core.generator.CodeGenerator;
import com.umlcodegen.core.generator.GeneratorRegistry;
import com.umlcodegen.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list supported target languages or output renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays
 * their capabilities.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List target languages
 * umlcodegen list
 *
 * # List renderers
 * umlcodegen list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported languages or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: languages or renderers (default: languages)",
        defaultValue = "languages"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "languages", "language", "generators", "generator" -> listLanguages();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: languages or renderers", type);
                System.err.println("✗ Unknown type: " + type + ". Use: languages or renderers");
                yield 1;
            }
        };
    }

    private int listLanguages() {
        System.out.println("Supported Languages:");
        System.out.println();

        GeneratorRegistry registry = GeneratorRegistry.load();
        for (CodeGenerator generator : registry.generators()) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.printf("    Packages: %s%n", generator.supportsPackages() ? "yes" : "no");
            System.out.println();
        }

        if (registry.generators().isEmpty()) {
            System.out.println("  No generators found on the classpath.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        ServiceLoader<OutputRenderer> renderers = ServiceLoader.load(OutputRenderer.class);
        boolean found = false;

        for (OutputRenderer renderer : renderers) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}

package com.umlcodegen.cli;

import com.umlcodegen.core.UmlTranspiler;
import com.umlcodegen.core.model.ClassDiagram;
import com.umlcodegen.core.model.ParseResult;
import com.umlcodegen.core.model.SkippedLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check what the parser makes of a diagram.
 *
 * <p>Prints the number of entities, relationships and packages found and lists every line
 * that contributed nothing, with the reason. Skipped lines are reported, not failed on,
 * unless {@code --strict} is given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * umlcodegen validate shop.puml
 * umlcodegen validate diagrams/ --strict
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Report recognized entities and skipped lines of PlantUML diagrams",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(
        index = "0",
        description = "Diagram file, directory of diagrams, or '-' for stdin"
    )
    private String input;

    @Option(
        names = {"--strict"},
        description = "Fail when any line was skipped"
    )
    private boolean strict;

    private final UmlTranspiler transpiler = new UmlTranspiler();

    @Override
    public Integer call() {
        try {
            List<DiagramInput> diagrams = DiagramInput.read(input, DiagramInput.STDIN);
            if (diagrams.isEmpty()) {
                System.err.println("✗ No PlantUML files found in: " + input);
                return 1;
            }

            boolean valid = true;
            for (DiagramInput diagram : diagrams) {
                valid &= validate(diagram);
            }
            return valid ? 0 : 1;

        } catch (Exception e) {
            log.debug("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private boolean validate(DiagramInput input) {
        System.out.println("Diagram: " + input.source());

        if (input.text().isBlank()) {
            System.err.println("✗ " + input.source() + ": diagram is empty");
            return false;
        }

        ParseResult result = transpiler.parseWithDiagnostics(input.text());
        ClassDiagram diagram = result.diagram();
        System.out.printf("  Classes:       %d%n", diagram.classes().size());
        System.out.printf("  Interfaces:    %d%n", diagram.interfaces().size());
        System.out.printf("  Enums:         %d%n", diagram.enums().size());
        System.out.printf("  Relationships: %d%n", diagram.relationships().size());
        System.out.printf("  Packages:      %d%n", diagram.packages().size());

        if (result.isClean()) {
            System.out.println("✓ No lines skipped");
            System.out.println();
            return true;
        }

        System.out.println("  Skipped lines:");
        for (SkippedLine line : result.skippedLines()) {
            System.out.printf("    %4d: %s (%s)%n", line.lineNumber(), line.text(), line.reason());
        }
        System.out.println();
        return !strict;
    }
}

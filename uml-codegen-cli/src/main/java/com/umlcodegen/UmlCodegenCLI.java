package com.umlcodegen;

import com.umlcodegen.cli.InspectCommand;
import com.umlcodegen.cli.ListCommand;
import com.umlcodegen.cli.TranspileCommand;
import com.umlcodegen.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for UML Codegen.
 *
 * <p>UML Codegen reads PlantUML class diagrams and generates skeleton source code in
 * Java, C#, Python, Ruby, Kotlin, JavaScript and TypeScript.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code transpile} - Generate source code from a diagram</li>
 *   <li>{@code validate} - Report what the parser recognized and skipped</li>
 *   <li>{@code inspect} - Print the parsed model as JSON</li>
 *   <li>{@code list} - List supported target languages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Generate Java into ./generated
 * umlcodegen transpile model.puml
 *
 * # Generate Python and Kotlin, print instead of writing files
 * umlcodegen transpile model.puml -l python -l kotlin --stdout
 *
 * # Read the diagram from stdin
 * cat model.puml | umlcodegen transpile - -l typescript --stdout
 * }</pre>
 */
@Command(
    name = "umlcodegen",
    mixinStandardHelpOptions = true,
    version = "UML Codegen 1.0.0-SNAPSHOT",
    description = "Generates source code skeletons from PlantUML class diagrams",
    subcommands = {
        TranspileCommand.class,
        ValidateCommand.class,
        InspectCommand.class,
        ListCommand.class
    }
)
public class UmlCodegenCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(UmlCodegenCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("UML Codegen - PlantUML class diagrams to source code");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'umlcodegen --help' to see available commands");
        System.out.println("Use 'umlcodegen <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Runs before any subcommand so that {@code umlcodegen -v transpile ...} logs at DEBUG.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the logging options applied before subcommands run.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        UmlCodegenCLI cli = new UmlCodegenCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}

package com.umlcodegen.cli;

import com.umlcodegen.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Diagram text read from a file or standard input.
 *
 * @param name base name used for generated files
 * @param source where the text came from, for messages
 * @param text diagram text
 */
public record DiagramInput(String name, String source, String text) {

    /** Input argument that selects standard input. */
    public static final String STDIN = "-";

    private static final Logger log = LoggerFactory.getLogger(DiagramInput.class);

    public DiagramInput {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Reads every diagram named by a command-line argument.
     *
     * <p>{@code -} reads standard input under {@code stdinName}; a directory yields all
     * PlantUML files found below it, in path order; anything else is read as one file.
     *
     * @param argument input argument
     * @param stdinName base name for standard input
     * @return diagrams, empty for a directory without PlantUML files
     * @throws IOException if a file cannot be read or does not exist
     */
    public static List<DiagramInput> read(String argument, String stdinName) throws IOException {
        if (STDIN.equals(argument)) {
            return List.of(fromStream(System.in, stdinName));
        }

        Path path = Path.of(argument);
        if (Files.isDirectory(path)) {
            List<DiagramInput> inputs = new ArrayList<>();
            for (Path file : FileUtils.findPlantUmlFiles(path)) {
                inputs.add(fromFile(file));
            }
            log.debug("Found {} PlantUML files in {}", inputs.size(), path);
            return inputs;
        }
        if (!Files.exists(path)) {
            throw new IOException("Input not found: " + path);
        }
        return List.of(fromFile(path));
    }

    static DiagramInput fromFile(Path file) throws IOException {
        return new DiagramInput(FileUtils.getBaseName(file), file.toString(), FileUtils.readString(file));
    }

    static DiagramInput fromStream(InputStream in, String name) throws IOException {
        return new DiagramInput(name, "<stdin>", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
}

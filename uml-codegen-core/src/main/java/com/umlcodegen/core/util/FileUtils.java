package com.umlcodegen.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    /** Extensions recognized as PlantUML sources. */
    public static final Set<String> PLANTUML_EXTENSIONS = Set.of("puml", "plantuml", "pu", "iuml");

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds every PlantUML source below a directory.
     *
     * @param rootPath root directory
     * @return PlantUML files, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findPlantUmlFiles(Path rootPath) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> PLANTUML_EXTENSIONS.contains(getExtension(path).toLowerCase(Locale.ROOT)))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a file as a UTF-8 string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name, e.g. {@code shop} for {@code diagrams/shop.puml}
     */
    public static String getBaseName(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}

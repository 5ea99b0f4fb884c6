package com.umlcodegen.core.renderer.impl;

import com.umlcodegen.core.renderer.GeneratedFile;
import com.umlcodegen.core.renderer.GeneratedOutput;
import com.umlcodegen.core.renderer.OutputRenderer;
import com.umlcodegen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes generated sources below the output directory.
 *
 * <p>Creates parent directories as needed. Relative paths must stay inside the output
 * directory.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code filesystem.overwrite} - Replace existing files ("true"/"false", default: "true");
 *       when false, existing files are left untouched and reported</li>
 * </ul>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Path.of(context.outputDirectory()).toAbsolutePath().normalize();
        boolean overwrite = context.getFlag("filesystem.overwrite", true);
        logger.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file, overwrite);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file, boolean overwrite) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File path escapes output directory: " + file.relativePath());
        }
        if (!overwrite && Files.exists(targetPath)) {
            logger.warn("Skipping existing file: {}", targetPath);
            return;
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}

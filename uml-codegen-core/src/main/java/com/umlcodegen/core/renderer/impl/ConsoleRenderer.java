package com.umlcodegen.core.renderer.impl;

import com.umlcodegen.core.renderer.GeneratedFile;
import com.umlcodegen.core.renderer.GeneratedOutput;
import com.umlcodegen.core.renderer.OutputRenderer;
import com.umlcodegen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints generated sources to a stream, standard output by default.
 *
 * <p>With a single file and headers disabled, only the source itself is printed, so the
 * output can be piped straight into a file.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - Separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    /**
     * Creates a renderer printing to {@link System#out}. Used by {@link java.util.ServiceLoader}.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.getFlag("console.colors", false);
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        boolean showHeaders = context.getFlag("console.showHeaders", true);

        logger.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);

            if (i > 0) {
                printSeparator(separator, useColors);
            }
            if (showHeaders) {
                printFileHeader(file, i + 1, output.files().size(), useColors);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(pathColor + "File " + index + "/" + total + ": " + file.relativePath() + reset);
        if (file.language() != null && !file.language().isEmpty()) {
            out.println(metaColor + "Language: " + file.language() + reset);
        }
        out.println();
    }

    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        int repeatCount = Math.max(1, LINE_WIDTH / separator.length());
        out.println();
        out.println(color + separator.repeat(repeatCount) + reset);
        out.println();
    }
}

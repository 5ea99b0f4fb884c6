package com.umlcodegen.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration of the code generator.
 *
 * <p>Loaded from {@code umlcodegen.yaml}. Selects the languages to generate and where the
 * generated sources are written. Every section is optional.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * generators:
 *   default: java
 *   enabled:
 *     - java
 *     - python
 *
 * output:
 *   directory: "./generated"
 *   fileName: "model"
 * }</pre>
 *
 * @param generators generator configuration
 * @param output output configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("generators") GeneratorSettings generators,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_LANGUAGE = "java";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./generated";
    public static final String DEFAULT_FILE_NAME = "model";

    /**
     * Compact constructor replacing absent sections with defaults.
     */
    public ProjectConfig {
        if (generators == null) {
            generators = new GeneratorSettings(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates the default configuration: Java by default, every language enabled,
     * output to {@code ./generated/model.<ext>}.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new GeneratorSettings(DEFAULT_LANGUAGE, List.of()),
            new OutputConfig(DEFAULT_OUTPUT_DIRECTORY, DEFAULT_FILE_NAME)
        );
    }

    /**
     * Generator configuration.
     *
     * @param defaultLanguage language used when none is requested
     * @param enabled enabled language keys, empty for all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("default") String defaultLanguage,
        @JsonProperty("enabled") List<String> enabled
    ) {
        public GeneratorSettings {
            if (defaultLanguage == null || defaultLanguage.isBlank()) {
                defaultLanguage = DEFAULT_LANGUAGE;
            }
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
        }

        /**
         * Checks if a language is enabled. An empty list enables every language.
         *
         * @param language language key, any case
         * @return true if enabled
         */
        public boolean isEnabled(String language) {
            return enabled.isEmpty() || enabled.stream().anyMatch(key -> key.equalsIgnoreCase(language));
        }

        /**
         * Returns the default language key in lowercase.
         *
         * @return default language
         */
        public String defaultLanguageKey() {
            return defaultLanguage.trim().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param fileName base file name; the generator's extension is appended
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("fileName") String fileName
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
            if (fileName == null || fileName.isBlank()) {
                fileName = DEFAULT_FILE_NAME;
            }
        }
    }
}

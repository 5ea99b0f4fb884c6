package com.umlcodegen.core.renderer;

/**
 * Interface for output renderers that deliver generated sources.
 *
 * <p>Renderers write generated files to a destination: the filesystem or the console.
 * They are discovered via Java Service Provider Interface (SPI) and selected by id.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.umlcodegen.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Lowercase (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * <p>Implementations should validate required settings and throw
     * {@link IllegalStateException} if configuration is invalid or the destination
     * cannot be written.
     *
     * @param output the generated files to render
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if rendering fails
     */
    void render(GeneratedOutput output, RenderContext context);
}

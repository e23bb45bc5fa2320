package com.furiflow.core.renderer;

/**
 * Writes generated application files to a destination.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GenerationResult result = new CodeGenerator().generate(registry, manifest, snapshot);
 * OutputRenderer renderer = new FileSystemRenderer();
 * renderer.render(result.toOutput(), new RenderContext("build/app", Map.of()));
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the renderer identifier (lowercase, e.g. "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders every file in the output.
     *
     * @param output files to render
     * @param context destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}

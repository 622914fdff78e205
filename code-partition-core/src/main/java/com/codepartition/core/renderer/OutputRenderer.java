package com.codepartition.core.renderer;

/**
 * Writes generated artifacts to a destination.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the renderer identifier, lowercase (e.g. {@code filesystem}).
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes every file of the output.
     *
     * @param output artifacts to write
     * @param context destination settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}

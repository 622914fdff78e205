package com.codepartition.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how a renderer writes.
 *
 * @param outputDirectory target directory
 * @param dryRun true to report what would be written without touching the filesystem
 */
public record RenderContext(
    Path outputDirectory,
    boolean dryRun
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }
}

package com.codepartition.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * An artifact to be written.
 *
 * @param relativePath path below the output directory (e.g. {@code module_tree.json})
 * @param content file content
 * @param contentType media type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String APPLICATION_JSON = "application/json";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank() || relativePath.startsWith("/") || relativePath.contains("..")) {
            throw new IllegalArgumentException("relativePath must stay inside the output directory: " + relativePath);
        }
    }

    public static GeneratedFile json(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, APPLICATION_JSON);
    }

    public int sizeInBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }
}

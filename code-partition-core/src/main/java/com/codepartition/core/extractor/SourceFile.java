package com.codepartition.core.extractor;

import com.codepartition.core.model.Language;

import java.util.Objects;

/**
 * One source file handed to an {@link EntityExtractor}.
 *
 * @param relativePath repository-relative path with {@code /} separators
 * @param language language resolved from the file extension
 * @param content full file text
 */
public record SourceFile(
    String relativePath,
    Language language,
    String content
) {
    public SourceFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns the directory of this file ({@code ""} for the repository root).
     *
     * @return directory part of the relative path
     */
    public String directory() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }
}

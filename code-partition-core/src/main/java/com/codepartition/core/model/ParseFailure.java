package com.codepartition.core.model;

import java.util.Objects;

/**
 * A source file that could not be extracted and was left out of the graph.
 *
 * @param filePath repository-relative file path
 * @param errorType short error category (e.g. "Syntax error", "File read error")
 * @param message human-readable detail
 */
public record ParseFailure(
    String filePath,
    String errorType,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ParseFailure {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(errorType, "errorType must not be null");
        message = message == null ? "" : message;
    }
}

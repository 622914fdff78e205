package com.codepartition.core.extractor;

/**
 * Signals that one source file could not be parsed.
 *
 * <p>Never aborts a run: the {@link ExtractionRunner} turns it into a
 * {@link com.codepartition.core.model.ParseFailure} and continues with the next file.
 */
public class ExtractionException extends Exception {

    private final String errorType;

    public ExtractionException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ExtractionException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * Short category used for statistics, e.g. {@code "Syntax error"}.
     *
     * @return error category
     */
    public String getErrorType() {
        return errorType;
    }
}

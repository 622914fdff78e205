package com.codepartition.core.model;

/**
 * Location of an entity inside its source file.
 *
 * <p>Lines are 1-based and inclusive; offsets are 0-based character offsets,
 * start inclusive and end exclusive.
 *
 * @param startLine first line of the entity
 * @param endLine last line of the entity
 * @param startOffset character offset of the first character
 * @param endOffset character offset one past the last character
 */
public record SourceSpan(
    int startLine,
    int endLine,
    int startOffset,
    int endOffset
) {
    /**
     * Compact constructor with validation.
     */
    public SourceSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid line range: " + startLine + "-" + endLine);
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid offset range: " + startOffset + "-" + endOffset);
        }
    }

    /**
     * Returns the span length in characters.
     *
     * @return number of characters covered
     */
    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Checks whether another span lies entirely inside this one.
     *
     * @param other span to test
     * @return true if {@code other} is enclosed by this span
     */
    public boolean encloses(SourceSpan other) {
        return other.startOffset >= startOffset && other.endOffset <= endOffset;
    }
}

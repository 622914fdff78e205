package com.codepartition.core.util;

/**
 * Counts the tokens of a piece of source text.
 *
 * <p>Implementations must be thread-safe and deterministic.
 */
@FunctionalInterface
public interface TokenCounter {

    /**
     * Counts the tokens of the given text.
     *
     * @param text text to count, may be empty
     * @return token count, never negative
     */
    int count(String text);
}

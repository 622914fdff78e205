package com.codepartition.core;

/**
 * Root of the fatal errors raised while partitioning a repository.
 *
 * <p>Recoverable conditions (parse failures, unresolved references, oversized
 * entities) are reported as data and never surface as this exception.
 */
public class PartitionException extends RuntimeException {

    public PartitionException(String message) {
        super(message);
    }

    public PartitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

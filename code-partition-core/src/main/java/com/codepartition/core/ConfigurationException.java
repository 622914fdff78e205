package com.codepartition.core;

import java.util.List;

/**
 * Raised when the partition configuration is semantically invalid.
 *
 * <p>Thrown before any source file is read.
 */
public class ConfigurationException extends PartitionException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    /**
     * Returns every violated constraint.
     *
     * @return constraint messages
     */
    public List<String> getViolations() {
        return violations;
    }
}

package com.codepartition.core;

/**
 * Raised when a structural invariant of the dependency graph or the module tree
 * does not hold. Always indicates a defect; the run is aborted instead of
 * emitting a wrong tree.
 */
public class InvariantViolationException extends PartitionException {

    /**
     * Invariant names used in diagnostics.
     */
    public static final String PARTITION = "partition";
    public static final String ACYCLICITY = "acyclicity";
    public static final String DEPTH_BOUND = "depth-bound";
    public static final String GROUP_INTEGRITY = "group-integrity";

    private final String invariant;

    public InvariantViolationException(String invariant, String detail) {
        super("Invariant '" + invariant + "' violated: " + detail);
        this.invariant = invariant;
    }

    public String getInvariant() {
        return invariant;
    }
}

package com.codepartition.core.model;

/**
 * Kinds of directed relations between entities.
 */
public enum RelationKind {
    /** Import, include, require or using directive */
    IMPORT,

    /** Function or method invocation */
    CALL,

    /** Extends or implements */
    INHERIT,

    /** Any other type usage (instantiation, field or parameter type) */
    REFERENCE
}

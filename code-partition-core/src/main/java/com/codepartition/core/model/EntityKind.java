package com.codepartition.core.model;

/**
 * Kinds of code entities tracked in the dependency graph.
 */
public enum EntityKind {
    /** A whole source file; owns module-level code such as imports and globals */
    FILE,

    /** Class declaration (including records and abstract classes) */
    CLASS,

    /** Interface or protocol declaration */
    INTERFACE,

    /** Enumeration declaration */
    ENUM,

    /** Struct declaration (C, C++, C#) */
    STRUCT,

    /** Free-standing function */
    FUNCTION,

    /** Function declared inside a type */
    METHOD,

    /** Constructor of a type */
    CONSTRUCTOR;

    /**
     * Returns true for kinds that introduce a scope other declarations can nest in.
     *
     * @return true for type-like kinds
     */
    public boolean isType() {
        return this == CLASS || this == INTERFACE || this == ENUM || this == STRUCT;
    }

    /**
     * Returns true for callable kinds.
     *
     * @return true for functions, methods and constructors
     */
    public boolean isCallable() {
        return this == FUNCTION || this == METHOD || this == CONSTRUCTOR;
    }
}

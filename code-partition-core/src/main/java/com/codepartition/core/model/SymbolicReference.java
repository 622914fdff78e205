package com.codepartition.core.model;

import java.util.Objects;

/**
 * A relation as seen from inside one file: the source is local, the target is
 * still a symbolic name that the graph builder resolves later.
 *
 * @param fromLocalName local name of the referencing declaration; empty for the file itself
 * @param target symbolic target (dotted name, or repository-relative path when {@code pathTarget})
 * @param kind relation kind
 * @param pathTarget true if {@code target} is a file path rather than a symbol
 * @param includeSearch true if a path target that matches no file exactly may be looked
 *                      up by suffix, as for include directives resolved through a search path
 */
public record SymbolicReference(
    String fromLocalName,
    String target,
    RelationKind kind,
    boolean pathTarget,
    boolean includeSearch
) {
    /**
     * Compact constructor with validation.
     */
    public SymbolicReference {
        Objects.requireNonNull(fromLocalName, "fromLocalName must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates a symbol-name reference.
     *
     * @param fromLocalName referencing declaration
     * @param target dotted symbol name
     * @param kind relation kind
     * @return symbolic reference
     */
    public static SymbolicReference symbol(String fromLocalName, String target, RelationKind kind) {
        return new SymbolicReference(fromLocalName, target, kind, false, false);
    }

    /**
     * Creates a file-path import reference originating from the file itself.
     *
     * @param relativePath repository-relative path, with or without extension
     * @return symbolic reference that only matches that exact path
     */
    public static SymbolicReference path(String relativePath) {
        return new SymbolicReference("", relativePath, RelationKind.IMPORT, true, false);
    }

    /**
     * Creates an include reference whose path may also match a unique file ending with it.
     *
     * @param relativePath include path resolved against the including file's directory
     * @return symbolic reference
     */
    public static SymbolicReference include(String relativePath) {
        return new SymbolicReference("", relativePath, RelationKind.IMPORT, true, true);
    }
}

package com.codepartition.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A resolved, directed relation between two entities of the graph.
 *
 * @param fromId id of the depending entity
 * @param toId id of the entity depended upon
 * @param kind relation kind
 */
public record Relation(
    String fromId,
    String toId,
    RelationKind kind
) {
    /** Canonical relation order: source, target, kind. */
    public static final Comparator<Relation> ORDER = Comparator
        .comparing(Relation::fromId)
        .thenComparing(Relation::toId)
        .thenComparing(Relation::kind);

    /**
     * Compact constructor with validation.
     */
    public Relation {
        Objects.requireNonNull(fromId, "fromId must not be null");
        Objects.requireNonNull(toId, "toId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}

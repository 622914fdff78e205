package com.codepartition.core.model;

/**
 * A reference that pointed outside the analyzed entity set and was dropped.
 *
 * @param fromId id of the referencing entity
 * @param target symbolic target as written
 * @param kind relation kind
 */
public record UnresolvedReference(
    String fromId,
    String target,
    RelationKind kind
) {
}

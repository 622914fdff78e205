package com.codepartition.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Repository-wide dependency graph of entities and resolved relations.
 *
 * <p>Entities are kept in canonical order (file path, then declaration order)
 * and relations in {@link Relation#ORDER}. Every relation endpoint is an entity
 * of this graph; references that could not be resolved are listed in
 * {@link #unresolvedReferences()} instead.
 *
 * @param entities entities keyed by id, in canonical order
 * @param relations resolved relations in canonical order
 * @param unresolvedReferences dropped references
 */
public record DependencyGraph(
    Map<String, Entity> entities,
    List<Relation> relations,
    List<UnresolvedReference> unresolvedReferences
) {
    /**
     * Compact constructor with validation.
     */
    public DependencyGraph {
        Objects.requireNonNull(entities, "entities must not be null");
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        relations = relations == null ? List.of() : List.copyOf(relations);
        unresolvedReferences = unresolvedReferences == null ? List.of() : List.copyOf(unresolvedReferences);
        for (Relation relation : relations) {
            if (!entities.containsKey(relation.fromId()) || !entities.containsKey(relation.toId())) {
                throw new IllegalArgumentException("relation endpoint not in graph: " + relation);
            }
        }
    }

    /**
     * Creates an empty graph.
     *
     * @return graph without entities
     */
    public static DependencyGraph empty() {
        return new DependencyGraph(Map.of(), List.of(), List.of());
    }

    /**
     * Looks up an entity.
     *
     * @param id entity id
     * @return the entity, or null if absent
     */
    public Entity entity(String id) {
        return entities.get(id);
    }

    /**
     * Returns the number of entities.
     *
     * @return entity count
     */
    public int size() {
        return entities.size();
    }

    /**
     * Builds the successor lists of every entity, in canonical order.
     *
     * <p>Parallel relations of different kinds collapse into one successor.
     *
     * @return successors keyed by entity id; every entity has an entry
     */
    public Map<String, List<String>> successors() {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        entities.keySet().forEach(id -> adjacency.put(id, new ArrayList<>()));
        for (Relation relation : relations) {
            List<String> targets = adjacency.get(relation.fromId());
            if (!targets.contains(relation.toId())) {
                targets.add(relation.toId());
            }
        }
        return adjacency;
    }

    /**
     * Sums the token counts of all entities.
     *
     * @return total tokens
     */
    public long totalTokens() {
        return entities.values().stream().mapToLong(Entity::tokenCount).sum();
    }
}

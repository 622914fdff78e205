package com.codepartition.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The dependency graph with every strongly connected component collapsed into
 * an {@link EntityGroup}. Acyclic by construction.
 *
 * @param groups groups in id order
 * @param groupOfEntity group id of every entity
 * @param successors successor group ids of every group, sorted, without self-loops
 */
public record CondensedGraph(
    List<EntityGroup> groups,
    Map<String, String> groupOfEntity,
    Map<String, List<String>> successors
) {
    /**
     * Compact constructor with validation.
     */
    public CondensedGraph {
        Objects.requireNonNull(groups, "groups must not be null");
        Objects.requireNonNull(groupOfEntity, "groupOfEntity must not be null");
        Objects.requireNonNull(successors, "successors must not be null");
        groups = List.copyOf(groups);
        groupOfEntity = Collections.unmodifiableMap(new LinkedHashMap<>(groupOfEntity));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        successors.forEach((id, targets) -> copy.put(id, List.copyOf(targets)));
        successors = Collections.unmodifiableMap(copy);
    }

    /**
     * Looks up a group by id.
     *
     * @param groupId group id
     * @return the group, or null if absent
     */
    public EntityGroup group(String groupId) {
        return groups.stream().filter(group -> group.id().equals(groupId)).findFirst().orElse(null);
    }

    /**
     * Returns the number of groups that contain more than one entity.
     *
     * @return cyclic group count
     */
    public long cyclicGroupCount() {
        return groups.stream().filter(EntityGroup::cyclic).count();
    }
}

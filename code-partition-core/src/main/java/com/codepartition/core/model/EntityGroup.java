package com.codepartition.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A strongly connected component of the dependency graph, condensed to one node.
 *
 * <p>Entities that are not part of a cycle form singleton groups. A group is the
 * smallest unit the clustering engine moves around: it is never split.
 *
 * @param id group id ({@code g0}, {@code g1}, ...)
 * @param memberIds member entity ids in canonical order
 * @param tokenCount sum of member token counts
 * @param anchorPath file path of the first member (ordering key)
 * @param anchorOrdinal declaration ordinal of the first member (ordering key)
 */
public record EntityGroup(
    String id,
    List<String> memberIds,
    long tokenCount,
    String anchorPath,
    int anchorOrdinal
) {
    /**
     * Compact constructor with validation.
     */
    public EntityGroup {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(anchorPath, "anchorPath must not be null");
        if (memberIds == null || memberIds.isEmpty()) {
            throw new IllegalArgumentException("group " + id + " has no members");
        }
        memberIds = List.copyOf(memberIds);
    }

    /**
     * Returns true if the group stems from a dependency cycle.
     *
     * @return true for groups with more than one member
     */
    public boolean cyclic() {
        return memberIds.size() > 1;
    }

    /**
     * Returns the directory of the anchor file ({@code ""} for the repository root).
     *
     * @return anchor directory
     */
    public String directory() {
        int slash = anchorPath.lastIndexOf('/');
        return slash < 0 ? "" : anchorPath.substring(0, slash);
    }
}

package com.codepartition.core.cluster;

import com.codepartition.core.model.EntityGroup;

import java.util.ArrayList;
import java.util.List;

/**
 * Intermediate result of clustering: either a leaf holding whole groups, or an inner
 * node with ordered children. Turned into {@code Module}s by the
 * {@link ModuleTreeAssembler}.
 *
 * @param depth depth of the node (root = 0)
 * @param units groups owned by a leaf, in sequence order; empty for inner nodes
 * @param children child nodes; empty for leaves
 */
public record ClusterNode(
    int depth,
    List<EntityGroup> units,
    List<ClusterNode> children
) {
    public ClusterNode {
        units = units == null ? List.of() : List.copyOf(units);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ClusterNode leaf(int depth, List<EntityGroup> units) {
        return new ClusterNode(depth, units, List.of());
    }

    public static ClusterNode inner(int depth, List<ClusterNode> children) {
        return new ClusterNode(depth, List.of(), children);
    }

    public boolean leaf() {
        return children.isEmpty();
    }

    /**
     * Sums the tokens of every group in the subtree.
     *
     * @return token total
     */
    public long tokenCount() {
        if (leaf()) {
            return units.stream().mapToLong(EntityGroup::tokenCount).sum();
        }
        return children.stream().mapToLong(ClusterNode::tokenCount).sum();
    }

    /**
     * Collects the groups of the subtree in leaf order.
     *
     * @return all groups below this node
     */
    public List<EntityGroup> allUnits() {
        List<EntityGroup> all = new ArrayList<>(units);
        children.forEach(child -> all.addAll(child.allUnits()));
        return all;
    }
}

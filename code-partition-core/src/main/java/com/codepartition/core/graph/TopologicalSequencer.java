package com.codepartition.core.graph;

import com.codepartition.core.InvariantViolationException;
import com.codepartition.core.model.CondensedGraph;
import com.codepartition.core.model.EntityGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orders the groups of a condensed graph so that every group precedes the groups it
 * depends on.
 *
 * <p>Kahn's algorithm; among groups that are free at the same time the one whose anchor
 * comes first by file path, then declaration order, goes first.
 */
public class TopologicalSequencer {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSequencer.class);

    static final Comparator<EntityGroup> ANCHOR_ORDER = Comparator
        .comparing(EntityGroup::anchorPath)
        .thenComparingInt(EntityGroup::anchorOrdinal)
        .thenComparing(EntityGroup::id);

    /**
     * Sequences the groups.
     *
     * @param condensed condensed graph
     * @return every group exactly once, in dependency order
     * @throws InvariantViolationException if the condensed graph contains a cycle
     */
    public List<EntityGroup> sequence(CondensedGraph condensed) {
        Map<String, Integer> inDegree = new HashMap<>();
        condensed.groups().forEach(group -> inDegree.put(group.id(), 0));
        condensed.successors().values()
            .forEach(targets -> targets.forEach(target -> inDegree.merge(target, 1, Integer::sum)));

        Map<String, EntityGroup> byId = new HashMap<>();
        condensed.groups().forEach(group -> byId.put(group.id(), group));

        PriorityQueue<EntityGroup> ready = new PriorityQueue<>(ANCHOR_ORDER);
        condensed.groups().stream().filter(group -> inDegree.get(group.id()) == 0).forEach(ready::add);

        List<EntityGroup> order = new ArrayList<>(condensed.groups().size());
        while (!ready.isEmpty()) {
            EntityGroup group = ready.poll();
            order.add(group);
            for (String target : condensed.successors().getOrDefault(group.id(), List.of())) {
                if (inDegree.merge(target, -1, Integer::sum) == 0) {
                    ready.add(byId.get(target));
                }
            }
        }

        if (order.size() != condensed.groups().size()) {
            throw new InvariantViolationException(InvariantViolationException.ACYCLICITY,
                (condensed.groups().size() - order.size()) + " group(s) remain on a cycle after condensation");
        }
        log.debug("Sequenced {} groups", order.size());
        return order;
    }
}

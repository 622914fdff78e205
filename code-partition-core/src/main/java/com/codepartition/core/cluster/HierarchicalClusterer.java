package com.codepartition.core.cluster;

import com.codepartition.core.model.EntityGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursively partitions the sequenced groups into a token-budgeted tree.
 *
 * <p>At depth {@code d} a set of groups becomes a leaf when {@code d} is the maximum
 * depth, when it is a single group, or when its tokens fit {@link ClusteringSettings#leafCap()}.
 * Otherwise it is packed into buckets and each bucket is partitioned at {@code d + 1}.
 * Bucket capacity is the leaf cap when the next level is the last one, or when the whole
 * set would fit a single module-budget bucket; otherwise it is the module budget.
 *
 * <p>Packing walks <i>affinity runs</i>, maximal stretches of consecutive groups that
 * share a directory, in sequence order:
 * <ul>
 *   <li>a run that fits into the open bucket joins it</li>
 *   <li>a run that fits into an empty bucket closes the open bucket and starts a new one</li>
 *   <li>a larger run is poured group by group</li>
 * </ul>
 * A group is never split. A single group above the capacity gets a bucket of its own.
 * All decisions depend only on positions in the sequence, so equal input gives an equal tree.
 */
public class HierarchicalClusterer {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalClusterer.class);

    private final ClusteringSettings settings;

    public HierarchicalClusterer(ClusteringSettings settings) {
        this.settings = settings;
    }

    /**
     * Clusters the groups.
     *
     * @param sequence every group of the condensed graph in topological order
     * @return root of the cluster tree
     */
    public ClusterNode cluster(List<EntityGroup> sequence) {
        ClusterNode root = partition(sequence, 0);
        log.info("Clustered {} groups ({} tokens) under budgets {}/{} and max depth {}",
            sequence.size(), root.tokenCount(), settings.maxTokenPerModule(), settings.maxTokenPerLeafModule(),
            settings.maxDepth());
        return root;
    }

    private ClusterNode partition(List<EntityGroup> units, int depth) {
        long total = tokens(units);
        if (depth >= settings.maxDepth() || units.size() <= 1 || total <= settings.leafCap()) {
            return ClusterNode.leaf(depth, units);
        }

        long capacity = depth + 1 == settings.maxDepth() || total <= settings.maxTokenPerModule()
            ? settings.leafCap()
            : settings.maxTokenPerModule();
        List<List<EntityGroup>> buckets = pack(units, capacity);
        if (buckets.size() < 2) {
            return ClusterNode.leaf(depth, units);
        }
        log.debug("Depth {}: split {} groups ({} tokens) into {} buckets of capacity {}",
            depth, units.size(), total, buckets.size(), capacity);

        List<ClusterNode> children = new ArrayList<>(buckets.size());
        for (List<EntityGroup> bucket : buckets) {
            children.add(partition(bucket, depth + 1));
        }
        return ClusterNode.inner(depth, children);
    }

    /**
     * Greedy bin packing over affinity runs.
     */
    List<List<EntityGroup>> pack(List<EntityGroup> units, long capacity) {
        List<List<EntityGroup>> buckets = new ArrayList<>();
        List<EntityGroup> open = new ArrayList<>();
        long openTokens = 0;

        for (List<EntityGroup> run : affinityRuns(units)) {
            long runTokens = tokens(run);
            if (openTokens + runTokens <= capacity) {
                open.addAll(run);
                openTokens += runTokens;
            } else if (runTokens <= capacity) {
                close(buckets, open);
                open = new ArrayList<>(run);
                openTokens = runTokens;
            } else {
                for (EntityGroup unit : run) {
                    if (!open.isEmpty() && openTokens + unit.tokenCount() > capacity) {
                        close(buckets, open);
                        open = new ArrayList<>();
                        openTokens = 0;
                    }
                    open.add(unit);
                    openTokens += unit.tokenCount();
                }
            }
        }
        close(buckets, open);
        return buckets;
    }

    private static List<List<EntityGroup>> affinityRuns(List<EntityGroup> units) {
        List<List<EntityGroup>> runs = new ArrayList<>();
        List<EntityGroup> run = new ArrayList<>();
        for (EntityGroup unit : units) {
            if (!run.isEmpty() && !run.get(run.size() - 1).directory().equals(unit.directory())) {
                runs.add(run);
                run = new ArrayList<>();
            }
            run.add(unit);
        }
        if (!run.isEmpty()) {
            runs.add(run);
        }
        return runs;
    }

    private static void close(List<List<EntityGroup>> buckets, List<EntityGroup> open) {
        if (!open.isEmpty()) {
            buckets.add(List.copyOf(open));
        }
    }

    private static long tokens(List<EntityGroup> units) {
        return units.stream().mapToLong(EntityGroup::tokenCount).sum();
    }
}

package com.codepartition.core.cluster;

import com.codepartition.core.InvariantViolationException;
import com.codepartition.core.model.CondensedGraph;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.Entity;
import com.codepartition.core.model.EntityGroup;
import com.codepartition.core.model.Module;
import com.codepartition.core.model.ModuleTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a cluster tree, or a previously saved module tree, into the final immutable
 * {@link ModuleTree} and checks its structural invariants.
 *
 * <p>Module ids are positional ({@code root}, {@code root.1}, {@code root.1.2}); token
 * totals, depth and the leaf, oversized and complex flags are computed here. Every
 * violation of the partition, depth-bound or group-integrity invariant is fatal.
 */
public class ModuleTreeAssembler {

    private static final Logger log = LoggerFactory.getLogger(ModuleTreeAssembler.class);

    public static final String ROOT_ID = "root";

    private final ClusteringSettings settings;
    private final String projectName;

    /**
     * Creates an assembler.
     *
     * @param settings budgets used for the oversized flag and the depth check
     * @param projectName name of the root module
     */
    public ModuleTreeAssembler(ClusteringSettings settings, String projectName) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.projectName = Objects.requireNonNull(projectName, "projectName must not be null");
    }

    /**
     * Assembles the clustering result.
     *
     * @param root root cluster node
     * @param graph dependency graph that was clustered
     * @param condensed its condensation
     * @return validated module tree
     * @throws InvariantViolationException if the tree breaks an invariant
     */
    public ModuleTree assemble(ClusterNode root, DependencyGraph graph, CondensedGraph condensed) {
        Map<String, Integer> graphOrder = graphOrder(graph);
        ModuleTree tree = new ModuleTree(build(root, ROOT_ID, projectName, graph, graphOrder));
        validate(tree, graph, condensed, true);
        log.info("Assembled module tree: {} modules, {} leaves, depth {}",
            tree.processingOrder().size(), tree.leafCount(), tree.maxDepthReached());
        return tree;
    }

    /**
     * Re-assembles a saved module tree over the current graph.
     *
     * <p>The saved structure and names are kept; ids, depths, token totals and flags are
     * recomputed. A saved tree that splits a cyclic group is accepted with a warning.
     *
     * @param saved root of the saved tree
     * @param graph current dependency graph
     * @param condensed its condensation
     * @return validated module tree
     * @throws InvariantViolationException if the saved tree no longer partitions the entities
     */
    public ModuleTree reassemble(Module saved, DependencyGraph graph, CondensedGraph condensed) {
        ModuleTree tree = new ModuleTree(rebuild(saved, ROOT_ID, 0, graph, condensed));
        validate(tree, graph, condensed, false);
        log.info("Re-assembled saved module tree: {} modules, {} leaves",
            tree.processingOrder().size(), tree.leafCount());
        return tree;
    }

    // ==================== Construction ====================

    private Module build(ClusterNode node, String id, String name, DependencyGraph graph,
                         Map<String, Integer> graphOrder) {
        if (node.leaf()) {
            List<String> entityIds = new ArrayList<>();
            node.units().forEach(unit -> entityIds.addAll(unit.memberIds()));
            entityIds.sort(Comparator.comparing(graphOrder::get));
            long tokens = node.tokenCount();
            boolean oversized = node.units().size() == 1 && tokens > settings.maxTokenPerLeafModule();
            return new Module(id, name, true, tokens, node.depth(), oversized, spansFiles(entityIds, graph),
                entityIds, List.of());
        }

        List<String> names = new ArrayList<>();
        for (ClusterNode child : node.children()) {
            Set<String> files = new LinkedHashSet<>();
            child.allUnits().forEach(unit -> unit.memberIds().forEach(member -> files.add(graph.entity(member).filePath())));
            names.add(ModuleNamer.nameFor(files));
        }
        List<String> uniqueNames = ModuleNamer.uniqueNames(names);

        List<Module> children = new ArrayList<>();
        for (int i = 0; i < node.children().size(); i++) {
            children.add(build(node.children().get(i), id + "." + (i + 1), uniqueNames.get(i), graph, graphOrder));
        }
        long tokens = children.stream().mapToLong(Module::tokenCount).sum();
        return new Module(id, name, false, tokens, node.depth(), false, false, List.of(), children);
    }

    private Module rebuild(Module saved, String id, int depth, DependencyGraph graph, CondensedGraph condensed) {
        if (saved.children().isEmpty()) {
            long tokens = 0;
            Set<String> groups = new LinkedHashSet<>();
            for (String entityId : saved.entityIds()) {
                Entity entity = graph.entity(entityId);
                if (entity != null) {
                    tokens += entity.tokenCount();
                    groups.add(condensed.groupOfEntity().get(entityId));
                }
            }
            boolean oversized = groups.size() == 1 && tokens > settings.maxTokenPerLeafModule();
            return new Module(id, saved.name(), true, tokens, depth, oversized,
                spansFiles(saved.entityIds(), graph), saved.entityIds(), List.of());
        }
        if (!saved.entityIds().isEmpty()) {
            throw new InvariantViolationException(InvariantViolationException.PARTITION,
                "non-leaf module '" + saved.name() + "' owns entities directly");
        }
        List<Module> children = new ArrayList<>();
        for (int i = 0; i < saved.children().size(); i++) {
            children.add(rebuild(saved.children().get(i), id + "." + (i + 1), depth + 1, graph, condensed));
        }
        long tokens = children.stream().mapToLong(Module::tokenCount).sum();
        return new Module(id, saved.name(), false, tokens, depth, false, false, List.of(), children);
    }

    private static boolean spansFiles(List<String> entityIds, DependencyGraph graph) {
        return entityIds.stream()
            .map(graph::entity)
            .filter(Objects::nonNull)
            .map(Entity::filePath)
            .distinct()
            .count() > 1;
    }

    private static Map<String, Integer> graphOrder(DependencyGraph graph) {
        Map<String, Integer> order = new HashMap<>();
        for (String id : graph.entities().keySet()) {
            order.put(id, order.size());
        }
        return order;
    }

    // ==================== Validation ====================

    /**
     * Checks the partition, depth-bound and group-integrity invariants.
     *
     * @param tree assembled tree
     * @param graph dependency graph
     * @param condensed condensation of the graph
     * @param strictGroups whether a split cyclic group is fatal rather than a warning
     * @throws InvariantViolationException on the first violated invariant
     */
    void validate(ModuleTree tree, DependencyGraph graph, CondensedGraph condensed, boolean strictGroups) {
        Map<String, String> owner = new HashMap<>();
        for (Module module : tree.processingOrder()) {
            if (module.depth() > settings.maxDepth()) {
                throw new InvariantViolationException(InvariantViolationException.DEPTH_BOUND,
                    "module " + module.moduleId() + " has depth " + module.depth()
                        + " > max depth " + settings.maxDepth());
            }
            if (!module.leaf()) {
                continue;
            }
            for (String entityId : module.entityIds()) {
                if (graph.entity(entityId) == null) {
                    throw new InvariantViolationException(InvariantViolationException.PARTITION,
                        "module " + module.moduleId() + " lists unknown entity " + entityId);
                }
                String previous = owner.put(entityId, module.moduleId());
                if (previous != null) {
                    throw new InvariantViolationException(InvariantViolationException.PARTITION,
                        "entity " + entityId + " is in both " + previous + " and " + module.moduleId());
                }
            }
        }
        List<String> missing = graph.entities().keySet().stream()
            .filter(id -> !owner.containsKey(id))
            .toList();
        if (!missing.isEmpty()) {
            throw new InvariantViolationException(InvariantViolationException.PARTITION,
                missing.size() + " entities are in no leaf module, first: " + missing.get(0));
        }

        for (EntityGroup group : condensed.groups()) {
            if (!group.cyclic()) {
                continue;
            }
            Set<String> leaves = new LinkedHashSet<>();
            group.memberIds().forEach(member -> leaves.add(owner.get(member)));
            if (leaves.size() > 1) {
                String detail = "group " + group.id() + " is split across " + String.join(", ", leaves);
                if (strictGroups) {
                    throw new InvariantViolationException(InvariantViolationException.GROUP_INTEGRITY, detail);
                }
                log.warn("Saved grouping keeps a dependency cycle apart: {}", detail);
            }
        }
    }
}

package com.codepartition.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rooted, immutable tree of modules produced by the clustering engine.
 *
 * <p>The leaves partition the entity set of the graph the tree was built from.
 *
 * @param root root module (depth 0)
 */
public record ModuleTree(Module root) {

    /**
     * Compact constructor with validation.
     */
    public ModuleTree {
        Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Returns the leaf modules in document order.
     *
     * @return leaf modules
     */
    public List<Module> leaves() {
        List<Module> leaves = new ArrayList<>();
        collectLeaves(root, leaves);
        return leaves;
    }

    /**
     * Returns every module in post-order: children before their parent, leaves first.
     *
     * <p>This is the order in which downstream consumers process modules so that a
     * parent is only handled once all of its children are done.
     *
     * @return modules in processing order; the root is last
     */
    public List<Module> processingOrder() {
        List<Module> order = new ArrayList<>();
        collectPostOrder(root, order);
        return order;
    }

    /**
     * Finds a module by id.
     *
     * @param moduleId module id
     * @return the module, or empty if absent
     */
    public Optional<Module> findModule(String moduleId) {
        return processingOrder().stream()
            .filter(module -> module.moduleId().equals(moduleId))
            .findFirst();
    }

    /**
     * Finds the leaf module owning an entity.
     *
     * @param entityId entity id
     * @return the owning leaf, or empty if the entity is not in the tree
     */
    public Optional<Module> moduleOfEntity(String entityId) {
        return leaves().stream()
            .filter(leaf -> leaf.entityIds().contains(entityId))
            .findFirst();
    }

    public int leafCount() {
        return leaves().size();
    }

    /**
     * Returns the greatest module depth in the tree.
     *
     * @return maximum depth (0 for a single-module tree)
     */
    public int maxDepthReached() {
        return processingOrder().stream().mapToInt(Module::depth).max().orElse(0);
    }

    private static void collectLeaves(Module module, List<Module> leaves) {
        if (module.leaf()) {
            leaves.add(module);
            return;
        }
        for (Module child : module.children()) {
            collectLeaves(child, leaves);
        }
    }

    private static void collectPostOrder(Module module, List<Module> order) {
        for (Module child : module.children()) {
            collectPostOrder(child, order);
        }
        order.add(module);
    }
}

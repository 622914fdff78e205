package com.codepartition.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModuleTreeTest {

    private static final ModuleTree TREE = new ModuleTree(
        inner("root", 0,
            inner("root.1", 1,
                leaf("root.1.1", 2, "a.py"),
                leaf("root.1.2", 2, "b.py", "b.py::B")),
            leaf("root.2", 1, "c.py")));

    @Test
    void leaves_returnsLeavesInDocumentOrder() {
        assertThat(TREE.leaves()).extracting(Module::moduleId).containsExactly("root.1.1", "root.1.2", "root.2");
        assertThat(TREE.leafCount()).isEqualTo(3);
    }

    @Test
    void processingOrder_visitsChildrenBeforeParents() {
        assertThat(TREE.processingOrder()).extracting(Module::moduleId)
            .containsExactly("root.1.1", "root.1.2", "root.1", "root.2", "root");
    }

    @Test
    void findModule_withKnownAndUnknownIds_returnsOptional() {
        assertThat(TREE.findModule("root.1")).map(Module::depth).contains(1);
        assertThat(TREE.findModule("root.9")).isEmpty();
    }

    @Test
    void moduleOfEntity_returnsOwningLeaf() {
        assertThat(TREE.moduleOfEntity("b.py::B")).map(Module::moduleId).contains("root.1.2");
        assertThat(TREE.moduleOfEntity("missing.py")).isEmpty();
    }

    @Test
    void maxDepthReached_returnsDeepestModule() {
        assertThat(TREE.maxDepthReached()).isEqualTo(2);
        assertThat(new ModuleTree(leaf("root", 0, "a.py")).maxDepthReached()).isZero();
    }

    @Test
    void module_withNullLists_usesEmptyLists() {
        Module module = new Module("root", "demo", true, 0, 0, false, false, null, null);

        assertThat(module.entityIds()).isEmpty();
        assertThat(module.children()).isEmpty();
    }

    private static Module leaf(String id, int depth, String... entityIds) {
        return new Module(id, id, true, 10, depth, false, false, List.of(entityIds), List.of());
    }

    private static Module inner(String id, int depth, Module... children) {
        return new Module(id, id, false, 0, depth, false, false, List.of(), List.of(children));
    }
}

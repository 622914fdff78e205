package com.codepartition.core.graph;

import com.codepartition.core.InvariantViolationException;
import com.codepartition.core.model.CondensedGraph;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.EntityGroup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.codepartition.core.graph.GraphFixtures.call;
import static com.codepartition.core.graph.GraphFixtures.file;
import static com.codepartition.core.graph.GraphFixtures.graph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologicalSequencerTest {

    private final TopologicalSequencer sequencer = new TopologicalSequencer();

    @Test
    void sequence_withoutEdges_ordersByAnchorPath() {
        // Given: independent groups whose ids disagree with their paths
        CondensedGraph condensed = new CondensedGraph(
            List.of(group("g0", "z.py"), group("g1", "a.py"), group("g2", "m.py")),
            Map.of("z.py", "g0", "a.py", "g1", "m.py", "g2"),
            Map.of("g0", List.of(), "g1", List.of(), "g2", List.of()));

        // When: sequencing
        List<EntityGroup> order = sequencer.sequence(condensed);

        // Then: path order breaks the ties
        assertThat(order).extracting(EntityGroup::anchorPath).containsExactly("a.py", "m.py", "z.py");
    }

    @Test
    void sequence_withEdge_putsSourceBeforeTarget() {
        // Given: z depends on a
        CondensedGraph condensed = new CondensedGraph(
            List.of(group("g0", "z.py"), group("g1", "a.py")),
            Map.of("z.py", "g0", "a.py", "g1"),
            Map.of("g0", List.of("g1"), "g1", List.of()));

        // When: sequencing
        List<EntityGroup> order = sequencer.sequence(condensed);

        // Then: the dependency edge overrides path order
        assertThat(order).extracting(EntityGroup::id).containsExactly("g0", "g1");
    }

    @Test
    void sequence_withCondensedGraph_respectsEveryEdge() {
        // Given: a diamond condensed from a real graph
        DependencyGraph graph = graph(
            List.of(file("a.py", 1), file("b.py", 1), file("c.py", 1), file("d.py", 1)),
            call("d.py", "b.py"), call("d.py", "c.py"), call("b.py", "a.py"), call("c.py", "a.py"));
        CondensedGraph condensed = new CycleResolver().condense(graph);

        // When: sequencing
        List<EntityGroup> order = sequencer.sequence(condensed);

        // Then: every edge points forward
        List<String> ids = order.stream().map(EntityGroup::id).toList();
        condensed.successors().forEach((from, targets) -> targets.forEach(
            to -> assertThat(ids.indexOf(from)).isLessThan(ids.indexOf(to))));
        assertThat(order).extracting(EntityGroup::anchorPath).containsExactly("d.py", "b.py", "c.py", "a.py");
    }

    @Test
    void sequence_withCycle_throwsAcyclicityViolation() {
        // Given: a hand-made condensation that still contains a cycle
        CondensedGraph condensed = new CondensedGraph(
            List.of(group("g0", "a.py"), group("g1", "b.py")),
            Map.of("a.py", "g0", "b.py", "g1"),
            Map.of("g0", List.of("g1"), "g1", List.of("g0")));

        // When/Then: sequencing fails loudly
        assertThatThrownBy(() -> sequencer.sequence(condensed))
            .isInstanceOfSatisfying(InvariantViolationException.class,
                e -> assertThat(e.getInvariant()).isEqualTo(InvariantViolationException.ACYCLICITY));
    }

    private static EntityGroup group(String id, String path) {
        return new EntityGroup(id, List.of(path), 1, path, 0);
    }
}

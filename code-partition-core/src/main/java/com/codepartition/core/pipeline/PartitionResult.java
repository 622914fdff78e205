package com.codepartition.core.pipeline;

import com.codepartition.core.extractor.ExtractionReport;
import com.codepartition.core.model.CondensedGraph;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.ModuleTree;

import java.util.List;
import java.util.Objects;

/**
 * Everything a partition run produced.
 *
 * @param tree validated module tree
 * @param graph dependency graph the tree partitions
 * @param condensed condensation of the graph
 * @param report extraction report with parse failures and statistics
 * @param warnings user-facing warnings (parse failures, oversized modules)
 */
public record PartitionResult(
    ModuleTree tree,
    DependencyGraph graph,
    CondensedGraph condensed,
    ExtractionReport report,
    List<String> warnings
) {
    public PartitionResult {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(condensed, "condensed must not be null");
        Objects.requireNonNull(report, "report must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}

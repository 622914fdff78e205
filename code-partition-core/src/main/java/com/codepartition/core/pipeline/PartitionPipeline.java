package com.codepartition.core.pipeline;

import com.codepartition.core.PartitionException;
import com.codepartition.core.cluster.ClusterNode;
import com.codepartition.core.cluster.ClusteringSettings;
import com.codepartition.core.cluster.HierarchicalClusterer;
import com.codepartition.core.cluster.ModuleTreeAssembler;
import com.codepartition.core.cluster.SavedGroupingLoader;
import com.codepartition.core.config.PartitionConfig;
import com.codepartition.core.extractor.ExtractionReport;
import com.codepartition.core.extractor.ExtractionRunner;
import com.codepartition.core.graph.CycleResolver;
import com.codepartition.core.graph.GraphBuilder;
import com.codepartition.core.graph.TopologicalSequencer;
import com.codepartition.core.model.CondensedGraph;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.EntityGroup;
import com.codepartition.core.model.Module;
import com.codepartition.core.model.ModuleTree;
import com.codepartition.core.model.ParseFailure;
import com.codepartition.core.util.FileUtils;
import com.codepartition.core.util.JtokkitTokenCounter;
import com.codepartition.core.util.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the whole partition: extraction, graph building, cycle condensation,
 * sequencing, clustering and tree assembly.
 *
 * <p>The configuration is validated when the pipeline is created, before any file is
 * read. Extraction runs in parallel; every later stage runs on the calling thread.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PartitionConfig config = ConfigLoader.load(root.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * PartitionResult result = new PartitionPipeline(config).run(root);
 * result.tree().leaves().forEach(leaf -> ...);
 * }</pre>
 */
public class PartitionPipeline {

    private static final Logger log = LoggerFactory.getLogger(PartitionPipeline.class);

    private final PartitionConfig config;
    private final TokenCounter tokenCounter;

    /**
     * Creates a pipeline counting tokens with the configured JTokkit encoding.
     *
     * @param config configuration
     * @throws com.codepartition.core.ConfigurationException if the configuration is invalid
     */
    public PartitionPipeline(PartitionConfig config) {
        this(validated(config), new JtokkitTokenCounter(config.extraction().encoding()));
    }

    /**
     * Creates a pipeline with a custom token counter.
     *
     * @param config configuration
     * @param tokenCounter token counter
     * @throws com.codepartition.core.ConfigurationException if the configuration is invalid
     */
    public PartitionPipeline(PartitionConfig config, TokenCounter tokenCounter) {
        this.config = validated(config);
        this.tokenCounter = tokenCounter;
    }

    /**
     * Partitions every source file selected by the configured include and exclude patterns.
     *
     * @param repositoryRoot repository root
     * @return partition result
     * @throws PartitionException if the sources cannot be listed or an invariant is violated
     */
    public PartitionResult run(Path repositoryRoot) {
        List<Path> files;
        try {
            files = FileUtils.resolveSources(repositoryRoot, config.sources().include(), config.sources().exclude());
        } catch (IOException e) {
            throw new PartitionException("Failed to list source files under " + repositoryRoot, e);
        }
        log.info("Found {} source files under {}", files.size(), repositoryRoot);
        return run(repositoryRoot, files);
    }

    /**
     * Partitions the given files.
     *
     * @param repositoryRoot repository root used for relative paths
     * @param files files to partition
     * @return partition result
     * @throws com.codepartition.core.InvariantViolationException if the tree breaks an invariant
     */
    public PartitionResult run(Path repositoryRoot, List<Path> files) {
        List<String> warnings = new ArrayList<>();

        ExtractionReport report = new ExtractionRunner(config.extraction().effectiveThreads())
            .run(repositoryRoot, files);
        for (ParseFailure failure : report.failures()) {
            warnings.add("Skipped " + failure.filePath() + ": " + failure.errorType() + " (" + failure.message() + ")");
        }

        DependencyGraph graph = new GraphBuilder(tokenCounter).build(report.extractions());
        CondensedGraph condensed = new CycleResolver().condense(graph);
        List<EntityGroup> sequence = new TopologicalSequencer().sequence(condensed);

        ClusteringSettings settings = ClusteringSettings.from(config.clustering());
        ModuleTreeAssembler assembler = new ModuleTreeAssembler(settings, projectName(repositoryRoot));
        ModuleTree tree;
        String savedGrouping = config.clustering().savedGrouping();
        if (savedGrouping != null && !savedGrouping.isBlank()) {
            Module saved = SavedGroupingLoader.load(repositoryRoot.resolve(savedGrouping));
            tree = assembler.reassemble(saved, graph, condensed);
        } else {
            ClusterNode root = new HierarchicalClusterer(settings).cluster(sequence);
            tree = assembler.assemble(root, graph, condensed);
        }

        for (Module leaf : tree.leaves()) {
            if (leaf.oversized()) {
                String warning = "Oversized module " + leaf.moduleId() + " (" + String.join(", ", leaf.entityIds())
                    + "): " + leaf.tokenCount() + " tokens exceed the leaf budget of "
                    + settings.maxTokenPerLeafModule();
                log.warn(warning);
                warnings.add(warning);
            }
        }

        log.info("Partitioned {} entities into {} leaf modules (max depth {})",
            graph.size(), tree.leafCount(), tree.maxDepthReached());
        return new PartitionResult(tree, graph, condensed, report, warnings);
    }

    public PartitionConfig getConfig() {
        return config;
    }

    private String projectName(Path repositoryRoot) {
        String configured = config.project().name();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        Path fileName = repositoryRoot.toAbsolutePath().normalize().getFileName();
        return fileName == null ? "root" : fileName.toString();
    }

    private static PartitionConfig validated(PartitionConfig config) {
        config.validate();
        return config;
    }
}

package com.codepartition.cli;

import com.codepartition.core.ConfigurationException;
import com.codepartition.core.InvariantViolationException;
import com.codepartition.core.config.ConfigLoader;
import com.codepartition.core.config.PartitionConfig;
import com.codepartition.core.model.Module;
import com.codepartition.core.model.ModuleTree;
import com.codepartition.core.pipeline.PartitionPipeline;
import com.codepartition.core.pipeline.PartitionResult;
import com.codepartition.core.renderer.ArtifactGenerator;
import com.codepartition.core.renderer.GeneratedOutput;
import com.codepartition.core.renderer.RenderContext;
import com.codepartition.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to partition a repository and write the module tree artifacts.
 *
 * <p>Steps:
 * <ol>
 *   <li>Load {@code codepartition.yaml} and apply command-line overrides</li>
 *   <li>Run the partition pipeline</li>
 *   <li>Print a summary of the tree and any warnings</li>
 *   <li>Write the artifacts unless {@code --dry-run} is given</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze the current directory
 * codepartition analyze
 *
 * # Analyze with tighter budgets
 * codepartition analyze /path/to/repo --max-tokens-per-leaf 8000 --max-depth 3
 *
 * # Show the tree without writing artifacts
 * codepartition analyze --dry-run
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Partition a repository into a module tree and write the artifacts",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(
        index = "0",
        description = "Repository directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <repository>/codepartition.yaml)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(names = {"--max-depth"}, description = "Maximum module tree depth (overrides config)")
    private Integer maxDepth;

    @Option(names = {"--max-tokens-per-module"}, description = "Token budget of non-leaf levels (overrides config)")
    private Long maxTokensPerModule;

    @Option(names = {"--max-tokens-per-leaf"}, description = "Token budget of leaf modules (overrides config)")
    private Long maxTokensPerLeaf;

    @Option(names = {"--dry-run"}, description = "Partition and print the summary without writing artifacts")
    private boolean dryRun;

    @Override
    public Integer call() {
        Path root = projectPath.toAbsolutePath().normalize();
        try {
            log.info("Starting analysis of: {}", root);
            System.out.println("Analyzing repository: " + root);
            System.out.println();

            PartitionConfig config = loadConfiguration(root);
            PartitionPipeline pipeline = new PartitionPipeline(config);
            PartitionResult result = pipeline.run(root);

            printSummary(result);
            for (String warning : result.warnings()) {
                System.out.println("⚠ " + warning);
            }

            Path output = resolveOutputDirectory(root, config);
            GeneratedOutput artifacts = new ArtifactGenerator().generate(result, config, root);
            new FileSystemRenderer().render(artifacts, new RenderContext(output, dryRun));

            System.out.println();
            if (dryRun) {
                System.out.println("Dry-run mode: " + artifacts.files().size() + " artifacts not written");
            } else {
                System.out.println("✓ Wrote " + artifacts.files().size() + " artifacts to: " + output);
            }
            return ExitCodes.SUCCESS;

        } catch (ConfigurationException e) {
            log.error("Invalid configuration", e);
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (InvariantViolationException e) {
            log.error("Partition aborted: invariant '{}' violated", e.getInvariant(), e);
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.FAILURE;
        } catch (RuntimeException e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private PartitionConfig loadConfiguration(Path root) {
        Path path = configPath != null ? configPath : root.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        PartitionConfig config = ConfigLoader.load(path);
        PartitionConfig.ClusteringConfig clustering = config.clustering();
        if (maxDepth != null || maxTokensPerModule != null || maxTokensPerLeaf != null) {
            config = config.withClustering(new PartitionConfig.ClusteringConfig(
                maxTokensPerModule != null ? maxTokensPerModule : clustering.maxTokenPerModule(),
                maxTokensPerLeaf != null ? maxTokensPerLeaf : clustering.maxTokenPerLeafModule(),
                maxDepth != null ? maxDepth : clustering.maxDepth(),
                clustering.savedGrouping()));
        }
        if (outputDir != null) {
            config = config.withOutputDirectory(outputDir.toString());
        }
        return config;
    }

    private static Path resolveOutputDirectory(Path root, PartitionConfig config) {
        Path output = Path.of(config.output().directory());
        return output.isAbsolute() ? output : root.resolve(output).normalize();
    }

    private static void printSummary(PartitionResult result) {
        ModuleTree tree = result.tree();
        System.out.println("✓ Parsed " + result.report().statistics().filesParsed() + " files ("
            + result.report().statistics().filesFailed() + " skipped)");
        System.out.println("✓ " + result.graph().size() + " entities, " + result.graph().relations().size()
            + " relations, " + result.condensed().cyclicGroupCount() + " dependency cycles");
        System.out.println("✓ " + tree.leafCount() + " leaf modules, max depth " + tree.maxDepthReached());
        System.out.println();
        printModule(tree.root());
    }

    private static void printModule(Module module) {
        String indent = "  ".repeat(module.depth());
        String flags = module.oversized() ? " [oversized]" : "";
        System.out.printf("%s%s %s (%d tokens%s)%s%n", indent, module.moduleId(), module.name(), module.tokenCount(),
            module.leaf() ? ", " + module.entityIds().size() + " entities" : "", flags);
        module.children().forEach(AnalyzeCommand::printModule);
    }
}

package com.codepartition.core.renderer;

import com.codepartition.core.PartitionException;
import com.codepartition.core.config.PartitionConfig;
import com.codepartition.core.extractor.ExtractionStatistics;
import com.codepartition.core.model.Entity;
import com.codepartition.core.model.Module;
import com.codepartition.core.model.ModuleTree;
import com.codepartition.core.model.ParseFailure;
import com.codepartition.core.pipeline.PartitionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a {@link PartitionResult} into the JSON artifacts read by downstream tools.
 *
 * <ul>
 *   <li>{@code module_tree.json}: the module tree</li>
 *   <li>{@code components.json}: every entity keyed by id, with its source text</li>
 *   <li>{@code metadata.json}: run information, configuration and statistics</li>
 * </ul>
 * Output is pretty-printed with {@code \n} line endings and sorted map keys, so
 * {@code module_tree.json} and {@code components.json} are byte-identical for identical
 * input. {@code metadata.json} carries a timestamp.
 */
public class ArtifactGenerator {

    public static final String MODULE_TREE_FILE = "module_tree.json";
    public static final String COMPONENTS_FILE = "components.json";
    public static final String METADATA_FILE = "metadata.json";

    public static final String GENERATOR_NAME = "code-partition";
    public static final String GENERATOR_VERSION = "1.0.0";

    private static final ObjectWriter JSON_WRITER = createWriter();

    private final Clock clock;

    public ArtifactGenerator() {
        this(Clock.systemUTC());
    }

    public ArtifactGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generates all artifacts.
     *
     * @param result partition result
     * @param config configuration the result was produced with
     * @param repositoryRoot analyzed repository
     * @return the three artifacts
     */
    public GeneratedOutput generate(PartitionResult result, PartitionConfig config, Path repositoryRoot) {
        return new GeneratedOutput(List.of(
            GeneratedFile.json(MODULE_TREE_FILE, moduleTreeJson(result.tree())),
            GeneratedFile.json(COMPONENTS_FILE, componentsJson(result)),
            GeneratedFile.json(METADATA_FILE, metadataJson(result, config, repositoryRoot))
        ));
    }

    /**
     * Serializes a module tree.
     *
     * @param tree module tree
     * @return JSON document ending with a newline
     */
    public static String moduleTreeJson(ModuleTree tree) {
        return write(tree.root());
    }

    String componentsJson(PartitionResult result) {
        Map<String, Component> components = new TreeMap<>();
        for (Entity entity : result.graph().entities().values()) {
            components.put(entity.id(), Component.of(entity));
        }
        return write(components);
    }

    String metadataJson(PartitionResult result, PartitionConfig config, Path repositoryRoot) {
        ExtractionStatistics extraction = result.report().statistics();
        ModuleTree tree = result.tree();
        List<Module> modules = tree.processingOrder();
        Statistics statistics = new Statistics(
            extraction.filesDiscovered(),
            extraction.filesParsed(),
            extraction.filesFailed(),
            result.graph().size(),
            result.graph().relations().size(),
            result.graph().unresolvedReferences().size(),
            result.condensed().groups().size(),
            result.condensed().cyclicGroupCount(),
            modules.size(),
            tree.leafCount(),
            tree.leaves().stream().filter(Module::oversized).count(),
            tree.maxDepthReached(),
            new TreeMap<>(extraction.errorCounts())
        );
        Metadata metadata = new Metadata(
            new Generator(GENERATOR_NAME, GENERATOR_VERSION),
            Instant.now(clock).toString(),
            repositoryRoot.toAbsolutePath().normalize().toString().replace('\\', '/'),
            config,
            statistics,
            result.report().failures().stream().map(Failure::of).toList(),
            result.warnings()
        );
        return write(metadata);
    }

    private static String write(Object value) {
        try {
            return JSON_WRITER.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new PartitionException("Failed to serialize artifact: " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectWriter createWriter() {
        ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return mapper.writer(printer);
    }

    // --- artifact records ---

    /**
     * One entry of {@code components.json}.
     */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Component(
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("language") String language,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("qualified_name") String qualifiedName,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("start_offset") int startOffset,
        @JsonProperty("end_offset") int endOffset,
        @JsonProperty("parameters") List<String> parameters,
        @JsonProperty("token_count") int tokenCount,
        @JsonProperty("parent_id") String parentId,
        @JsonProperty("source_code") String sourceCode
    ) {
        static Component of(Entity entity) {
            return new Component(
                entity.name(),
                entity.kind().name().toLowerCase(Locale.ROOT),
                entity.language() == null ? null : entity.language().tag(),
                entity.filePath(),
                entity.qualifiedName(),
                entity.span().startLine(),
                entity.span().endLine(),
                entity.span().startOffset(),
                entity.span().endOffset(),
                entity.parameters(),
                entity.tokenCount(),
                entity.parentId(),
                entity.sourceText()
            );
        }
    }

    public record Generator(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {}

    public record Statistics(
        @JsonProperty("files_discovered") int filesDiscovered,
        @JsonProperty("files_parsed") int filesParsed,
        @JsonProperty("files_failed") int filesFailed,
        @JsonProperty("entities") int entities,
        @JsonProperty("relations") int relations,
        @JsonProperty("unresolved_references") int unresolvedReferences,
        @JsonProperty("groups") int groups,
        @JsonProperty("cyclic_groups") long cyclicGroups,
        @JsonProperty("modules") int modules,
        @JsonProperty("leaf_modules") int leafModules,
        @JsonProperty("oversized_modules") long oversizedModules,
        @JsonProperty("max_depth_reached") int maxDepthReached,
        @JsonProperty("parse_errors") Map<String, Integer> parseErrors
    ) {}

    public record Metadata(
        @JsonProperty("generator") Generator generator,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("repository_path") String repositoryPath,
        @JsonProperty("configuration") PartitionConfig configuration,
        @JsonProperty("statistics") Statistics statistics,
        @JsonProperty("parse_failures") List<Failure> parseFailures,
        @JsonProperty("warnings") List<String> warnings
    ) {}

    public record Failure(
        @JsonProperty("file_path") String filePath,
        @JsonProperty("error_type") String errorType,
        @JsonProperty("message") String message
    ) {
        static Failure of(ParseFailure failure) {
            return new Failure(failure.filePath(), failure.errorType(), failure.message());
        }
    }
}

package com.codepartition.core.config;

import com.codepartition.core.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for a partition run.
 *
 * <p>Loaded from {@code codepartition.yaml} in the repository root. Missing sections
 * fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "my-repo"
 *
 * sources:
 *   include: ["src/**"]
 *   exclude: ["src/generated/**"]
 *
 * clustering:
 *   maxTokenPerModule: 36369
 *   maxTokenPerLeafModule: 16000
 *   maxDepth: 2
 *
 * extraction:
 *   threads: 0
 *   encoding: cl100k_base
 *
 * output:
 *   directory: "./docs/module-tree"
 * }</pre>
 *
 * @param project project metadata
 * @param sources source selection
 * @param clustering clustering budgets
 * @param extraction extraction settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PartitionConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("sources") SourcesConfig sources,
    @JsonProperty("clustering") ClusteringConfig clustering,
    @JsonProperty("extraction") ExtractionConfig extraction,
    @JsonProperty("output") OutputConfig output
) {
    public static final long DEFAULT_MAX_TOKEN_PER_MODULE = 36369;
    public static final long DEFAULT_MAX_TOKEN_PER_LEAF_MODULE = 16000;
    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final String DEFAULT_ENCODING = "cl100k_base";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./docs/module-tree";

    /**
     * Compact constructor filling missing sections with defaults.
     */
    public PartitionConfig {
        project = project == null ? new ProjectInfo(null) : project;
        sources = sources == null ? new SourcesConfig(null, null) : sources;
        clustering = clustering == null ? new ClusteringConfig(null, null, null, null) : clustering;
        extraction = extraction == null ? new ExtractionConfig(null, null) : extraction;
        output = output == null ? new OutputConfig(null) : output;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static PartitionConfig defaults() {
        return new PartitionConfig(null, null, null, null, null);
    }

    /**
     * Returns a copy with a different clustering section.
     *
     * @param newClustering clustering section
     * @return updated configuration
     */
    public PartitionConfig withClustering(ClusteringConfig newClustering) {
        return new PartitionConfig(project, sources, newClustering, extraction, output);
    }

    /**
     * Returns a copy with a different output directory.
     *
     * @param directory output directory
     * @return updated configuration
     */
    public PartitionConfig withOutputDirectory(String directory) {
        return new PartitionConfig(project, sources, clustering, extraction, new OutputConfig(directory));
    }

    /**
     * Checks every semantic constraint.
     *
     * @throws ConfigurationException listing all violations
     */
    public void validate() {
        List<String> violations = new ArrayList<>();
        if (clustering.maxTokenPerModule() <= 0) {
            violations.add("clustering.maxTokenPerModule must be positive, was " + clustering.maxTokenPerModule());
        }
        if (clustering.maxTokenPerLeafModule() <= 0) {
            violations.add("clustering.maxTokenPerLeafModule must be positive, was "
                + clustering.maxTokenPerLeafModule());
        }
        if (clustering.maxDepth() < 1) {
            violations.add("clustering.maxDepth must be at least 1, was " + clustering.maxDepth());
        }
        if (extraction.threads() < 0) {
            violations.add("extraction.threads must not be negative, was " + extraction.threads());
        }
        if (extraction.encoding().isBlank()) {
            violations.add("extraction.encoding must not be blank");
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    /**
     * Project metadata.
     *
     * @param name root module name; the repository directory name when absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {}

    /**
     * Source selection. Excludes are merged with the built-in excluded directories.
     *
     * @param include include globs; empty selects every supported extension
     * @param exclude exclude globs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourcesConfig(
        @JsonProperty("include") List<String> include,
        @JsonProperty("exclude") List<String> exclude
    ) {
        public SourcesConfig {
            include = include == null ? List.of() : List.copyOf(include);
            exclude = exclude == null ? List.of() : List.copyOf(exclude);
        }
    }

    /**
     * Clustering budgets.
     *
     * @param maxTokenPerModule budget of non-terminal levels
     * @param maxTokenPerLeafModule budget of every leaf module
     * @param maxDepth maximum tree depth (root = 0)
     * @param savedGrouping optional path to a previously written {@code module_tree.json}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClusteringConfig(
        @JsonProperty("maxTokenPerModule") Long maxTokenPerModule,
        @JsonProperty("maxTokenPerLeafModule") Long maxTokenPerLeafModule,
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("savedGrouping") String savedGrouping
    ) {
        public ClusteringConfig {
            maxTokenPerModule = maxTokenPerModule == null ? DEFAULT_MAX_TOKEN_PER_MODULE : maxTokenPerModule;
            maxTokenPerLeafModule = maxTokenPerLeafModule == null
                ? DEFAULT_MAX_TOKEN_PER_LEAF_MODULE
                : maxTokenPerLeafModule;
            maxDepth = maxDepth == null ? DEFAULT_MAX_DEPTH : maxDepth;
        }
    }

    /**
     * Extraction settings.
     *
     * @param threads worker threads, 0 for the number of available processors
     * @param encoding tokenizer encoding name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractionConfig(
        @JsonProperty("threads") Integer threads,
        @JsonProperty("encoding") String encoding
    ) {
        public ExtractionConfig {
            threads = threads == null ? 0 : threads;
            encoding = encoding == null ? DEFAULT_ENCODING : encoding;
        }

        /**
         * Returns the effective worker count.
         *
         * @return configured threads, or available processors when 0
         */
        public int effectiveThreads() {
            return threads == 0 ? Runtime.getRuntime().availableProcessors() : threads;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory artifact directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            directory = directory == null ? DEFAULT_OUTPUT_DIRECTORY : directory;
        }
    }
}

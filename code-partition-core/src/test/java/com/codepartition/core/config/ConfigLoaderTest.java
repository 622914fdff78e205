package com.codepartition.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "shop"

            sources:
              include: ["src/**"]
              exclude: ["src/generated/**"]

            clustering:
              maxTokenPerModule: 20000
              maxTokenPerLeafModule: 8000
              maxDepth: 3
              savedGrouping: "docs/module_tree.json"

            extraction:
              threads: 4
              encoding: o200k_base

            output:
              directory: "./out"
            """);

        PartitionConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("shop");
        assertThat(config.sources().include()).containsExactly("src/**");
        assertThat(config.sources().exclude()).containsExactly("src/generated/**");
        assertThat(config.clustering().maxTokenPerModule()).isEqualTo(20000L);
        assertThat(config.clustering().maxTokenPerLeafModule()).isEqualTo(8000L);
        assertThat(config.clustering().maxDepth()).isEqualTo(3);
        assertThat(config.clustering().savedGrouping()).isEqualTo("docs/module_tree.json");
        assertThat(config.extraction().threads()).isEqualTo(4);
        assertThat(config.extraction().encoding()).isEqualTo("o200k_base");
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            clustering:
              maxDepth: 4
            """);

        PartitionConfig config = ConfigLoader.load(configFile);

        assertThat(config.clustering().maxDepth()).isEqualTo(4);
        assertThat(config.clustering().maxTokenPerModule()).isEqualTo(PartitionConfig.DEFAULT_MAX_TOKEN_PER_MODULE);
        assertThat(config.clustering().maxTokenPerLeafModule())
            .isEqualTo(PartitionConfig.DEFAULT_MAX_TOKEN_PER_LEAF_MODULE);
        assertThat(config.project().name()).isNull();
        assertThat(config.sources().include()).isEmpty();
        assertThat(config.output().directory()).isEqualTo(PartitionConfig.DEFAULT_OUTPUT_DIRECTORY);
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "shop"
              owner: "team"
            renderers:
              - html
            """);

        PartitionConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("shop");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        PartitionConfig config = ConfigLoader.load(tempDir.resolve("absent.yaml"));

        assertThat(config).isEqualTo(PartitionConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(PartitionConfig.defaults());
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            clustering:
              maxDepth: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(PartitionConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(PartitionConfig.defaults());
    }

    @Test
    void parse_malformedYaml_throwsIOException() {
        assertThatThrownBy(() -> ConfigLoader.parse("clustering: [unclosed"))
            .isInstanceOf(IOException.class);
    }
}

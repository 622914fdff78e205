package com.codepartition.core.config;

import com.codepartition.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PartitionConfig}.
 */
class PartitionConfigTest {

    @Test
    void defaults_useDocumentedValues() {
        PartitionConfig config = PartitionConfig.defaults();

        assertThat(config.clustering().maxTokenPerModule()).isEqualTo(36369L);
        assertThat(config.clustering().maxTokenPerLeafModule()).isEqualTo(16000L);
        assertThat(config.clustering().maxDepth()).isEqualTo(2);
        assertThat(config.clustering().savedGrouping()).isNull();
        assertThat(config.extraction().threads()).isZero();
        assertThat(config.extraction().encoding()).isEqualTo("cl100k_base");
        assertThat(config.output().directory()).isEqualTo("./docs/module-tree");
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_withZeroDepth_throwsConfigurationException() {
        PartitionConfig config = PartitionConfig.defaults()
            .withClustering(new PartitionConfig.ClusteringConfig(null, null, 0, null));

        assertThatThrownBy(config::validate)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("clustering.maxDepth must be at least 1, was 0");
    }

    @Test
    void validate_withSeveralViolations_listsAll() {
        PartitionConfig config = new PartitionConfig(null, null,
            new PartitionConfig.ClusteringConfig(0L, -5L, 2, null),
            new PartitionConfig.ExtractionConfig(-1, " "), null);

        assertThatThrownBy(config::validate)
            .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations()).containsExactly(
                "clustering.maxTokenPerModule must be positive, was 0",
                "clustering.maxTokenPerLeafModule must be positive, was -5",
                "extraction.threads must not be negative, was -1",
                "extraction.encoding must not be blank"));
    }

    @Test
    void validate_withLeafBudgetAboveModuleBudget_isAccepted() {
        PartitionConfig config = PartitionConfig.defaults()
            .withClustering(new PartitionConfig.ClusteringConfig(1000L, 5000L, 2, null));

        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    void withOutputDirectory_replacesOnlyOutput() {
        PartitionConfig config = PartitionConfig.defaults().withOutputDirectory("target/tree");

        assertThat(config.output().directory()).isEqualTo("target/tree");
        assertThat(config.clustering()).isEqualTo(PartitionConfig.defaults().clustering());
    }

    @Test
    void effectiveThreads_withZero_usesAvailableProcessors() {
        assertThat(new PartitionConfig.ExtractionConfig(0, null).effectiveThreads())
            .isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(new PartitionConfig.ExtractionConfig(3, null).effectiveThreads()).isEqualTo(3);
    }
}

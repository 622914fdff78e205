package com.codepartition.core.cluster;

import com.codepartition.core.config.PartitionConfig;

/**
 * Token budgets and depth limit of one clustering run.
 *
 * @param maxTokenPerModule budget of non-terminal levels
 * @param maxTokenPerLeafModule budget of every leaf module
 * @param maxDepth deepest allowed module depth
 */
public record ClusteringSettings(
    long maxTokenPerModule,
    long maxTokenPerLeafModule,
    int maxDepth
) {
    public static ClusteringSettings from(PartitionConfig.ClusteringConfig config) {
        return new ClusteringSettings(config.maxTokenPerModule(), config.maxTokenPerLeafModule(), config.maxDepth());
    }

    /**
     * Largest token total a leaf may hold at any depth.
     *
     * @return the smaller of the two budgets
     */
    public long leafCap() {
        return Math.min(maxTokenPerModule, maxTokenPerLeafModule);
    }
}

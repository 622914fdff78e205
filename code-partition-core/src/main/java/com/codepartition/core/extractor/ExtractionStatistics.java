package com.codepartition.core.extractor;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics collected during an extraction pass.
 *
 * @param filesDiscovered files handed to the runner
 * @param filesParsed files extracted successfully
 * @param filesFailed files recorded as parse failures
 * @param declarations declarations found across all parsed files
 * @param errorCounts failures per error type
 */
public record ExtractionStatistics(
    int filesDiscovered,
    int filesParsed,
    int filesFailed,
    int declarations,
    Map<String, Integer> errorCounts
) {
    /**
     * Compact constructor with defaults.
     */
    public ExtractionStatistics {
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ExtractionStatistics empty() {
        return new ExtractionStatistics(0, 0, 0, 0, Map.of());
    }

    /**
     * Calculates the share of files that failed to parse.
     *
     * @return failure rate as percentage (0.0 to 100.0), or 0 if no files were discovered
     */
    public double getFailureRate() {
        if (filesDiscovered == 0) {
            return 0.0;
        }
        return (filesFailed * 100.0) / filesDiscovered;
    }

    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Parsed: %d, Failed: %d (%.1f%%), Declarations: %d, Errors: %s",
            filesDiscovered,
            filesParsed,
            filesFailed,
            getFailureRate(),
            declarations,
            new TreeMap<>(errorCounts)
        );
    }

    /**
     * Builder for constructing ExtractionStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesParsed = 0;
        private int filesFailed = 0;
        private int declarations = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder incrementFilesParsed(int declarationCount) {
            this.filesParsed++;
            this.declarations += declarationCount;
            return this;
        }

        public Builder addFailure(String errorType) {
            this.filesFailed++;
            errorCounts.merge(errorType, 1, Integer::sum);
            return this;
        }

        public ExtractionStatistics build() {
            return new ExtractionStatistics(filesDiscovered, filesParsed, filesFailed, declarations, errorCounts);
        }
    }
}

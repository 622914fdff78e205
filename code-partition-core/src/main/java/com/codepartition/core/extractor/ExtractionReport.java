package com.codepartition.core.extractor;

import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.ParseFailure;

import java.util.List;

/**
 * Result of extracting a whole file set.
 *
 * @param extractions successful extractions sorted by path
 * @param failures files that could not be parsed, sorted by path
 * @param statistics extraction statistics
 */
public record ExtractionReport(
    List<FileExtraction> extractions,
    List<ParseFailure> failures,
    ExtractionStatistics statistics
) {
    public ExtractionReport {
        extractions = extractions == null ? List.of() : List.copyOf(extractions);
        failures = failures == null ? List.of() : List.copyOf(failures);
        statistics = statistics == null ? ExtractionStatistics.empty() : statistics;
    }
}

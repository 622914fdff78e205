package com.codepartition.core.extractor;

import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.Language;
import com.codepartition.core.model.ParseFailure;
import com.codepartition.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Extracts a set of files in parallel.
 *
 * <p>Each file is read and parsed by one worker of a fixed pool; workers share no
 * mutable state. {@link #run} returns only after every task has finished, so the
 * caller always sees the complete result set. A file that cannot be read or parsed
 * becomes a {@link ParseFailure}; it never aborts the run.
 */
public class ExtractionRunner {

    private static final Logger log = LoggerFactory.getLogger(ExtractionRunner.class);

    private final int threads;

    /**
     * Creates a runner.
     *
     * @param threads worker count, at least 1
     */
    public ExtractionRunner(int threads) {
        this.threads = Math.max(1, threads);
    }

    /**
     * Extracts every file.
     *
     * @param repositoryRoot repository root used to relativize paths
     * @param files files to extract
     * @return extractions and failures sorted by path
     */
    public ExtractionReport run(Path repositoryRoot, List<Path> files) {
        log.info("Extracting {} files with {} worker(s)", files.size(), threads);
        List<Outcome> outcomes = new ArrayList<>(files.size());

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<Outcome>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(CompletableFuture.supplyAsync(() -> extractOne(repositoryRoot, file), pool));
            }
            for (CompletableFuture<Outcome> future : futures) {
                outcomes.add(future.join());
            }
        } finally {
            pool.shutdown();
        }

        ExtractionStatistics.Builder statistics = new ExtractionStatistics.Builder().filesDiscovered(files.size());
        List<FileExtraction> extractions = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.extraction() != null) {
                extractions.add(outcome.extraction());
                statistics.incrementFilesParsed(outcome.extraction().declarations().size());
            } else {
                failures.add(outcome.failure());
                statistics.addFailure(outcome.failure().errorType());
            }
        }
        extractions.sort(Comparator.comparing(FileExtraction::relativePath));
        failures.sort(Comparator.comparing(ParseFailure::filePath));

        ExtractionStatistics stats = statistics.build();
        log.info("Extraction finished. {}", stats.getSummary());
        return new ExtractionReport(extractions, failures, stats);
    }

    private Outcome extractOne(Path repositoryRoot, Path file) {
        String relativePath = FileUtils.toRelativePath(repositoryRoot, file);
        Optional<Language> language = ExtractorRegistry.languageOf(relativePath);
        if (language.isEmpty()) {
            return failed(relativePath, "Unsupported language", "no extractor for extension of " + relativePath);
        }
        EntityExtractor extractor = ExtractorRegistry.forLanguage(language.get()).orElse(null);
        if (extractor == null) {
            return failed(relativePath, "Unsupported language", "no extractor for " + language.get().tag());
        }

        try {
            String content = FileUtils.readSource(file);
            FileExtraction extraction = extractor.extract(new SourceFile(relativePath, language.get(), content));
            log.debug("Extracted {} declarations and {} references from {}",
                extraction.declarations().size(), extraction.references().size(), relativePath);
            return new Outcome(extraction, null);
        } catch (ExtractionException e) {
            return failed(relativePath, e.getErrorType(), e.getMessage());
        } catch (IOException e) {
            return failed(relativePath, "File read error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Unexpected error extracting {}", relativePath, e);
            return failed(relativePath, "Unexpected error", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Outcome failed(String relativePath, String errorType, String message) {
        log.warn("Skipping {}: {} ({})", relativePath, errorType, message);
        return new Outcome(null, new ParseFailure(relativePath, errorType, message));
    }

    private record Outcome(FileExtraction extraction, ParseFailure failure) {
    }
}

package com.codepartition.core.extractor;

import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.Language;

import java.util.Set;

/**
 * Parses one source file into code entities and symbolic relations.
 *
 * <p>An extractor sees a single file only. Its {@link FileExtraction} carries the
 * declarations of the file (the entities) and the references leaving them (the
 * relations, whose targets are still symbolic names or paths). Matching those
 * targets against the rest of the repository is the job of the graph builder.
 *
 * <p>Implementations must be stateless or thread-safe: the {@link ExtractionRunner}
 * calls them concurrently from several workers.
 *
 * <p>Names are reported as written. Generic names such as {@code main} or
 * {@code utils} are not filtered here.
 */
public interface EntityExtractor {

    /**
     * Unique identifier of this extractor.
     *
     * @return extractor id (e.g. "python")
     */
    String getId();

    /**
     * Languages this extractor handles.
     *
     * @return supported languages
     */
    Set<Language> getSupportedLanguages();

    /**
     * Extracts the entities and relations of one file.
     *
     * @param source file to parse
     * @return declarations, symbolic references and import bindings of the file
     * @throws ExtractionException if the file cannot be parsed
     */
    FileExtraction extract(SourceFile source) throws ExtractionException;
}

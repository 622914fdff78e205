package com.codepartition.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything an extractor learned from one source file.
 *
 * <p>Immutable once produced; the graph builder merges these after every file
 * has been processed.
 *
 * @param relativePath repository-relative path with {@code /} separators
 * @param language source language
 * @param namespace package, module or namespace that prefixes the file's declarations (may be empty)
 * @param content full file text
 * @param declarations declarations in source order
 * @param references outgoing symbolic references
 * @param imports names bound by import statements
 */
public record FileExtraction(
    String relativePath,
    Language language,
    String namespace,
    String content,
    List<CodeDeclaration> declarations,
    List<SymbolicReference> references,
    List<ImportBinding> imports
) {
    /**
     * Compact constructor with validation.
     */
    public FileExtraction {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(content, "content must not be null");
        namespace = namespace == null ? "" : namespace;
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
        references = references == null ? List.of() : List.copyOf(references);
        imports = imports == null ? List.of() : List.copyOf(imports);
    }
}

package com.codepartition.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An atomic unit of code tracked in the dependency graph.
 *
 * <p>Entities are created once per run by the graph builder and never mutated.
 * Relations refer to them by {@link #id()} only.
 *
 * @param id stable identifier ({@code path} for files, {@code path::Local.Name} otherwise)
 * @param name display name
 * @param qualifiedName namespace-qualified name used for symbol resolution
 * @param kind entity kind
 * @param language source language
 * @param filePath repository-relative file path
 * @param span location within the file
 * @param parameters parameter list (empty for non-callables)
 * @param sourceText full, untruncated source text of the entity
 * @param tokenCount tokens of the entity's own text (nested entities excluded)
 * @param parentId id of the enclosing entity, or null for files
 * @param ordinal declaration order within the file (0 for the file entity)
 */
public record Entity(
    String id,
    String name,
    String qualifiedName,
    EntityKind kind,
    Language language,
    String filePath,
    SourceSpan span,
    List<String> parameters,
    String sourceText,
    int tokenCount,
    String parentId,
    int ordinal
) {
    /**
     * Compact constructor with validation.
     */
    public Entity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must not be negative: " + tokenCount);
        }
        qualifiedName = qualifiedName == null ? name : qualifiedName;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        sourceText = sourceText == null ? "" : sourceText;
    }

    /**
     * Returns the directory containing this entity's file ({@code ""} for the repository root).
     *
     * @return parent directory path
     */
    public String directory() {
        int slash = filePath.lastIndexOf('/');
        return slash < 0 ? "" : filePath.substring(0, slash);
    }
}

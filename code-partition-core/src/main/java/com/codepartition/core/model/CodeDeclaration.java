package com.codepartition.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A declaration found by an extractor, before it becomes a graph {@link Entity}.
 *
 * @param localName name qualified within the file (e.g. {@code OrderService.place})
 * @param name simple display name (e.g. {@code place})
 * @param kind declaration kind
 * @param span location in the file
 * @param parameters parameter list as written in the source
 * @param parentLocalName local name of the enclosing declaration, or null for top-level ones
 */
public record CodeDeclaration(
    String localName,
    String name,
    EntityKind kind,
    SourceSpan span,
    List<String> parameters,
    String parentLocalName
) {
    /**
     * Compact constructor with validation.
     */
    public CodeDeclaration {
        Objects.requireNonNull(localName, "localName must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (kind == EntityKind.FILE) {
            throw new IllegalArgumentException("FILE entities are created by the graph builder");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}

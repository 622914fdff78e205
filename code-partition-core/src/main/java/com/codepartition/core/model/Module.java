package com.codepartition.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A node of the module tree.
 *
 * <p>Serialized as:
 * <pre>{@code
 * { "module_id": "root.1", "name": "src/core", "leaf": true, "token_count": 1234,
 *   "depth": 1, "oversized": false, "complex": true,
 *   "entity_ids": ["src/core/a.py", "src/core/a.py::Foo"], "children": [] }
 * }</pre>
 *
 * @param moduleId hierarchical id ({@code root}, {@code root.2}, {@code root.2.1})
 * @param name human-readable name
 * @param leaf true if the module has no children
 * @param tokenCount tokens of all entities in the subtree
 * @param depth distance from the root (root = 0)
 * @param oversized true for a leaf made of one unsplittable unit above the leaf budget
 * @param complex true for a leaf whose entities span more than one file
 * @param entityIds entities owned directly (empty for non-leaf modules)
 * @param children child modules in order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"module_id", "name", "leaf", "token_count", "depth", "oversized", "complex",
    "entity_ids", "children"})
public record Module(
    @JsonProperty("module_id") String moduleId,
    @JsonProperty("name") String name,
    @JsonProperty("leaf") boolean leaf,
    @JsonProperty("token_count") long tokenCount,
    @JsonProperty("depth") int depth,
    @JsonProperty("oversized") boolean oversized,
    @JsonProperty("complex") boolean complex,
    @JsonProperty("entity_ids") List<String> entityIds,
    @JsonProperty("children") List<Module> children
) {
    /**
     * Compact constructor with validation.
     */
    public Module {
        Objects.requireNonNull(moduleId, "moduleId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
        children = children == null ? List.of() : List.copyOf(children);
    }
}

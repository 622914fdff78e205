package com.codepartition.core.model;

import java.util.Objects;

/**
 * A name brought into a file's scope by an import statement.
 *
 * <p>For {@code from a.b import C as D} the binding is {@code alias=D, target=a.b.C}.
 * Wildcard bindings ({@code import a.b.*}, C# {@code using a.b;}) have a null alias
 * and name the package whose members become visible.
 *
 * @param alias local name, or null for wildcard bindings
 * @param target fully qualified target
 * @param wildcard true if every member of {@code target} becomes visible
 */
public record ImportBinding(
    String alias,
    String target,
    boolean wildcard
) {
    /**
     * Compact constructor with validation.
     */
    public ImportBinding {
        Objects.requireNonNull(target, "target must not be null");
        if (!wildcard && (alias == null || alias.isBlank())) {
            throw new IllegalArgumentException("non-wildcard binding requires an alias");
        }
    }

    public static ImportBinding named(String alias, String target) {
        return new ImportBinding(alias, target, false);
    }

    public static ImportBinding wildcard(String target) {
        return new ImportBinding(null, target, true);
    }
}

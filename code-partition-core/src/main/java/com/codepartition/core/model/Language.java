package com.codepartition.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages supported by the entity extractors.
 *
 * <p>Each language is resolved from a file extension; the tag is what the
 * extractor registry dispatches on.
 */
public enum Language {
    PYTHON("python", List.of("py")),
    JAVA("java", List.of("java")),
    JAVASCRIPT("javascript", List.of("js", "jsx", "mjs", "cjs")),
    TYPESCRIPT("typescript", List.of("ts", "tsx")),
    C("c", List.of("c", "h")),
    CPP("cpp", List.of("cpp", "cc", "cxx", "hpp", "hh", "hxx")),
    CSHARP("csharp", List.of("cs")),
    PHP("php", List.of("php"));

    private final String tag;
    private final List<String> extensions;

    Language(String tag, List<String> extensions) {
        this.tag = tag;
        this.extensions = extensions;
    }

    /**
     * Returns the lower-case language tag (e.g. "python", "csharp").
     *
     * @return language tag
     */
    public String tag() {
        return tag;
    }

    /**
     * Returns the file extensions (without dot) mapped to this language.
     *
     * @return file extensions
     */
    public List<String> extensions() {
        return extensions;
    }

    /**
     * Resolves a language from a file extension.
     *
     * @param extension extension without the leading dot, case-insensitive
     * @return the language, or empty if the extension is not supported
     */
    public static Optional<Language> fromExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.extensions.contains(normalized))
            .findFirst();
    }

    /**
     * Resolves a language from its tag.
     *
     * @param tag language tag, case-insensitive
     * @return the language, or empty if unknown
     */
    public static Optional<Language> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.tag.equals(normalized))
            .findFirst();
    }
}

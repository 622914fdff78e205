package com.codepartition.core.extractor;

import com.codepartition.core.extractor.impl.c.CExtractor;
import com.codepartition.core.extractor.impl.c.CppExtractor;
import com.codepartition.core.extractor.impl.dotnet.CSharpExtractor;
import com.codepartition.core.extractor.impl.java.JavaExtractor;
import com.codepartition.core.extractor.impl.javascript.JavaScriptExtractor;
import com.codepartition.core.extractor.impl.javascript.TypeScriptExtractor;
import com.codepartition.core.extractor.impl.php.PhpExtractor;
import com.codepartition.core.extractor.impl.python.PythonExtractor;
import com.codepartition.core.model.Language;
import com.codepartition.core.util.FileUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static registry mapping every supported {@link Language} to its extractor.
 *
 * <p>The set of extractors is closed: dispatch happens on the language tag
 * resolved from the file extension.
 */
public final class ExtractorRegistry {

    private static final Map<Language, EntityExtractor> EXTRACTORS = createExtractors();

    private ExtractorRegistry() {
        // Utility class
    }

    private static Map<Language, EntityExtractor> createExtractors() {
        List<EntityExtractor> extractors = List.of(
            new PythonExtractor(),
            new JavaExtractor(),
            new JavaScriptExtractor(),
            new TypeScriptExtractor(),
            new CExtractor(),
            new CppExtractor(),
            new CSharpExtractor(),
            new PhpExtractor()
        );
        Map<Language, EntityExtractor> byLanguage = new EnumMap<>(Language.class);
        for (EntityExtractor extractor : extractors) {
            for (Language language : extractor.getSupportedLanguages()) {
                if (byLanguage.put(language, extractor) != null) {
                    throw new IllegalStateException("Duplicate extractor for language " + language);
                }
            }
        }
        return Collections.unmodifiableMap(byLanguage);
    }

    /**
     * Returns the extractor for a language.
     *
     * @param language language tag
     * @return extractor, or empty if the language is not supported
     */
    public static Optional<EntityExtractor> forLanguage(Language language) {
        return Optional.ofNullable(EXTRACTORS.get(language));
    }

    /**
     * Resolves the language of a path from its extension.
     *
     * @param relativePath file path
     * @return language, or empty if the extension is unknown
     */
    public static Optional<Language> languageOf(String relativePath) {
        return Language.fromExtension(FileUtils.getExtension(relativePath));
    }

    /**
     * Returns every registered extractor keyed by language.
     *
     * @return unmodifiable registry view
     */
    public static Map<Language, EntityExtractor> all() {
        return EXTRACTORS;
    }
}

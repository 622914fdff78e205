package com.codepartition.core.extractor.impl.c;

import com.codepartition.core.model.Language;

import java.util.Set;

/**
 * Extracts C++ sources and headers.
 *
 * <p>Adds classes with base lists, in-class methods and constructors, and out-of-line
 * member definitions ({@code void Foo::bar()} becomes {@code Foo.bar}) to what the
 * {@link CExtractor} recognizes. Namespaces are not part of entity names.
 */
public class CppExtractor extends CExtractor {

    @Override
    public String getId() {
        return "cpp";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.CPP);
    }
}

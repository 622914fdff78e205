package com.codepartition.core.extractor.impl.javascript;

import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.Language;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts TypeScript modules.
 *
 * <p>Everything the {@link JavaScriptExtractor} recognizes plus {@code interface} and
 * {@code enum} declarations and {@code implements} clauses. Type annotations and
 * generic parameters in headers are tolerated.
 */
public class TypeScriptExtractor extends JavaScriptExtractor {

    private static final Pattern INTERFACE_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:export\\s+)?(?:declare\\s+)?interface\\s+([\\w$]+)(?:\\s*<[^{]*?>)?"
            + "(?:\\s+extends\\s+([^{]+?))?\\s*$");

    private static final Pattern ENUM_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:export\\s+)?(?:declare\\s+)?(?:const\\s+)?enum\\s+([\\w$]+)\\s*$");

    @Override
    public String getId() {
        return "typescript";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.TYPESCRIPT);
    }

    @Override
    protected Optional<HeaderMatch> classifyHeader(String header, Block enclosing, boolean directBody) {
        Matcher interfaceMatch = INTERFACE_HEADER.matcher(header);
        if (interfaceMatch.find()) {
            List<String> bases = interfaceMatch.group(2) == null ? List.of() : splitTopLevel(interfaceMatch.group(2));
            return Optional.of(new HeaderMatch(interfaceMatch.start(), interfaceMatch.start(1),
                interfaceMatch.group(1), interfaceMatch.group(1), EntityKind.INTERFACE, List.of(), bases));
        }
        Matcher enumMatch = ENUM_HEADER.matcher(header);
        if (enumMatch.find()) {
            return Optional.of(new HeaderMatch(enumMatch.start(), enumMatch.start(1), enumMatch.group(1),
                enumMatch.group(1), EntityKind.ENUM, List.of(), List.of()));
        }
        return super.classifyHeader(header, enclosing, directBody);
    }
}

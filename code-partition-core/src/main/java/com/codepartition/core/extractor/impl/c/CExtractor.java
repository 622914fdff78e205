package com.codepartition.core.extractor.impl.c;

import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.extractor.base.AbstractBraceExtractor;
import com.codepartition.core.extractor.base.ExtractionBuilder;
import com.codepartition.core.extractor.base.SourceMasker;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.Language;
import com.codepartition.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structs, unions, enums and function definitions from C sources and headers.
 *
 * <p>Only definitions with a body become entities; prototypes in headers do not.
 * Preprocessor directives are ignored apart from {@code #include "..."}, which is
 * resolved relative to the including file. System includes ({@code <...>}) are external.
 */
public class CExtractor extends AbstractBraceExtractor {

    private static final Pattern INCLUDE = Pattern.compile("(?m)^[ \\t]*#[ \\t]*include[ \\t]*\"([^\"\\n]+)\"");

    private static final Pattern ACCESS_LABELS = Pattern.compile("^\\s*(?:(?:public|private|protected)\\s*:\\s*)*");

    private static final Pattern TYPE_HEADER = Pattern.compile(
        "(?<![\\w])(?:typedef\\s+)?(struct|union|enum|class)\\s+(?:class\\s+|struct\\s+)?(?:\\[\\[[^\\]]*\\]\\]\\s*)?"
            + "([A-Za-z_]\\w*)(?:\\s+final)?\\s*(?::\\s*([^{;]+?))?\\s*$");

    private static final Pattern FUNCTION_HEADER = Pattern.compile(
        "(?<![\\w:~])(~?[A-Za-z_]\\w*(?:\\s*::\\s*~?[A-Za-z_]\\w*)*)\\s*"
            + "\\(([^()]*(?:\\([^()]*\\)[^()]*)*)\\)\\s*"
            + "(?:(?:const|noexcept|override|final|volatile|mutable|&&|&)\\s*)*"
            + "(?:->\\s*[^{;=]+?)?\\s*(?::\\s*[^{;]*)?$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "while", "switch", "return", "sizeof", "else", "case", "do", "defined", "alignof",
        "_Alignof", "typeof", "__typeof__", "__attribute__", "static_assert", "_Static_assert", "decltype",
        "catch", "throw", "new", "delete", "operator", "noexcept", "alignas", "requires", "asm", "__asm__"
    );

    @Override
    public String getId() {
        return "c";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.C);
    }

    @Override
    protected SourceMasker.Syntax syntax() {
        return SourceMasker.Syntax.C_FAMILY;
    }

    @Override
    protected boolean hasPreprocessor() {
        return true;
    }

    @Override
    protected Set<String> callKeywords() {
        return KEYWORDS;
    }

    @Override
    protected void extractImports(SourceFile source, String commentFree, ExtractionBuilder builder) {
        for (MatchResult match : findMatches(INCLUDE, commentFree)) {
            String include = match.group(1);
            String resolved = FileUtils.resolveRelative(source.directory(), include);
            if (include.startsWith("./") || include.startsWith("../")) {
                builder.pathReference(resolved);
            } else {
                builder.includeReference(resolved);
            }
        }
    }

    @Override
    protected Optional<HeaderMatch> classifyHeader(String header, Block enclosing, boolean directBody) {
        int start = labelEnd(header);

        Matcher type = TYPE_HEADER.matcher(header);
        if (type.find()) {
            EntityKind kind = switch (type.group(1)) {
                case "enum" -> EntityKind.ENUM;
                case "class" -> EntityKind.CLASS;
                default -> EntityKind.STRUCT;
            };
            List<String> bases = new ArrayList<>();
            if (kind != EntityKind.ENUM && type.group(3) != null) {
                for (String base : splitTopLevel(type.group(3))) {
                    bases.add(base.replaceAll("\\b(?:public|protected|private|virtual)\\b", "").strip());
                }
            }
            return Optional.of(new HeaderMatch(Math.min(start, type.start()), type.start(2), type.group(2),
                type.group(2), kind, List.of(), bases));
        }

        boolean classBody = enclosing != null && enclosing.kind().isType() && directBody;
        if (enclosing != null && !classBody) {
            return Optional.empty();
        }
        Matcher function = FUNCTION_HEADER.matcher(header);
        if (!function.find()) {
            return Optional.empty();
        }
        String qualified = function.group(1).replaceAll("\\s+", "");
        String[] segments = qualified.split("::");
        String name = segments[segments.length - 1];
        if (KEYWORDS.contains(name)) {
            return Optional.empty();
        }
        String prefix = header.substring(start, function.start());
        if (prefix.contains("=") || prefix.isBlank() && segments.length == 1 && !classBody) {
            return Optional.empty();
        }

        EntityKind kind;
        if (classBody) {
            kind = name.equals(enclosing.name()) ? EntityKind.CONSTRUCTOR : EntityKind.METHOD;
        } else if (segments.length > 1) {
            kind = name.equals(segments[segments.length - 2]) ? EntityKind.CONSTRUCTOR : EntityKind.METHOD;
        } else {
            kind = EntityKind.FUNCTION;
        }
        String localTail = String.join(".", segments);
        int nameStart = function.start(1) + function.group(1).lastIndexOf(name);
        return Optional.of(new HeaderMatch(Math.min(start, function.start()), nameStart, name, localTail, kind,
            parameterNames(function.group(2), false), List.of()));
    }

    private static int labelEnd(String header) {
        Matcher labels = ACCESS_LABELS.matcher(header);
        int end = labels.find() ? labels.end() : 0;
        return end + firstNonWhitespace(header.substring(end));
    }
}

package com.codepartition.core.extractor.impl.dotnet;

import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.extractor.base.AbstractBraceExtractor;
import com.codepartition.core.extractor.base.ExtractionBuilder;
import com.codepartition.core.extractor.base.SourceMasker;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.Language;
import com.codepartition.core.model.RelationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts types, methods and constructors from C# source files.
 *
 * <p>The first {@code namespace} declaration (block or file scoped) becomes the file's
 * namespace. {@code using Ns;} makes every type of {@code Ns} visible,
 * {@code using A = Ns.Type;} binds an alias and {@code using static Ns.Type;} makes the
 * members of {@code Ns.Type} visible. Expression-bodied members ({@code =>}) have no
 * body and are not entities; calls inside them count for the enclosing type. Positional
 * records without a body ({@code record Point(int X, int Y);}) are types.
 */
public class CSharpExtractor extends AbstractBraceExtractor {

    private static final Pattern NAMESPACE = Pattern.compile("(?m)^\\s*namespace\\s+([\\w.]+)");

    private static final Pattern USING = Pattern.compile(
        "(?m)^\\s*(?:global\\s+)?using\\s+(static\\s+)?(?:([A-Za-z_]\\w*)\\s*=\\s*)?([A-Za-z_][\\w.]*)\\s*;");

    private static final Pattern TYPE_HEADER = Pattern.compile(
        "(?<![\\w.])(?:(?:public|private|protected|internal|static|sealed|abstract|partial|unsafe|new|readonly|ref|file)\\s+)*"
            + "(class|struct|interface|enum|record(?:\\s+class|\\s+struct)?)\\s+([A-Za-z_]\\w*)\\s*(?:<[^>]*>)?\\s*"
            + "(?:\\(([^)]*)\\))?\\s*(?::\\s*([^{]+?))?\\s*(?:\\bwhere\\b[^{]*)?$");

    private static final Pattern METHOD_HEADER = Pattern.compile(
        "(?<![\\w.])(~?[A-Za-z_]\\w*)\\s*(?:<[^(]*?>)?\\s*\\(([^()]*(?:\\([^()]*\\)[^()]*)*)\\)\\s*"
            + "(?::\\s*(?:base|this)\\s*\\([^{]*\\))?\\s*(?:\\bwhere\\b[^{]*)?$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "foreach", "while", "switch", "catch", "using", "lock", "return", "typeof", "sizeof",
        "nameof", "default", "checked", "unchecked", "fixed", "when", "base", "this", "new", "throw", "await",
        "stackalloc", "is", "as", "get", "set", "init", "add", "remove", "operator"
    );

    @Override
    public String getId() {
        return "csharp";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.CSHARP);
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
        Matcher namespace = NAMESPACE.matcher(commentFree);
        if (namespace.find()) {
            builder.namespace(namespace.group(1));
        }

        for (MatchResult match : findMatches(USING, commentFree)) {
            boolean isStatic = match.group(1) != null;
            String alias = match.group(2);
            String target = match.group(3);
            if (alias != null) {
                builder.binding(ImportBinding.named(alias, target));
                builder.reference("", target, RelationKind.IMPORT);
            } else if (isStatic) {
                builder.binding(ImportBinding.wildcard(target));
                builder.reference("", target, RelationKind.IMPORT);
            } else {
                builder.binding(ImportBinding.wildcard(target));
            }
        }
    }

    @Override
    protected Optional<HeaderMatch> classifyHeader(String header, Block enclosing, boolean directBody) {
        boolean topLevel = enclosing == null;
        boolean typeBody = enclosing != null && enclosing.kind().isType() && directBody;
        if (!topLevel && !typeBody) {
            return Optional.empty();
        }

        Matcher type = TYPE_HEADER.matcher(header);
        if (type.find()) {
            return Optional.of(typeMatch(type));
        }

        if (!typeBody) {
            return Optional.empty();
        }
        Matcher method = METHOD_HEADER.matcher(header);
        if (!method.find() || KEYWORDS.contains(method.group(1))) {
            return Optional.empty();
        }
        String name = method.group(1);
        EntityKind kind = name.equals(enclosing.name()) ? EntityKind.CONSTRUCTOR : EntityKind.METHOD;
        return Optional.of(new HeaderMatch(firstNonWhitespace(header), method.start(1), name, name, kind,
            parameterNames(method.group(2), false), List.of()));
    }

    @Override
    protected Optional<HeaderMatch> classifyBodilessHeader(String header, Block enclosing, boolean directBody) {
        boolean topLevel = enclosing == null;
        boolean typeBody = enclosing != null && enclosing.kind().isType() && directBody;
        if (!topLevel && !typeBody || !header.contains("record")) {
            return Optional.empty();
        }
        Matcher type = TYPE_HEADER.matcher(header);
        if (!type.find() || !type.group(1).startsWith("record") || type.group(3) == null) {
            return Optional.empty();
        }
        return Optional.of(typeMatch(type));
    }

    private HeaderMatch typeMatch(Matcher type) {
        EntityKind kind = switch (type.group(1).replaceAll("\\s+", " ")) {
            case "interface" -> EntityKind.INTERFACE;
            case "enum" -> EntityKind.ENUM;
            case "struct", "record struct" -> EntityKind.STRUCT;
            default -> EntityKind.CLASS;
        };
        List<String> bases = new ArrayList<>();
        if (kind != EntityKind.ENUM && type.group(4) != null) {
            for (String base : splitTopLevel(type.group(4))) {
                bases.add(base.replaceFirst("\\(.*$", "").strip());
            }
        }
        return new HeaderMatch(type.start(), type.start(2), type.group(2), type.group(2), kind,
            parameterNames(type.group(3), false), bases);
    }
}

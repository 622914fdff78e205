package com.codepartition.core.extractor.impl.php;

import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.extractor.base.AbstractBraceExtractor;
import com.codepartition.core.extractor.base.ExtractionBuilder;
import com.codepartition.core.extractor.base.SourceMasker;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.Language;
import com.codepartition.core.model.RelationKind;
import com.codepartition.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts classes, interfaces, traits, enums, functions and methods from PHP files.
 *
 * <p>Namespaces use {@code \} as separator in source and {@code .} in qualified names,
 * so {@code App\Service\Mailer} becomes {@code App.Service.Mailer}.
 *
 * <p><b>Relations</b>
 * <ul>
 *   <li>{@code use} statements, including {@code use function} and group use</li>
 *   <li>{@code require}/{@code include} of literal paths, relative to the including file</li>
 *   <li>{@code extends}, {@code implements} and trait {@code use} inside a class body</li>
 *   <li>function, method and static calls, {@code new} expressions</li>
 * </ul>
 */
public class PhpExtractor extends AbstractBraceExtractor {

    private static final Pattern NAMESPACE = Pattern.compile("(?m)^\\s*namespace\\s+([\\w\\\\]+)\\s*[;{]");

    private static final Pattern USE = Pattern.compile(
        "(?m)^\\s*use\\s+(?:(function|const)\\s+)?([^;{]+?)(?:\\\\?\\{([^}]*)\\})?\\s*;");

    private static final Pattern INCLUDE = Pattern.compile(
        "\\b(?:require|include)(?:_once)?\\s*\\(?\\s*(__DIR__\\s*\\.\\s*)?['\"]([^'\"\\n]+)['\"]");

    private static final Pattern TYPE_START = Pattern.compile("\\b(?:class|trait|interface|enum)\\s+(?!extends\\b|implements\\b)(\\w+)[^{;]*\\{");

    private static final Pattern TYPE_HEADER = Pattern.compile(
        "(?<![\\w$>])(?:(?:abstract|final|readonly)\\s+)*(class|interface|trait|enum)\\s+(?!extends\\b|implements\\b)(\\w+)"
            + "(?:\\s*:\\s*\\w+)?(?:\\s+extends\\s+([\\w\\\\,\\s]+?))?(?:\\s+implements\\s+([\\w\\\\,\\s]+?))?\\s*$");

    private static final Pattern FUNCTION_HEADER = Pattern.compile(
        "(?<![\\w$>])(?:(?:public|private|protected|static|abstract|final)\\s+)*function\\s+&?(\\w+)\\s*"
            + "\\(([^()]*(?:\\([^()]*\\)[^()]*)*)\\)(?:\\s*:\\s*[?\\w\\\\|&\\s]+?)?\\s*$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "elseif", "for", "foreach", "while", "switch", "match", "catch", "return", "array", "list",
        "isset", "unset", "empty", "echo", "print", "function", "fn", "use", "new", "require", "require_once",
        "include", "include_once", "exit", "die", "eval", "declare", "and", "or", "not"
    );

    @Override
    public String getId() {
        return "php";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.PHP);
    }

    @Override
    protected SourceMasker.Syntax syntax() {
        return SourceMasker.Syntax.PHP;
    }

    @Override
    protected Set<String> callKeywords() {
        return KEYWORDS;
    }

    @Override
    protected void extractImports(SourceFile source, String commentFree, ExtractionBuilder builder) {
        Matcher namespace = NAMESPACE.matcher(commentFree);
        if (namespace.find()) {
            builder.namespace(qualify(namespace.group(1)));
        }

        String masked = SourceMasker.maskCommentsAndStrings(source.content(), syntax());
        List<TypeBody> typeBodies = typeBodies(masked);

        for (MatchResult match : findMatches(USE, commentFree)) {
            TypeBody owner = ownerOf(typeBodies, match.start());
            if (owner != null) {
                for (String trait : splitTopLevel(match.group(2))) {
                    builder.reference(owner.name, qualify(trait), RelationKind.INHERIT);
                }
            } else if (!"const".equals(match.group(1))) {
                bindUse(match.group(2), match.group(3), builder);
            }
        }

        for (MatchResult match : findMatches(INCLUDE, commentFree)) {
            String path = match.group(2);
            boolean anchored = match.group(1) != null;
            if (anchored && path.startsWith("/")) {
                path = path.substring(1);
            }
            String resolved = FileUtils.resolveRelative(source.directory(), path);
            if (anchored || path.startsWith("./") || path.startsWith("../")) {
                builder.pathReference(resolved);
            } else {
                builder.includeReference(resolved);
            }
        }
    }

    @Override
    protected Optional<HeaderMatch> classifyHeader(String header, Block enclosing, boolean directBody) {
        boolean typeBody = enclosing != null && enclosing.kind().isType() && directBody;

        if (enclosing == null) {
            Matcher type = TYPE_HEADER.matcher(header);
            if (type.find()) {
                EntityKind kind = switch (type.group(1)) {
                    case "interface" -> EntityKind.INTERFACE;
                    case "enum" -> EntityKind.ENUM;
                    default -> EntityKind.CLASS;
                };
                List<String> bases = new ArrayList<>();
                for (int group = 3; group <= 4; group++) {
                    if (type.group(group) != null) {
                        splitTopLevel(type.group(group)).forEach(base -> bases.add(qualify(base)));
                    }
                }
                return Optional.of(new HeaderMatch(type.start(), type.start(2), type.group(2), type.group(2), kind,
                    List.of(), bases));
            }
        }

        if (enclosing != null && !typeBody && !enclosing.kind().isCallable()) {
            return Optional.empty();
        }
        Matcher function = FUNCTION_HEADER.matcher(header);
        if (!function.find()) {
            return Optional.empty();
        }
        String name = function.group(1);
        EntityKind kind;
        if (typeBody) {
            kind = "__construct".equals(name) ? EntityKind.CONSTRUCTOR : EntityKind.METHOD;
        } else {
            kind = EntityKind.FUNCTION;
        }
        return Optional.of(new HeaderMatch(function.start(), function.start(1), name, name, kind,
            parameterNames(function.group(2), false), List.of()));
    }

    /**
     * Binds {@code use A\B [as C]} lists and {@code use A\{B, C as D}} groups.
     */
    private void bindUse(String clause, String group, ExtractionBuilder builder) {
        String prefix = group == null ? "" : qualify(clause);
        for (String item : splitTopLevel(group == null ? clause : group)) {
            String[] parts = item.strip().split("\\s+as\\s+");
            String name = qualify(parts[0]);
            String target = prefix.isEmpty() ? name : prefix + "." + name;
            if (name.isEmpty()) {
                continue;
            }
            String alias = parts.length > 1 ? parts[1].strip() : target.substring(target.lastIndexOf('.') + 1);
            builder.binding(ImportBinding.named(alias, target));
            builder.reference("", target, RelationKind.IMPORT);
        }
    }

    /**
     * Converts a PHP name as written ({@code \App\Model}) to dotted form ({@code App.Model}).
     */
    static String qualify(String name) {
        String dotted = name.strip().replace('\\', '.');
        while (dotted.startsWith(".")) {
            dotted = dotted.substring(1);
        }
        while (dotted.endsWith(".")) {
            dotted = dotted.substring(0, dotted.length() - 1);
        }
        return dotted;
    }

    private List<TypeBody> typeBodies(String masked) {
        List<TypeBody> bodies = new ArrayList<>();
        for (MatchResult match : findMatches(TYPE_START, masked)) {
            int open = match.end() - 1;
            int depth = 0;
            for (int i = open; i < masked.length(); i++) {
                char c = masked.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    bodies.add(new TypeBody(match.group(1), open, i));
                    break;
                }
            }
        }
        return bodies;
    }

    private static TypeBody ownerOf(List<TypeBody> bodies, int offset) {
        for (TypeBody body : bodies) {
            if (offset > body.open && offset < body.close) {
                return body;
            }
        }
        return null;
    }

    private record TypeBody(String name, int open, int close) {
    }
}

package com.codepartition.core.extractor.impl.javascript;

import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.extractor.base.AbstractBraceExtractor;
import com.codepartition.core.extractor.base.ExtractionBuilder;
import com.codepartition.core.extractor.base.SourceMasker;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.ImportBinding;
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
 * Extracts classes, functions and methods from JavaScript modules.
 *
 * <p>Recognizes {@code class} declarations, {@code function} declarations, functions
 * and arrow functions assigned to {@code const}/{@code let}/{@code var}, class methods
 * and arrow-function class fields.
 *
 * <p><b>Relations</b>
 * <ul>
 *   <li>ES module imports, re-exports, {@code require()} and dynamic {@code import()}
 *       of relative paths; bare package specifiers are external and ignored</li>
 *   <li>calls and {@code new} expressions</li>
 *   <li>{@code extends}</li>
 * </ul>
 *
 * <p>The namespace of a module is its path without extension, so {@code src/a.js}
 * exports {@code src/a.Foo}.
 */
public class JavaScriptExtractor extends AbstractBraceExtractor {

    private static final Pattern IMPORT_FROM = Pattern.compile(
        "\\bimport\\s+(?:type\\s+)?([\\w$*{}\\s,]+?)\\s+from\\s*['\"]([^'\"\\n]+)['\"]");

    private static final Pattern IMPORT_BARE = Pattern.compile(
        "\\bimport\\s*\\(?\\s*['\"]([^'\"\\n]+)['\"]");

    private static final Pattern EXPORT_FROM = Pattern.compile(
        "\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+[\\w$]+)?|\\{[^}]*\\})\\s*from\\s*['\"]([^'\"\\n]+)['\"]");

    private static final Pattern REQUIRE = Pattern.compile(
        "(?:\\b(?:const|let|var)\\s+([\\w$]+|\\{[^}]*\\})\\s*=\\s*)?\\brequire\\s*\\(\\s*['\"]([^'\"\\n]+)['\"]\\s*\\)");

    private static final Pattern NAMED_IMPORTS = Pattern.compile("\\{([^}]*)\\}");

    private static final Pattern NAMESPACE_IMPORT = Pattern.compile("\\*\\s*as\\s+([\\w$]+)");

    private static final Pattern CLASS_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?class\\s+([\\w$]+)"
            + "(?:\\s*<[^{]*?>)?(?:\\s+extends\\s+([\\w$.]+)(?:\\s*<[^{]*?>)?)?(?:\\s+implements\\s+([^{]+?))?\\s*$");

    private static final Pattern FUNCTION_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*([\\w$]+)\\s*(?:<[^(]*?>)?"
            + "\\s*\\(([^)]*)\\)(?:\\s*:\\s*[^{]+?)?\\s*$");

    private static final Pattern ASSIGNED_FUNCTION_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:export\\s+)?(?:const|let|var)\\s+([\\w$]+)(?:\\s*:\\s*[^=]+?)?\\s*=\\s*(?:async\\s+)?"
            + "(?:function\\s*\\*?\\s*[\\w$]*\\s*\\(([^)]*)\\)(?:\\s*:\\s*[^{]+?)?"
            + "|(?:<[^(]*?>\\s*)?\\(([^)]*)\\)(?:\\s*:\\s*[^=]+?)?\\s*=>"
            + "|([\\w$]+)\\s*=>)\\s*$");

    private static final Pattern METHOD_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:(?:public|private|protected|static|async|readonly|override|abstract|get|set)\\s+)*"
            + "\\*?\\s*(#?[\\w$]+)\\s*(?:<[^(]*?>)?\\s*\\(([^)]*)\\)(?:\\s*:\\s*[^{]+?)?\\s*$");

    private static final Pattern FIELD_ARROW_HEADER = Pattern.compile(
        "(?<![\\w$.])(?:(?:public|private|protected|static|readonly)\\s+)*(#?[\\w$]+)(?:\\s*:\\s*[^=]+?)?\\s*=\\s*"
            + "(?:async\\s+)?(?:\\(([^)]*)\\)|([\\w$]+))(?:\\s*:\\s*[^=]+?)?\\s*=>\\s*$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "typeof", "function", "await", "async",
        "super", "import", "require", "with", "do", "else", "void", "delete", "in", "of", "instanceof",
        "yield", "throw", "new", "as", "satisfies", "keyof"
    );

    @Override
    public String getId() {
        return "javascript";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.JAVASCRIPT);
    }

    @Override
    protected SourceMasker.Syntax syntax() {
        return SourceMasker.Syntax.JAVASCRIPT;
    }

    @Override
    protected Set<String> callKeywords() {
        return KEYWORDS;
    }

    @Override
    protected void extractImports(SourceFile source, String commentFree, ExtractionBuilder builder) {
        builder.namespace(FileUtils.stripExtension(source.relativePath()));
        String directory = source.directory();

        for (MatchResult match : findMatches(IMPORT_FROM, commentFree)) {
            modulePath(directory, match.group(2)).ifPresent(module -> {
                builder.pathReference(module);
                bindImportClause(match.group(1), module, builder);
            });
        }
        for (MatchResult match : findMatches(IMPORT_BARE, commentFree)) {
            modulePath(directory, match.group(1)).ifPresent(builder::pathReference);
        }
        for (MatchResult match : findMatches(EXPORT_FROM, commentFree)) {
            modulePath(directory, match.group(1)).ifPresent(builder::pathReference);
        }
        for (MatchResult match : findMatches(REQUIRE, commentFree)) {
            modulePath(directory, match.group(2)).ifPresent(module -> {
                builder.pathReference(module);
                String target = match.group(1);
                if (target == null) {
                    return;
                }
                if (target.startsWith("{")) {
                    bindDestructured(target.substring(1, target.length() - 1), module, builder);
                } else {
                    builder.binding(ImportBinding.named(target, module));
                }
            });
        }
    }

    @Override
    protected Optional<HeaderMatch> classifyHeader(String header, Block enclosing, boolean directBody) {
        boolean classBody = enclosing != null && enclosing.kind().isType() && directBody;
        if (classBody) {
            Optional<HeaderMatch> member = classMember(header, enclosing);
            if (member.isPresent()) {
                return member;
            }
        }

        Matcher clazz = CLASS_HEADER.matcher(header);
        if (clazz.find()) {
            List<String> bases = new ArrayList<>();
            if (clazz.group(2) != null) {
                bases.add(clazz.group(2));
            }
            if (clazz.group(3) != null) {
                bases.addAll(splitTopLevel(clazz.group(3)));
            }
            return Optional.of(new HeaderMatch(clazz.start(), clazz.start(1), clazz.group(1), clazz.group(1),
                EntityKind.CLASS, List.of(), bases));
        }

        if (enclosing != null && !enclosing.kind().isCallable()) {
            return Optional.empty();
        }
        Matcher function = FUNCTION_HEADER.matcher(header);
        if (function.find()) {
            return Optional.of(new HeaderMatch(function.start(), function.start(1), function.group(1),
                function.group(1), EntityKind.FUNCTION, parameterNames(function.group(2), true), List.of()));
        }
        Matcher assigned = ASSIGNED_FUNCTION_HEADER.matcher(header);
        if (assigned.find()) {
            String parameters = firstNonNull(assigned.group(2), assigned.group(3), assigned.group(4));
            return Optional.of(new HeaderMatch(assigned.start(), assigned.start(1), assigned.group(1),
                assigned.group(1), EntityKind.FUNCTION, parameterNames(parameters, true), List.of()));
        }
        return Optional.empty();
    }

    private Optional<HeaderMatch> classMember(String header, Block enclosing) {
        Matcher method = METHOD_HEADER.matcher(header);
        if (method.find() && !callKeywords().contains(method.group(1))) {
            String name = method.group(1);
            EntityKind kind = "constructor".equals(name) ? EntityKind.CONSTRUCTOR : EntityKind.METHOD;
            return Optional.of(new HeaderMatch(method.start(), method.start(1), name, name, kind,
                parameterNames(method.group(2), true), List.of()));
        }
        Matcher field = FIELD_ARROW_HEADER.matcher(header);
        if (field.find()) {
            String name = field.group(1);
            return Optional.of(new HeaderMatch(field.start(), field.start(1), name, name, EntityKind.METHOD,
                parameterNames(firstNonNull(field.group(2), field.group(3)), true), List.of()));
        }
        return Optional.empty();
    }

    /**
     * Binds {@code Default, { a as b }, * as ns} import clauses.
     */
    private void bindImportClause(String clause, String module, ExtractionBuilder builder) {
        String rest = clause;
        Matcher named = NAMED_IMPORTS.matcher(rest);
        if (named.find()) {
            for (String item : splitTopLevel(named.group(1))) {
                String[] parts = item.replaceFirst("^type\\s+", "").split("\\s+as\\s+");
                String imported = parts[0].strip();
                String alias = parts.length > 1 ? parts[1].strip() : imported;
                if (!imported.isEmpty() && !alias.isEmpty()) {
                    builder.binding(ImportBinding.named(alias, module + "." + imported));
                }
            }
            rest = rest.substring(0, named.start()) + rest.substring(named.end());
        }
        Matcher namespace = NAMESPACE_IMPORT.matcher(rest);
        if (namespace.find()) {
            builder.binding(ImportBinding.named(namespace.group(1), module));
            rest = rest.substring(0, namespace.start()) + rest.substring(namespace.end());
        }
        for (String item : splitTopLevel(rest)) {
            if (item.matches("[\\w$]+")) {
                builder.binding(ImportBinding.named(item, module + "." + item));
            }
        }
    }

    /**
     * Binds {@code const { a, b: c } = require(...)} destructuring.
     */
    private void bindDestructured(String names, String module, ExtractionBuilder builder) {
        for (String item : splitTopLevel(names)) {
            String[] parts = item.split(":");
            String imported = parts[0].strip();
            String alias = parts.length > 1 ? parts[1].strip() : imported;
            if (imported.matches("[\\w$]+") && alias.matches("[\\w$]+")) {
                builder.binding(ImportBinding.named(alias, module + "." + imported));
            }
        }
    }

    /**
     * Resolves a relative module specifier to a repository path without extension.
     *
     * @return the module path, or empty for package specifiers
     */
    private Optional<String> modulePath(String directory, String specifier) {
        if (!specifier.startsWith(".") && !specifier.startsWith("/")) {
            return Optional.empty();
        }
        String resolved = FileUtils.resolveRelative(directory, specifier);
        if (Language.fromExtension(FileUtils.getExtension(resolved)).isPresent()) {
            resolved = FileUtils.stripExtension(resolved);
        }
        return resolved.isEmpty() ? Optional.empty() : Optional.of(resolved);
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return "";
    }
}

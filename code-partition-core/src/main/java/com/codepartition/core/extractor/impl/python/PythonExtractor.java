package com.codepartition.core.extractor.impl.python;

import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.extractor.base.AbstractRegexExtractor;
import com.codepartition.core.extractor.base.ExtractionBuilder;
import com.codepartition.core.extractor.base.SourceMasker;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.Language;
import com.codepartition.core.model.RelationKind;
import com.codepartition.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts classes, functions and methods from Python source files.
 *
 * <p>Blocks are delimited by indentation: a {@code def} or {@code class} extends
 * over every following line indented deeper than its header. Lines that continue an
 * open bracket, a triple-quoted string or a backslash-ended line never end a block.
 * Decorators directly above a header belong to the declaration.
 *
 * <p><b>Relations</b>
 * <ul>
 *   <li>{@code import a.b as c} and {@code from .pkg import x} (relative imports are
 *       resolved against the file's package)</li>
 *   <li>calls, attributed to the innermost enclosing function or class</li>
 *   <li>base classes of {@code class A(Base):}</li>
 * </ul>
 *
 * <p>The namespace of a file is its dotted module path ({@code pkg/mod.py} is
 * {@code pkg.mod}, {@code pkg/__init__.py} is {@code pkg}).
 */
public class PythonExtractor extends AbstractRegexExtractor {

    private static final Pattern DEF_PATTERN = Pattern.compile(
        "^([ \\t]*)(?:async[ \\t]+)?def[ \\t]+(\\w+)[ \\t]*\\(", Pattern.MULTILINE);

    private static final Pattern CLASS_PATTERN = Pattern.compile(
        "^([ \\t]*)class[ \\t]+(\\w+)[ \\t]*([(:])", Pattern.MULTILINE);

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
        "^[ \\t]*import[ \\t]+([\\w. \\t,]+)$", Pattern.MULTILINE);

    private static final Pattern FROM_IMPORT_PATTERN = Pattern.compile(
        "^[ \\t]*from[ \\t]+(\\.*[\\w.]*)[ \\t]+import[ \\t]+(\\([^)]*\\)|[^\\n]+)", Pattern.MULTILINE);

    private static final Pattern IMPORT_ITEM = Pattern.compile("^([\\w.*]+)(?:\\s+as\\s+(\\w+))?$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "elif", "while", "for", "return", "and", "or", "not", "in", "is", "lambda", "with",
        "assert", "yield", "await", "except", "del", "def", "class", "import", "from", "raise",
        "super", "print", "async", "match", "case"
    );

    @Override
    public String getId() {
        return "python";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.PYTHON);
    }

    @Override
    protected Set<String> callKeywords() {
        return KEYWORDS;
    }

    @Override
    protected void parse(SourceFile source, ExtractionBuilder builder) throws ExtractionException {
        String masked = SourceMasker.maskCommentsAndStrings(source.content(), SourceMasker.Syntax.PYTHON);
        String namespace = moduleName(source.relativePath());
        builder.namespace(namespace);

        extractImports(masked, source.relativePath(), namespace, builder);
        BitSet continued = continuationLines(masked);

        List<Block> blocks = new ArrayList<>();
        for (MatchResult match : findMatches(DEF_PATTERN, masked)) {
            blocks.add(functionBlock(masked, continued, match, builder));
        }
        for (MatchResult match : findMatches(CLASS_PATTERN, masked)) {
            blocks.add(classBlock(masked, continued, match, builder));
        }

        assignParents(blocks);
        for (Block block : blocks) {
            if (block.kind() == EntityKind.FUNCTION && block.parent() != null
                    && block.parent().kind() == EntityKind.CLASS) {
                block.setKind("__init__".equals(block.name()) ? EntityKind.CONSTRUCTOR : EntityKind.METHOD);
            }
        }

        declareAll(blocks, builder);
        collectCalls(masked, blocks, builder);
        collectBases(blocks, builder);
    }

    private Block functionBlock(String masked, BitSet continued, MatchResult match, ExtractionBuilder builder)
            throws ExtractionException {
        String name = match.group(2);
        int indent = match.group(1).length();
        int open = match.end() - 1;
        int close = matchingParen(masked, open);
        if (close < 0) {
            throw new ExtractionException("Syntax error",
                "unclosed parameter list of '" + name + "' at line " + builder.lineOf(open));
        }
        int colon = masked.indexOf(':', close);
        if (colon < 0) {
            throw new ExtractionException("Syntax error",
                "missing ':' after 'def " + name + "' at line " + builder.lineOf(open));
        }
        List<String> parameters = parameterNames(masked.substring(open + 1, close - 1), true);
        int start = declarationStart(masked, match.start() + indent, indent);
        int end = blockEnd(masked, continued, colon + 1, indent);
        return new Block(name, name, EntityKind.FUNCTION, start, end, match.start(2), parameters, List.of());
    }

    private Block classBlock(String masked, BitSet continued, MatchResult match, ExtractionBuilder builder)
            throws ExtractionException {
        String name = match.group(2);
        int indent = match.group(1).length();
        List<String> bases = new ArrayList<>();
        int headerEnd = match.end() - 1;
        if ("(".equals(match.group(3))) {
            int close = matchingParen(masked, headerEnd);
            if (close < 0) {
                throw new ExtractionException("Syntax error",
                    "unclosed base list of class '" + name + "' at line " + builder.lineOf(headerEnd));
            }
            for (String base : splitTopLevel(masked.substring(headerEnd + 1, close - 1))) {
                if (!base.contains("=") && !base.startsWith("*") && !"object".equals(base)) {
                    bases.add(base);
                }
            }
            headerEnd = close;
        }
        int colon = masked.indexOf(':', headerEnd);
        if (colon < 0) {
            throw new ExtractionException("Syntax error",
                "missing ':' after 'class " + name + "' at line " + builder.lineOf(headerEnd));
        }
        int start = declarationStart(masked, match.start() + indent, indent);
        int end = blockEnd(masked, continued, colon + 1, indent);
        return new Block(name, name, EntityKind.CLASS, start, end, match.start(2), List.of(), bases);
    }

    /**
     * Moves the start of a declaration up over decorators at the same indentation.
     */
    private int declarationStart(String masked, int headerStart, int indent) {
        int start = headerStart;
        int lineStart = masked.lastIndexOf('\n', headerStart - 1) + 1;
        while (lineStart > 0) {
            int previousStart = masked.lastIndexOf('\n', lineStart - 2) + 1;
            String line = masked.substring(previousStart, lineStart - 1);
            String trimmed = line.strip();
            if (!trimmed.startsWith("@") || leadingWhitespace(line) != indent) {
                break;
            }
            start = previousStart + indent;
            lineStart = previousStart;
        }
        return start;
    }

    /**
     * Finds the end of an indented block: the last non-blank line indented deeper
     * than the header, or the header line itself for one-line bodies.
     */
    private int blockEnd(String masked, BitSet continued, int bodyStart, int indent) {
        int lineEnd = lineEnd(masked, bodyStart);
        int end = rightTrim(masked, bodyStart, lineEnd);
        int position = lineEnd + 1;
        while (position < masked.length()) {
            int nextEnd = lineEnd(masked, position);
            String line = masked.substring(position, nextEnd);
            if (!line.isBlank()) {
                if (!continued.get(position) && leadingWhitespace(line) <= indent) {
                    break;
                }
                end = rightTrim(masked, position, nextEnd);
            }
            position = nextEnd + 1;
        }
        return end;
    }

    /**
     * Marks the start offset of every line that continues the previous logical line.
     *
     * @param masked source with comments and string contents blanked
     * @return start offsets of continuation lines
     */
    static BitSet continuationLines(String masked) {
        BitSet continued = new BitSet(masked.length() + 1);
        int depth = 0;
        char tripleQuote = 0;
        char previous = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '\n') {
                if (depth > 0 || tripleQuote != 0 || previous == '\\') {
                    continued.set(i + 1);
                }
            } else if ((c == '"' || c == '\'') && masked.startsWith("" + c + c + c, i)) {
                if (tripleQuote == 0) {
                    tripleQuote = c;
                } else if (tripleQuote == c) {
                    tripleQuote = 0;
                }
                i += 2;
            } else if (tripleQuote == 0) {
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                    depth--;
                }
            }
            if (c != ' ' && c != '\t' && c != '\r') {
                previous = c;
            }
        }
        return continued;
    }

    private void extractImports(String masked, String relativePath, String namespace, ExtractionBuilder builder) {
        for (MatchResult match : findMatches(IMPORT_PATTERN, masked)) {
            for (String item : splitTopLevel(match.group(1))) {
                Matcher itemMatch = IMPORT_ITEM.matcher(item.strip());
                if (!itemMatch.matches()) {
                    continue;
                }
                String module = itemMatch.group(1);
                if (itemMatch.group(2) != null) {
                    builder.binding(ImportBinding.named(itemMatch.group(2), module));
                }
                builder.reference("", module, RelationKind.IMPORT);
            }
        }

        boolean packageInit = relativePath.endsWith("__init__.py");
        for (MatchResult match : findMatches(FROM_IMPORT_PATTERN, masked)) {
            String module = absoluteModule(match.group(1), namespace, packageInit);
            String items = match.group(2).strip();
            if (items.startsWith("(")) {
                items = items.substring(1, items.length() - 1);
            }
            for (String item : splitTopLevel(items)) {
                Matcher itemMatch = IMPORT_ITEM.matcher(item.strip());
                if (!itemMatch.matches()) {
                    continue;
                }
                String name = itemMatch.group(1);
                if ("*".equals(name)) {
                    builder.binding(ImportBinding.wildcard(module));
                    builder.reference("", module, RelationKind.IMPORT);
                    continue;
                }
                String target = module.isEmpty() ? name : module + "." + name;
                String alias = itemMatch.group(2) != null ? itemMatch.group(2) : name;
                builder.binding(ImportBinding.named(alias, target));
                builder.reference("", target, RelationKind.IMPORT);
            }
        }
    }

    /**
     * Resolves {@code from ..x import y} style module references to absolute dotted names.
     */
    static String absoluteModule(String written, String namespace, boolean packageInit) {
        int dots = 0;
        while (dots < written.length() && written.charAt(dots) == '.') {
            dots++;
        }
        if (dots == 0) {
            return written;
        }
        List<String> base = new ArrayList<>(namespace.isEmpty()
            ? List.of()
            : Arrays.asList(namespace.split("\\.")));
        int drop = (packageInit ? 0 : 1) + dots - 1;
        for (int i = 0; i < drop && !base.isEmpty(); i++) {
            base.remove(base.size() - 1);
        }
        String rest = written.substring(dots);
        if (!rest.isEmpty()) {
            base.add(rest);
        }
        return String.join(".", base);
    }

    /**
     * Converts a file path to its dotted module name.
     */
    static String moduleName(String relativePath) {
        String module = FileUtils.stripExtension(relativePath).replace('/', '.');
        if (module.equals("__init__")) {
            return "";
        }
        if (module.endsWith(".__init__")) {
            return module.substring(0, module.length() - ".__init__".length());
        }
        return module;
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static int lineEnd(String text, int from) {
        int newline = text.indexOf('\n', from);
        return newline < 0 ? text.length() : newline;
    }

    private static int rightTrim(String text, int from, int to) {
        int end = to;
        while (end > from && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }
}

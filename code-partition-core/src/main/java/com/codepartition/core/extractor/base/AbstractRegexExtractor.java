package com.codepartition.core.extractor.base;

import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.RelationKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that locate declarations and calls with
 * regular expressions over masked source text.
 *
 * <p>This base class is used for every language without a Java AST parser: Python,
 * JavaScript, TypeScript, C, C++, C# and PHP. Subclasses find declaration
 * {@link Block}s; this class then
 * <ul>
 *   <li>declares them in source order with their parents ({@link #declareAll})</li>
 *   <li>attributes every call site to its innermost enclosing block ({@link #collectCalls})</li>
 *   <li>records inheritance from the base names of each block ({@link #collectBases})</li>
 * </ul>
 *
 * @see AbstractExtractor
 * @see SourceMasker
 */
public abstract class AbstractRegexExtractor extends AbstractExtractor {

    /**
     * A call site: an identifier chain followed by an opening parenthesis.
     */
    protected static final Pattern CALL_PATTERN = Pattern.compile(
        "(?<![\\w$.>:\\\\])([A-Za-z_$][\\w$]*(?:\\s*(?:\\?\\.|\\?->|\\.|::|->)\\s*[A-Za-z_$][\\w$]*)*)\\s*\\(");

    private static final Pattern RECEIVER_PREFIX = Pattern.compile(
        "^(?:this|self|cls|\\$this|super|parent|static)\\.");

    protected AbstractRegexExtractor() {
        super();
    }

    /**
     * Words that look like calls but are language keywords or builtins never worth
     * resolving ({@code if (...)}, {@code sizeof(...)}).
     *
     * @return keyword set
     */
    protected abstract Set<String> callKeywords();

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match results in order
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        return pattern.matcher(text).results().toList();
    }

    /**
     * Extracts a numbered group from a match.
     *
     * @param match match result
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, or null if the group did not participate
     */
    protected String extractGroup(MatchResult match, int groupIndex) {
        try {
            return match.group(groupIndex);
        } catch (IndexOutOfBoundsException | IllegalStateException e) {
            return null;
        }
    }

    /**
     * Finds the offset just past the parenthesis that closes the one at {@code open}.
     *
     * @param text masked text
     * @param open offset of an opening parenthesis
     * @return offset after the matching close, or -1 if unbalanced
     */
    protected int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    // ==================== Block Processing ====================

    /**
     * Declares every block in source order so that parents receive their local
     * names before their children.
     *
     * @param blocks blocks with resolved extents and parents
     * @param builder extraction collector
     */
    protected void declareAll(List<Block> blocks, ExtractionBuilder builder) {
        blocks.sort(Block.SOURCE_ORDER);
        for (Block block : blocks) {
            String parentLocalName = block.parent == null ? null : block.parent.localName;
            block.localName = builder.declare(block.name, block.localTail, block.kind, block.start, block.end,
                block.parameters, parentLocalName);
        }
    }

    /**
     * Records a call relation for every call site in the masked text.
     *
     * <p>The caller is the innermost block containing the call, or the file itself.
     * The declaration name of each block is skipped.
     *
     * @param masked comment and string masked source
     * @param blocks declared blocks in source order
     * @param builder extraction collector
     */
    protected void collectCalls(String masked, List<Block> blocks, ExtractionBuilder builder) {
        Set<String> keywords = callKeywords();
        Deque<Block> open = new ArrayDeque<>();
        int next = 0;
        Matcher matcher = CALL_PATTERN.matcher(masked);
        while (matcher.find()) {
            int offset = matcher.start(1);
            while (next < blocks.size() && blocks.get(next).start <= offset) {
                Block block = blocks.get(next++);
                while (!open.isEmpty() && open.peek().end <= block.start) {
                    open.pop();
                }
                open.push(block);
            }
            while (!open.isEmpty() && open.peek().end <= offset) {
                open.pop();
            }
            Block owner = open.peek();
            if (owner != null && owner.nameOffset == offset) {
                continue;
            }
            String target = normalizeTarget(matcher.group(1));
            if (target.isEmpty() || keywords.contains(target)) {
                continue;
            }
            builder.reference(owner == null ? "" : owner.localName, target, RelationKind.CALL);
        }
    }

    /**
     * Records an inheritance relation from every block to each of its base names.
     *
     * @param blocks declared blocks
     * @param builder extraction collector
     */
    protected void collectBases(List<Block> blocks, ExtractionBuilder builder) {
        for (Block block : blocks) {
            for (String base : block.bases) {
                String target = stripTypeArguments(base);
                if (!target.isEmpty()) {
                    builder.reference(block.localName, normalizeTarget(target), RelationKind.INHERIT);
                }
            }
        }
    }

    /**
     * Normalizes a call chain to dotted form and drops receiver prefixes such as
     * {@code this.} or {@code $this->}.
     *
     * @param raw chain as written
     * @return dotted target, possibly empty
     */
    protected String normalizeTarget(String raw) {
        String target = raw.replaceAll("\\s+", "")
            .replace("?->", ".")
            .replace("?.", ".")
            .replace("->", ".")
            .replace("::", ".")
            .replace('\\', '.');
        if (target.startsWith(".")) {
            target = target.substring(1);
        }
        String previous;
        do {
            previous = target;
            target = RECEIVER_PREFIX.matcher(target).replaceFirst("");
        } while (!target.equals(previous));
        return target;
    }

    /**
     * Removes generic arguments, e.g. {@code Base<T>} to {@code Base}.
     *
     * @param typeName type as written
     * @return raw type name
     */
    protected String stripTypeArguments(String typeName) {
        StringBuilder result = new StringBuilder();
        int depth = 0;
        for (char c : typeName.toCharArray()) {
            if (c == '<' || c == '(') {
                depth++;
            } else if ((c == '>' || c == ')') && depth > 0) {
                depth--;
            } else if (depth == 0) {
                result.append(c);
            }
        }
        return result.toString().strip();
    }

    /**
     * Links every block to its innermost enclosing block.
     *
     * @param blocks blocks with extents; sorted in place into source order
     */
    protected void assignParents(List<Block> blocks) {
        blocks.sort(Block.SOURCE_ORDER);
        Deque<Block> open = new ArrayDeque<>();
        for (Block block : blocks) {
            while (!open.isEmpty() && open.peek().end < block.end) {
                open.pop();
            }
            block.parent = open.peek();
            open.push(block);
        }
    }

    /**
     * A declaration found in the source: its extent, name and base names.
     */
    protected static final class Block {

        static final Comparator<Block> SOURCE_ORDER = Comparator
            .comparingInt((Block b) -> b.start)
            .thenComparing(b -> -b.end);

        final String name;
        final String localTail;
        EntityKind kind;
        final int start;
        int end;
        final int nameOffset;
        final List<String> parameters;
        final List<String> bases;
        Block parent;
        String localName;

        public Block(String name, String localTail, EntityKind kind, int start, int end, int nameOffset,
                     List<String> parameters, List<String> bases) {
            this.name = name;
            this.localTail = localTail;
            this.kind = kind;
            this.start = start;
            this.end = end;
            this.nameOffset = nameOffset;
            this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
            this.bases = bases == null ? List.of() : List.copyOf(bases);
        }

        public String name() {
            return name;
        }

        public EntityKind kind() {
            return kind;
        }

        public void setKind(EntityKind kind) {
            this.kind = kind;
        }

        public Block parent() {
            return parent;
        }
    }
}

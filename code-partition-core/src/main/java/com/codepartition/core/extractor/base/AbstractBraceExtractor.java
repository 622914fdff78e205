package com.codepartition.core.extractor.base;

import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.model.EntityKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Abstract base class for extractors of brace-delimited languages.
 *
 * <p>The masked source is walked once. At every opening brace the text since the
 * previous <code>;</code>, <code>{</code> or <code>}</code> (the <i>header</i>) is offered to
 * {@link #classifyHeader}; a recognized header opens a declaration whose extent ends
 * at the matching closing brace. Headers ending at <code>;</code> are offered to
 * {@link #classifyBodilessHeader}. Unbalanced braces make the file unparseable.
 *
 * <p>Used by the JavaScript, TypeScript, C, C++, C# and PHP extractors.
 */
public abstract class AbstractBraceExtractor extends AbstractRegexExtractor {

    protected AbstractBraceExtractor() {
        super();
    }

    /**
     * Comment and string syntax of the language.
     *
     * @return masker syntax
     */
    protected abstract SourceMasker.Syntax syntax();

    /**
     * Whether {@code #} directive lines are blanked before the brace walk.
     *
     * @return true for languages with a preprocessor
     */
    protected boolean hasPreprocessor() {
        return false;
    }

    /**
     * Reports namespace, import bindings and file references.
     *
     * @param source file being parsed
     * @param commentFree source with comments masked and strings intact
     * @param builder extraction collector
     */
    protected abstract void extractImports(SourceFile source, String commentFree, ExtractionBuilder builder);

    /**
     * Recognizes a declaration header.
     *
     * @param header raw masked text between the previous boundary and the brace
     * @param enclosing innermost enclosing declaration, or null at file level
     * @param directBody true if the brace opens directly inside {@code enclosing}'s body
     * @return the declaration, or empty for anonymous blocks
     */
    protected abstract Optional<HeaderMatch> classifyHeader(String header, Block enclosing, boolean directBody);

    /**
     * Recognizes a declaration that ends at a semicolon instead of a body.
     *
     * @param header raw masked text between the previous boundary and the semicolon
     * @param enclosing innermost enclosing declaration, or null at file level
     * @param directBody true if the semicolon is directly inside {@code enclosing}'s body
     * @return the declaration, or empty for statements and prototypes
     */
    protected Optional<HeaderMatch> classifyBodilessHeader(String header, Block enclosing, boolean directBody) {
        return Optional.empty();
    }

    @Override
    protected void parse(SourceFile source, ExtractionBuilder builder) throws ExtractionException {
        String commentFree = SourceMasker.maskComments(source.content(), syntax());
        extractImports(source, commentFree, builder);

        String masked = SourceMasker.maskCommentsAndStrings(source.content(), syntax());
        if (hasPreprocessor()) {
            masked = SourceMasker.blankPreprocessorLines(masked);
        }

        List<Block> blocks = scanBlocks(masked, builder);
        assignParents(blocks);
        declareAll(blocks, builder);
        collectCalls(masked, blocks, builder);
        collectBases(blocks, builder);
    }

    private List<Block> scanBlocks(String masked, ExtractionBuilder builder) throws ExtractionException {
        List<Block> blocks = new ArrayList<>();
        Deque<Frame> frames = new ArrayDeque<>();
        int boundary = 0;

        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                Frame enclosingFrame = innermostDeclaration(frames);
                Block enclosing = enclosingFrame == null ? null : enclosingFrame.block;
                boolean directBody = enclosingFrame != null && frames.peek() == enclosingFrame;
                String header = masked.substring(boundary, i);
                int headerOffset = boundary;
                Block block = classifyHeader(header, enclosing, directBody)
                    .map(match -> match.toBlock(headerOffset))
                    .orElse(null);
                frames.push(new Frame(block));
                boundary = i + 1;
            } else if (c == '}') {
                if (frames.isEmpty()) {
                    throw new ExtractionException("Syntax error",
                        "unbalanced braces: unexpected '}' at line " + builder.lineOf(i));
                }
                Frame frame = frames.pop();
                if (frame.block != null) {
                    frame.block.end = i + 1;
                    blocks.add(frame.block);
                }
                boundary = i + 1;
            } else if (c == ';') {
                Frame enclosingFrame = innermostDeclaration(frames);
                Block enclosing = enclosingFrame == null ? null : enclosingFrame.block;
                boolean directBody = enclosingFrame != null && frames.peek() == enclosingFrame;
                int headerOffset = boundary;
                int end = i + 1;
                classifyBodilessHeader(masked.substring(boundary, i), enclosing, directBody)
                    .map(match -> match.toBlock(headerOffset))
                    .ifPresent(block -> {
                        block.end = end;
                        blocks.add(block);
                    });
                boundary = i + 1;
            }
        }

        if (!frames.isEmpty()) {
            throw new ExtractionException("Syntax error",
                "unbalanced braces: " + frames.size() + " unclosed '{' at end of file");
        }
        return blocks;
    }

    private static Frame innermostDeclaration(Deque<Frame> frames) {
        for (Frame frame : frames) {
            if (frame.block != null) {
                return frame;
            }
        }
        return null;
    }

    /**
     * Offset of the first non-whitespace character of a header.
     *
     * @param header header text
     * @return index within the header
     */
    protected static int firstNonWhitespace(String header) {
        int i = 0;
        while (i < header.length() && Character.isWhitespace(header.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * A recognized declaration header.
     *
     * @param start index in the header where the declaration starts
     * @param nameStart index in the header of the declared name
     * @param name simple name
     * @param localTail local name relative to the parent ({@code Foo.bar} for out-of-line methods)
     * @param kind declaration kind
     * @param parameters parameter names
     * @param bases base type names
     */
    protected record HeaderMatch(
        int start,
        int nameStart,
        String name,
        String localTail,
        EntityKind kind,
        List<String> parameters,
        List<String> bases
    ) {
        public HeaderMatch {
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
            bases = bases == null ? List.of() : List.copyOf(bases);
        }

        Block toBlock(int headerOffset) {
            return new Block(name, localTail, kind, headerOffset + start, -1, headerOffset + nameStart,
                parameters, bases);
        }
    }

    private static final class Frame {
        private final Block block;

        private Frame(Block block) {
            this.block = block;
        }
    }
}

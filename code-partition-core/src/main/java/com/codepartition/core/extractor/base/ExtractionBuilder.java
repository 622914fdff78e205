package com.codepartition.core.extractor.base;

import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.model.CodeDeclaration;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.RelationKind;
import com.codepartition.core.model.SourceSpan;
import com.codepartition.core.model.SymbolicReference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the declarations, references and imports of one file.
 *
 * <p>Local names are made unique within the file: the second declaration with the
 * same local name (an overload) becomes {@code name#2}, the third {@code name#3}.
 * Declarations must therefore be added in source order.
 */
public class ExtractionBuilder {

    private final SourceFile source;
    private final int[] lineStarts;
    private final List<CodeDeclaration> declarations = new ArrayList<>();
    private final Set<SymbolicReference> references = new LinkedHashSet<>();
    private final Set<ImportBinding> imports = new LinkedHashSet<>();
    private final Map<String, Integer> localNameCounts = new HashMap<>();
    private String namespace = "";

    public ExtractionBuilder(SourceFile source) {
        this.source = source;
        this.lineStarts = computeLineStarts(source.content());
    }

    public SourceFile source() {
        return source;
    }

    public void namespace(String namespace) {
        this.namespace = namespace == null ? "" : namespace;
    }

    public String namespace() {
        return namespace;
    }

    /**
     * Adds a declaration.
     *
     * @param name simple name
     * @param localTail local name relative to the parent; usually equal to {@code name},
     *                  dotted for out-of-line definitions such as {@code Foo.bar}
     * @param kind declaration kind
     * @param startOffset first character of the declaration
     * @param endOffset offset just past the declaration
     * @param parameters parameter names
     * @param parentLocalName local name of the enclosing declaration, or null at file level
     * @return the unique local name assigned to the declaration
     */
    public String declare(String name, String localTail, EntityKind kind, int startOffset, int endOffset,
                          List<String> parameters, String parentLocalName) {
        String base = parentLocalName == null ? localTail : parentLocalName + "." + localTail;
        int count = localNameCounts.merge(base, 1, Integer::sum);
        String localName = count == 1 ? base : base + "#" + count;
        declarations.add(new CodeDeclaration(localName, name, kind, span(startOffset, endOffset),
            parameters, parentLocalName));
        return localName;
    }

    /**
     * Adds a reference to a symbolic name.
     *
     * @param fromLocalName local name of the referencing declaration, {@code ""} for the file itself
     * @param target name as written in source
     * @param kind relation kind
     */
    public void reference(String fromLocalName, String target, RelationKind kind) {
        if (target != null && !target.isBlank()) {
            references.add(SymbolicReference.symbol(fromLocalName == null ? "" : fromLocalName, target.strip(), kind));
        }
    }

    /**
     * Adds a file-level import of another repository file.
     *
     * @param relativePath repository-relative path, with or without extension
     */
    public void pathReference(String relativePath) {
        if (relativePath != null && !relativePath.isBlank()) {
            references.add(SymbolicReference.path(relativePath));
        }
    }

    /**
     * Adds an include of another repository file that a search path may satisfy.
     *
     * @param relativePath include path resolved against the including file's directory
     */
    public void includeReference(String relativePath) {
        if (relativePath != null && !relativePath.isBlank()) {
            references.add(SymbolicReference.include(relativePath));
        }
    }

    public void binding(ImportBinding binding) {
        imports.add(binding);
    }

    /**
     * Builds the span of a character range.
     *
     * @param startOffset first character
     * @param endOffset offset just past the range
     * @return span with 1-based lines
     */
    public SourceSpan span(int startOffset, int endOffset) {
        int start = Math.max(0, Math.min(startOffset, source.content().length()));
        int end = Math.max(start, Math.min(endOffset, source.content().length()));
        return new SourceSpan(lineOf(start), lineOf(Math.max(start, end - 1)), start, end);
    }

    /**
     * Returns the 1-based line of an offset.
     *
     * @param offset character offset
     * @return line number
     */
    public int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Returns the offset of the first character of a 1-based line.
     *
     * @param line line number
     * @return offset
     */
    public int lineStart(int line) {
        return lineStarts[Math.max(0, Math.min(line - 1, lineStarts.length - 1))];
    }

    public FileExtraction build() {
        List<CodeDeclaration> ordered = new ArrayList<>(declarations);
        ordered.sort(Comparator.comparingInt((CodeDeclaration d) -> d.span().startOffset())
            .thenComparing(d -> -d.span().endOffset()));
        return new FileExtraction(source.relativePath(), source.language(), namespace, source.content(),
            ordered, new ArrayList<>(references), new ArrayList<>(imports));
    }

    private static int[] computeLineStarts(String content) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}

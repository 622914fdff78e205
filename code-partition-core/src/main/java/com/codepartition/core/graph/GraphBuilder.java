package com.codepartition.core.graph;

import com.codepartition.core.model.CodeDeclaration;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.Entity;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.Language;
import com.codepartition.core.model.Relation;
import com.codepartition.core.model.SourceSpan;
import com.codepartition.core.model.SymbolicReference;
import com.codepartition.core.model.UnresolvedReference;
import com.codepartition.core.util.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-file extraction results into one repository-wide {@link DependencyGraph}.
 *
 * <p>Runs single-threaded after every file has been extracted, since resolution needs
 * the complete namespace. The output depends only on the set of extractions, not on
 * their order: files are processed by path, relations and unresolved references are
 * sorted.
 *
 * <p>Each file contributes a {@link EntityKind#FILE} entity with id {@code path} and one
 * entity per declaration with id {@code path::LocalName}. Entity token counts cover the
 * entity's own text only: the spans of directly nested entities are excluded, so that
 * summing over all entities of a file counts each line once.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private static final String ID_SEPARATOR = "::";

    private static final Comparator<UnresolvedReference> UNRESOLVED_ORDER = Comparator
        .comparing(UnresolvedReference::fromId)
        .thenComparing(UnresolvedReference::target)
        .thenComparing(UnresolvedReference::kind);

    private final TokenCounter tokenCounter;

    public GraphBuilder(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    /**
     * Builds the dependency graph.
     *
     * @param extractions successfully extracted files
     * @return graph whose relations all resolve to entities in it
     */
    public DependencyGraph build(List<FileExtraction> extractions) {
        List<FileExtraction> files = new ArrayList<>(extractions);
        files.sort(Comparator.comparing(FileExtraction::relativePath));

        Map<String, Entity> entities = new LinkedHashMap<>();
        Map<String, SymbolTable.FileScope> scopes = new LinkedHashMap<>();
        for (FileExtraction file : files) {
            addFileEntities(file, entities);
            scopes.put(file.relativePath(), new SymbolTable.FileScope(file.namespace(), file.imports()));
        }
        SymbolTable symbols = new SymbolTable(entities.values(), scopes);

        Set<Relation> relations = new LinkedHashSet<>();
        Set<UnresolvedReference> unresolved = new LinkedHashSet<>();
        for (FileExtraction file : files) {
            for (SymbolicReference reference : file.references()) {
                String fromId = sourceId(file, reference, entities);
                List<String> targets;
                if (reference.includeSearch()) {
                    targets = symbols.searchPath(reference.target());
                } else if (reference.pathTarget()) {
                    targets = symbols.resolvePath(reference.target());
                } else {
                    targets = symbols.resolve(file.relativePath(), reference.fromLocalName(), reference.target());
                }
                if (targets.isEmpty()) {
                    unresolved.add(new UnresolvedReference(fromId, reference.target(), reference.kind()));
                    continue;
                }
                for (String toId : targets) {
                    if (!toId.equals(fromId)) {
                        relations.add(new Relation(fromId, toId, reference.kind()));
                    }
                }
            }
        }

        List<Relation> sortedRelations = new ArrayList<>(relations);
        sortedRelations.sort(Relation.ORDER);
        List<UnresolvedReference> sortedUnresolved = new ArrayList<>(unresolved);
        sortedUnresolved.sort(UNRESOLVED_ORDER);

        log.info("Built dependency graph: {} entities, {} relations, {} unresolved references",
            entities.size(), sortedRelations.size(), sortedUnresolved.size());
        return new DependencyGraph(entities, sortedRelations, sortedUnresolved);
    }

    /**
     * Returns the id of a declaration.
     *
     * @param filePath repository-relative path
     * @param localName local name, empty for the file itself
     * @return entity id
     */
    public static String entityId(String filePath, String localName) {
        return localName == null || localName.isEmpty() ? filePath : filePath + ID_SEPARATOR + localName;
    }

    private void addFileEntities(FileExtraction file, Map<String, Entity> entities) {
        String path = file.relativePath();
        String content = file.content();
        List<CodeDeclaration> declarations = file.declarations();

        String fileId = entityId(path, "");
        String fileQualifiedName = file.language() == Language.PYTHON && !file.namespace().isEmpty()
            ? file.namespace()
            : path;
        SourceSpan fileSpan = new SourceSpan(1, lineCount(content), 0, content.length());
        entities.put(fileId, new Entity(fileId, fileName(path), fileQualifiedName, EntityKind.FILE, file.language(),
            path, fileSpan, List.of(), content, ownTokens(content, fileSpan, childSpans(declarations, null)),
            null, 0));

        int ordinal = 1;
        for (CodeDeclaration declaration : declarations) {
            String id = entityId(path, declaration.localName());
            String parentId = declaration.parentLocalName() == null
                ? fileId
                : entityId(path, declaration.parentLocalName());
            SourceSpan span = declaration.span();
            String text = content.substring(span.startOffset(), span.endOffset());
            int tokens = ownTokens(content, span, childSpans(declarations, declaration.localName()));
            entities.put(id, new Entity(id, declaration.name(), qualifiedName(file.namespace(), declaration.localName()),
                declaration.kind(), file.language(), path, span, declaration.parameters(), text, tokens,
                parentId, ordinal++));
        }
        log.debug("{}: {} entities", path, declarations.size() + 1);
    }

    /**
     * Attributes a reference to its declaration, or to the file when the local name is unknown.
     */
    private static String sourceId(FileExtraction file, SymbolicReference reference, Map<String, Entity> entities) {
        String id = entityId(file.relativePath(), reference.fromLocalName());
        return entities.containsKey(id) ? id : entityId(file.relativePath(), "");
    }

    private static List<SourceSpan> childSpans(List<CodeDeclaration> declarations, String parentLocalName) {
        List<SourceSpan> spans = new ArrayList<>();
        for (CodeDeclaration declaration : declarations) {
            String parent = declaration.parentLocalName();
            if (parentLocalName == null ? parent == null : parentLocalName.equals(parent)) {
                spans.add(declaration.span());
            }
        }
        spans.sort(Comparator.comparingInt(SourceSpan::startOffset));
        return spans;
    }

    /**
     * Counts the tokens of a span with the given child spans cut out.
     */
    private int ownTokens(String content, SourceSpan span, List<SourceSpan> children) {
        StringBuilder own = new StringBuilder();
        int cursor = span.startOffset();
        for (SourceSpan child : children) {
            int start = Math.max(cursor, child.startOffset());
            if (start > cursor) {
                own.append(content, cursor, Math.min(start, span.endOffset()));
            }
            cursor = Math.max(cursor, Math.min(child.endOffset(), span.endOffset()));
        }
        if (cursor < span.endOffset()) {
            own.append(content, cursor, span.endOffset());
        }
        return tokenCounter.count(own.toString());
    }

    private static String qualifiedName(String namespace, String localName) {
        String name = localName.replaceAll("#\\d+", "");
        return namespace.isEmpty() ? name : namespace + "." + name;
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static int lineCount(String content) {
        int lines = 1;
        int end = content.endsWith("\n") ? content.length() - 1 : content.length();
        for (int i = 0; i < end; i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}

package com.codepartition.core.graph;

import com.codepartition.core.model.Entity;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.Language;
import com.codepartition.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repository-wide index used to resolve symbolic reference targets to entities.
 *
 * <p>A symbol {@code T} referenced from file {@code F} inside scope {@code S} resolves
 * to the first of these lookups that finds anything:
 * <ol>
 *   <li>import bindings of {@code F}: an alias equal to the head of {@code T}, then
 *       every wildcard package followed by {@code T}</li>
 *   <li>the enclosing scopes of {@code S} inside {@code F}, innermost first, then the
 *       namespace of {@code F} followed by {@code T}</li>
 *   <li>{@code T} as a qualified name, or as the unique dotted suffix of one</li>
 *   <li>for a dotted {@code T}, its head resolved by the steps above followed by the
 *       rest of {@code T}</li>
 *   <li>the simple name (last segment) of {@code T} among all non-file entities</li>
 * </ol>
 * Candidates spread over several files are ambiguous: only those in {@code F} are kept,
 * and if there are none the reference is unresolved. Candidates within one file
 * (overloads) are all kept.
 *
 * <p>Instances are built once from the complete entity set and are read-only afterwards.
 */
public class SymbolTable {

    private final Map<String, List<Entity>> byQualifiedName = new HashMap<>();
    private final Map<String, List<Entity>> byQualifiedSuffix = new HashMap<>();
    private final Map<String, List<Entity>> bySimpleName = new HashMap<>();
    private final Map<String, Map<String, List<Entity>>> byLocalName = new HashMap<>();
    private final Map<String, List<Entity>> byPath = new HashMap<>();
    private final Map<String, FileScope> fileScopes;

    /**
     * Per-file resolution context.
     *
     * @param namespace namespace of the file's declarations, possibly empty
     * @param imports import bindings of the file
     */
    public record FileScope(String namespace, List<ImportBinding> imports) {
        public FileScope {
            namespace = namespace == null ? "" : namespace;
            imports = imports == null ? List.of() : List.copyOf(imports);
        }
    }

    /**
     * Indexes entities.
     *
     * @param entities every entity of the graph, in graph order
     * @param fileScopes resolution context keyed by file path
     */
    public SymbolTable(Collection<Entity> entities, Map<String, FileScope> fileScopes) {
        this.fileScopes = Map.copyOf(fileScopes);
        for (Entity entity : entities) {
            index(byQualifiedName, entity.qualifiedName(), entity);
            if (entity.kind() == EntityKind.FILE) {
                indexPath(entity);
                continue;
            }
            String[] segments = entity.qualifiedName().split("\\.");
            for (int i = 1; i < segments.length - 1; i++) {
                index(byQualifiedSuffix, String.join(".", List.of(segments).subList(i, segments.length)), entity);
            }
            index(bySimpleName, entity.name(), entity);
            byLocalName.computeIfAbsent(entity.filePath(), path -> new HashMap<>())
                .computeIfAbsent(localNameOf(entity), name -> new ArrayList<>())
                .add(entity);
        }
    }

    /**
     * Resolves a symbol name.
     *
     * @param filePath file containing the reference
     * @param scope local name of the referencing declaration, empty at file level
     * @param target dotted symbol name
     * @return ids of the matching entities, empty if unresolved or ambiguous
     */
    public List<String> resolve(String filePath, String scope, String target) {
        FileScope fileScope = fileScopes.getOrDefault(filePath, new FileScope("", List.of()));
        String head = headOf(target);

        List<Entity> found = lookupImports(fileScope, target);
        if (found.isEmpty()) {
            found = lookupScopes(filePath, fileScope, stripOrdinals(scope), target);
        }
        if (found.isEmpty()) {
            found = lookupQualified(target);
        }
        if (found.isEmpty() && !head.equals(target)) {
            found = lookupMember(filePath, fileScope, stripOrdinals(scope), head, target.substring(head.length() + 1));
        }
        if (found.isEmpty() && !isImportedName(fileScope, head)) {
            found = bySimpleName.getOrDefault(lastSegmentOf(target), List.of());
        }
        return choose(found, filePath);
    }

    /**
     * Resolves a repository-relative file path, with or without extension.
     *
     * @param target path as referenced, already resolved against the referencing file
     * @return id of the file entity, empty if no file has exactly that path
     */
    public List<String> resolvePath(String target) {
        List<Entity> exact = byPath.getOrDefault(target, List.of());
        return exact.size() == 1 ? List.of(exact.get(0).id()) : List.of();
    }

    /**
     * Resolves an include path the way a search path would.
     *
     * <p>Tries the exact path first, then a unique file whose path ends with the
     * target, then repeats with leading directories of the target removed.
     *
     * @param target include path resolved against the including file
     * @return id of the file entity, empty if unresolved or ambiguous
     */
    public List<String> searchPath(String target) {
        String candidate = target;
        while (!candidate.isEmpty()) {
            List<Entity> exact = byPath.getOrDefault(candidate, List.of());
            if (!exact.isEmpty()) {
                return exact.size() == 1 ? List.of(exact.get(0).id()) : List.of();
            }
            Set<Entity> suffixed = new LinkedHashSet<>();
            String suffix = "/" + candidate;
            byPath.forEach((key, files) -> {
                if (key.endsWith(suffix)) {
                    suffixed.addAll(files);
                }
            });
            if (!suffixed.isEmpty()) {
                return suffixed.size() == 1 ? List.of(suffixed.iterator().next().id()) : List.of();
            }
            int slash = candidate.indexOf('/');
            candidate = slash < 0 ? "" : candidate.substring(slash + 1);
        }
        return List.of();
    }

    // ==================== Resolution Steps ====================

    private List<Entity> lookupImports(FileScope fileScope, String target) {
        String head = headOf(target);
        String rest = target.substring(head.length());
        for (ImportBinding binding : fileScope.imports()) {
            if (!binding.wildcard() && binding.alias().equals(head)) {
                List<Entity> found = lookupQualified(binding.target() + rest);
                if (!found.isEmpty()) {
                    return found;
                }
            }
        }
        for (ImportBinding binding : fileScope.imports()) {
            if (binding.wildcard()) {
                List<Entity> found = byQualifiedName.getOrDefault(binding.target() + "." + target, List.of());
                if (!found.isEmpty()) {
                    return found;
                }
            }
        }
        return List.of();
    }

    private List<Entity> lookupScopes(String filePath, FileScope fileScope, String scope, String target) {
        Map<String, List<Entity>> locals = byLocalName.getOrDefault(filePath, Map.of());
        String prefix = scope;
        while (true) {
            List<Entity> found = locals.getOrDefault(prefix.isEmpty() ? target : prefix + "." + target, List.of());
            if (!found.isEmpty()) {
                return found;
            }
            if (prefix.isEmpty()) {
                break;
            }
            int dot = prefix.lastIndexOf('.');
            prefix = dot < 0 ? "" : prefix.substring(0, dot);
        }
        if (!fileScope.namespace().isEmpty()) {
            return byQualifiedName.getOrDefault(fileScope.namespace() + "." + target, List.of());
        }
        return List.of();
    }

    private List<Entity> lookupQualified(String target) {
        List<Entity> exact = byQualifiedName.getOrDefault(target, List.of());
        if (!exact.isEmpty()) {
            return exact;
        }
        return byQualifiedSuffix.getOrDefault(target, List.of());
    }

    private List<Entity> lookupMember(String filePath, FileScope fileScope, String scope, String head, String rest) {
        List<Entity> owners = lookupImports(fileScope, head);
        if (owners.isEmpty()) {
            owners = lookupScopes(filePath, fileScope, scope, head);
        }
        if (owners.isEmpty()) {
            owners = lookupQualified(head);
        }
        List<Entity> found = new ArrayList<>();
        for (Entity owner : owners) {
            found.addAll(byQualifiedName.getOrDefault(owner.qualifiedName() + "." + rest, List.of()));
        }
        return found;
    }

    /**
     * Keeps overloads within one file; across files keeps only those in the referencing file.
     */
    private static List<String> choose(List<Entity> candidates, String filePath) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        long files = candidates.stream().map(Entity::filePath).distinct().count();
        List<Entity> chosen = files == 1
            ? candidates
            : candidates.stream().filter(entity -> entity.filePath().equals(filePath)).toList();
        return chosen.stream().map(Entity::id).distinct().toList();
    }

    private static boolean isImportedName(FileScope fileScope, String head) {
        return fileScope.imports().stream().anyMatch(binding -> !binding.wildcard() && binding.alias().equals(head));
    }

    // ==================== Indexing ====================

    private void indexPath(Entity file) {
        String path = file.filePath();
        index(byPath, path, file);
        String withoutExtension = FileUtils.stripExtension(path);
        if (!withoutExtension.equals(path)) {
            index(byPath, withoutExtension, file);
        }
        String fileName = withoutExtension.substring(withoutExtension.lastIndexOf('/') + 1);
        boolean packageEntry = "index".equals(fileName)
            || "__init__".equals(fileName) && file.language() == Language.PYTHON;
        String directory = FileUtils.parentDirectory(path);
        if (packageEntry && !directory.isEmpty()) {
            index(byPath, directory, file);
        }
    }

    private static void index(Map<String, List<Entity>> index, String key, Entity entity) {
        if (key != null && !key.isEmpty()) {
            index.computeIfAbsent(key, k -> new ArrayList<>()).add(entity);
        }
    }

    private static String localNameOf(Entity entity) {
        int separator = entity.id().indexOf("::");
        return stripOrdinals(separator < 0 ? "" : entity.id().substring(separator + 2));
    }

    private static String stripOrdinals(String localName) {
        return localName == null ? "" : localName.replaceAll("#\\d+", "");
    }

    private static String headOf(String target) {
        int dot = target.indexOf('.');
        return dot < 0 ? target : target.substring(0, dot);
    }

    private static String lastSegmentOf(String target) {
        return target.substring(target.lastIndexOf('.') + 1);
    }
}

package com.codepartition.core.graph;

import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.model.DependencyGraph;
import com.codepartition.core.model.Entity;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.Relation;
import com.codepartition.core.model.RelationKind;
import com.codepartition.core.model.UnresolvedReference;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.codepartition.core.graph.GraphFixtures.extract;
import static org.assertj.core.api.Assertions.assertThat;

class GraphBuilderTest {

    private static final String MODULE_A = "from pkg.b import helper\n\ndef run():\n    return helper()\n";
    private static final String MODULE_B = "def helper():\n    return 1\n";

    private final GraphBuilder builder = new GraphBuilder(String::length);

    @Test
    void build_withPythonImportAndCall_resolvesRelations() throws ExtractionException {
        // Given: a module importing and calling a function of another module
        List<FileExtraction> files = List.of(extract("pkg/a.py", MODULE_A), extract("pkg/b.py", MODULE_B));

        // When: building the graph
        DependencyGraph graph = builder.build(files);

        // Then: entities are in canonical order and both references resolve
        assertThat(graph.entities().keySet())
            .containsExactly("pkg/a.py", "pkg/a.py::run", "pkg/b.py", "pkg/b.py::helper");
        assertThat(graph.relations()).containsExactly(
            new Relation("pkg/a.py", "pkg/b.py::helper", RelationKind.IMPORT),
            new Relation("pkg/a.py::run", "pkg/b.py::helper", RelationKind.CALL));
        assertThat(graph.unresolvedReferences()).isEmpty();
    }

    @Test
    void build_withDeclarations_fillsEntityAttributes() throws ExtractionException {
        // When: building
        DependencyGraph graph = builder.build(List.of(extract("pkg/a.py", MODULE_A), extract("pkg/b.py", MODULE_B)));

        // Then: file and declaration entities carry names, parents and ordinals
        Entity module = graph.entity("pkg/a.py");
        assertThat(module.kind()).isEqualTo(EntityKind.FILE);
        assertThat(module.qualifiedName()).isEqualTo("pkg.a");
        assertThat(module.ordinal()).isZero();
        assertThat(module.parentId()).isNull();

        Entity run = graph.entity("pkg/a.py::run");
        assertThat(run.name()).isEqualTo("run");
        assertThat(run.qualifiedName()).isEqualTo("pkg.a.run");
        assertThat(run.parentId()).isEqualTo("pkg/a.py");
        assertThat(run.ordinal()).isEqualTo(1);
        assertThat(run.sourceText()).isEqualTo("def run():\n    return helper()");
    }

    @Test
    void build_withNestedEntities_countsEachCharacterOnce() throws ExtractionException {
        // Given: a file whose declarations are nested
        String content = "class A:\n    def f(self):\n        return 1\n\n    def g(self):\n        return 2\n\nx = 1\n";

        // When: building with a character counter
        DependencyGraph graph = builder.build(List.of(extract("m.py", content)));

        // Then: own token counts add up to the file length
        assertThat(graph.totalTokens()).isEqualTo(content.length());
        assertThat(graph.entity("m.py::A.f").tokenCount()).isEqualTo("def f(self):\n        return 1".length());
    }

    @Test
    void build_withExternalReferences_recordsThemAsUnresolved() throws ExtractionException {
        // Given: references to a package and a builtin outside the repository
        String content = "import requests\n\ndef fetch():\n    return len([])\n";

        // When: building
        DependencyGraph graph = builder.build(List.of(extract("net.py", content)));

        // Then: nothing resolves and both are reported
        assertThat(graph.relations()).isEmpty();
        assertThat(graph.unresolvedReferences()).containsExactly(
            new UnresolvedReference("net.py", "requests", RelationKind.IMPORT),
            new UnresolvedReference("net.py::fetch", "len", RelationKind.CALL));
    }

    @Test
    void build_withAmbiguousSimpleName_leavesReferenceUnresolved() throws ExtractionException {
        // Given: util() defined in two other files and called without an import
        List<FileExtraction> files = List.of(
            extract("x.py", "def util():\n    return 1\n"),
            extract("y.py", "def util():\n    return 2\n"),
            extract("z.py", "def main():\n    return util()\n"));

        // When: building
        DependencyGraph graph = builder.build(files);

        // Then: the call is not guessed
        assertThat(graph.relations()).isEmpty();
        assertThat(graph.unresolvedReferences())
            .containsExactly(new UnresolvedReference("z.py::main", "util", RelationKind.CALL));
    }

    @Test
    void build_withRecursion_dropsSelfEdge() throws ExtractionException {
        // Given: a recursive function
        String content = "def fact(n):\n    return 1 if n <= 1 else n * fact(n - 1)\n";

        // When: building
        DependencyGraph graph = builder.build(List.of(extract("math_utils.py", content)));

        // Then: no relation points back at its source
        assertThat(graph.relations()).isEmpty();
        assertThat(graph.unresolvedReferences()).isEmpty();
    }

    @Test
    void build_withJavaOverloads_linksEveryOverload() throws ExtractionException {
        // Given: a call to an overloaded method of the same class
        String content = """
            package p;
            public class Repo {
                public String find(String id) { return id; }
                public String find(long id) { return null; }
                public String lookup() { return find("x"); }
            }
            """;

        // When: building
        DependencyGraph graph = builder.build(List.of(extract("p/Repo.java", content)));

        // Then: both overloads are call targets
        assertThat(graph.relations()).contains(
            new Relation("p/Repo.java::Repo.lookup", "p/Repo.java::Repo.find", RelationKind.CALL),
            new Relation("p/Repo.java::Repo.lookup", "p/Repo.java::Repo.find#2", RelationKind.CALL));
    }

    @Test
    void build_withJavaScriptModules_resolvesPathImportsAndBindings() throws ExtractionException {
        // Given: an ES module importing a function from a sibling module
        List<FileExtraction> files = List.of(
            extract("src/app.js", "import { helper } from './util';\nfunction main() { return helper(); }\n"),
            extract("src/util.js", "export function helper() { return 1; }\n"));

        // When: building
        DependencyGraph graph = builder.build(files);

        // Then: the file import and the call both resolve
        assertThat(graph.relations()).containsExactly(
            new Relation("src/app.js", "src/util.js", RelationKind.IMPORT),
            new Relation("src/app.js::main", "src/util.js::helper", RelationKind.CALL));
    }

    @Test
    void build_withMissingRelativeImport_leavesItUnresolved() throws ExtractionException {
        // Given: a relative import of a file that does not exist next to the importer
        List<FileExtraction> files = List.of(
            extract("web/app.js", "import './missing';\nfunction main() { return 1; }\n"),
            extract("vendor/lib/missing.js", "export function other() { return 2; }\n"));

        // When: building
        DependencyGraph graph = builder.build(files);

        // Then: the same-named file elsewhere is not bound
        assertThat(graph.relations()).isEmpty();
        assertThat(graph.unresolvedReferences())
            .containsExactly(new UnresolvedReference("web/app.js", "web/missing", RelationKind.IMPORT));
    }

    @Test
    void build_withBareCInclude_searchesIncludeDirectories() throws ExtractionException {
        // Given: a bare include satisfied by an include directory and a relative one that is missing
        List<FileExtraction> files = List.of(
            extract("src/main.c", "#include \"lib/util.h\"\n#include \"../gone.h\"\n"),
            extract("include/lib/util.h", "int helper(int v);\n"),
            extract("other/gone.h", "int gone(void);\n"));

        // When: building
        DependencyGraph graph = builder.build(files);

        // Then: only the bare include falls back to a suffix match
        assertThat(graph.relations())
            .containsExactly(new Relation("src/main.c", "include/lib/util.h", RelationKind.IMPORT));
        assertThat(graph.unresolvedReferences())
            .containsExactly(new UnresolvedReference("src/main.c", "gone.h", RelationKind.IMPORT));
    }

    @Test
    void build_withShuffledInput_producesIdenticalGraph() throws ExtractionException {
        // Given: the same files in two different orders
        List<FileExtraction> files = new ArrayList<>(List.of(
            extract("pkg/a.py", MODULE_A),
            extract("pkg/b.py", MODULE_B),
            extract("net.py", "import requests\n")));
        List<FileExtraction> reversed = new ArrayList<>(files);
        Collections.reverse(reversed);

        // When/Then: the graphs are equal
        assertThat(builder.build(reversed)).isEqualTo(builder.build(files));
    }

    @Test
    void entityId_withEmptyLocalName_returnsPath() {
        assertThat(GraphBuilder.entityId("a/b.py", "")).isEqualTo("a/b.py");
        assertThat(GraphBuilder.entityId("a/b.py", "C.m")).isEqualTo("a/b.py::C.m");
    }
}

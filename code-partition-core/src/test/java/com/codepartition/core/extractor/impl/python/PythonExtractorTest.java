package com.codepartition.core.extractor.impl.python;

import com.codepartition.core.extractor.EntityExtractor;
import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.ExtractorTestBase;
import com.codepartition.core.model.CodeDeclaration;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.RelationKind;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link PythonExtractor}.
 */
class PythonExtractorTest extends ExtractorTestBase {

    private final PythonExtractor extractor = new PythonExtractor();

    @Override
    protected EntityExtractor extractor() {
        return extractor;
    }

    @Test
    void extract_withClassAndFunctions_declaresNestedEntities() throws ExtractionException {
        // Given: a module with a class, a decorated method and a top-level function
        String content = """
            import os
            from .models import User as U

            class Service(Base):
                def __init__(self, repo):
                    self.repo = repo

                @staticmethod
                def build(x, y=2):
                    return helper(x)


            def helper(value):
                return value
            """;

        // When: extracting
        FileExtraction extraction = extract("app/service.py", content);

        // Then: declarations are reported in source order with unique local names
        assertThat(localNames(extraction))
            .containsExactly("Service", "Service.__init__", "Service.build", "helper");
        assertThat(declaration(extraction, "Service").kind()).isEqualTo(EntityKind.CLASS);
        assertThat(declaration(extraction, "Service.__init__").kind()).isEqualTo(EntityKind.CONSTRUCTOR);
        assertThat(declaration(extraction, "Service.build").kind()).isEqualTo(EntityKind.METHOD);
        assertThat(declaration(extraction, "helper").kind()).isEqualTo(EntityKind.FUNCTION);
        assertThat(declaration(extraction, "Service.build").parentLocalName()).isEqualTo("Service");
        assertThat(declaration(extraction, "helper").parentLocalName()).isNull();
    }

    @Test
    void extract_withClassBody_spansUntilDedent() throws ExtractionException {
        // Given: a class followed by a top-level function
        String content = """
            import os
            from .models import User as U

            class Service(Base):
                def __init__(self, repo):
                    self.repo = repo

                @staticmethod
                def build(x, y=2):
                    return helper(x)


            def helper(value):
                return value
            """;

        // When: extracting
        FileExtraction extraction = extract("app/service.py", content);

        // Then: the class ends on its last indented line and decorators belong to the method
        CodeDeclaration service = declaration(extraction, "Service");
        assertThat(service.span().startLine()).isEqualTo(4);
        assertThat(service.span().endLine()).isEqualTo(10);
        CodeDeclaration build = declaration(extraction, "Service.build");
        assertThat(content.substring(build.span().startOffset())).startsWith("@staticmethod");
        assertThat(declaration(extraction, "helper").span().startLine()).isEqualTo(13);
    }

    @Test
    void extract_withParameters_reportsParameterNames() throws ExtractionException {
        // Given: functions with defaults, annotations and star arguments
        String content = """
            def build(x, y=2):
                pass

            def typed(name: str, *args, limit: int = 10, **kwargs) -> None:
                pass
            """;

        // When: extracting
        FileExtraction extraction = extract("util.py", content);

        // Then: parameter names are stripped of defaults, annotations and stars
        assertThat(declaration(extraction, "build").parameters()).containsExactly("x", "y");
        assertThat(declaration(extraction, "typed").parameters())
            .containsExactly("name", "args", "limit", "kwargs");
    }

    @Test
    void extract_withImports_recordsBindingsAndReferences() throws ExtractionException {
        // Given: plain, aliased and relative imports
        String content = """
            import os
            import numpy as np
            from .models import User as U
            from ..core import base
            from pkg.tools import *
            """;

        // When: extracting app/api/views.py
        FileExtraction extraction = extract("app/api/views.py", content);

        // Then: relative imports are resolved against the package
        assertThat(extraction.namespace()).isEqualTo("app.api.views");
        assertThat(extraction.imports()).containsExactly(
            ImportBinding.named("np", "numpy"),
            ImportBinding.named("U", "app.api.models.User"),
            ImportBinding.named("base", "app.core.base"),
            ImportBinding.wildcard("pkg.tools"));
        assertThat(targets(extraction, "", RelationKind.IMPORT)).containsExactly(
            "os", "numpy", "app.api.models.User", "app.core.base", "pkg.tools");
    }

    @Test
    void extract_withCalls_attributesCallsToInnermostDeclaration() throws ExtractionException {
        // Given: calls at file level, in a function and in a nested function
        String content = """
            def outer():
                def inner():
                    return compute(1)
                return inner()

            setup()
            """;

        // When: extracting
        FileExtraction extraction = extract("calls.py", content);

        // Then: each call belongs to its innermost enclosing declaration
        assertThat(declaration(extraction, "outer.inner").kind()).isEqualTo(EntityKind.FUNCTION);
        assertThat(targets(extraction, "outer.inner", RelationKind.CALL)).containsExactly("compute");
        assertThat(targets(extraction, "outer", RelationKind.CALL)).containsExactly("inner");
        assertThat(targets(extraction, "", RelationKind.CALL)).containsExactly("setup");
    }

    @Test
    void extract_withCommentsAndStrings_ignoresCallsInsideThem() throws ExtractionException {
        // Given: call-like text inside a comment and a string
        String content = """
            def f():
                # ignored()
                s = "fake()"
                return real()
            """;

        // When: extracting
        FileExtraction extraction = extract("f.py", content);

        // Then: only the real call is recorded
        assertThat(targets(extraction, "f", RelationKind.CALL)).containsExactly("real");
    }

    @Test
    void extract_withReceiverCalls_dropsSelfPrefixAndKeywords() throws ExtractionException {
        // Given: calls through self, super() and a builtin keyword
        String content = """
            class Child(Parent, metaclass=Meta):
                def run(self):
                    super().run()
                    print("x")
                    return self.helper()
            """;

        // When: extracting
        FileExtraction extraction = extract("child.py", content);

        // Then: self. is dropped, keywords are skipped and keyword bases are ignored
        assertThat(targets(extraction, "Child.run", RelationKind.CALL)).containsExactly("helper");
        assertThat(targets(extraction, "Child", RelationKind.INHERIT)).containsExactly("Parent");
    }

    @Test
    void extract_withDuplicateNames_suffixesLocalNames() throws ExtractionException {
        // Given: a function redefined in the same module
        String content = """
            def dup():
                return 1

            def dup():
                return 2
            """;

        // When: extracting
        FileExtraction extraction = extract("dup.py", content);

        // Then: the second definition gets an ordinal suffix
        assertThat(localNames(extraction)).containsExactly("dup", "dup#2");
    }

    @Test
    void extract_withUnclosedParameterList_throwsSyntaxError() {
        // Given: a def whose parameter list never closes
        String content = "def broken(a, b:\n    pass\n";

        // When/Then: the file is rejected
        assertThatThrownBy(() -> extract("broken.py", content))
            .isInstanceOfSatisfying(ExtractionException.class,
                e -> assertThat(e.getErrorType()).isEqualTo("Syntax error"))
            .hasMessageContaining("broken");
    }

    @Test
    void moduleName_withPackageInit_returnsPackage() {
        assertThat(PythonExtractor.moduleName("pkg/sub/mod.py")).isEqualTo("pkg.sub.mod");
        assertThat(PythonExtractor.moduleName("pkg/__init__.py")).isEqualTo("pkg");
        assertThat(PythonExtractor.moduleName("__init__.py")).isEmpty();
    }

    @Test
    void absoluteModule_withRelativeImports_resolvesAgainstPackage() {
        assertThat(PythonExtractor.absoluteModule(".models", "app.service", false)).isEqualTo("app.models");
        assertThat(PythonExtractor.absoluteModule("..core", "app.api.views", false)).isEqualTo("app.core");
        assertThat(PythonExtractor.absoluteModule(".", "pkg", true)).isEqualTo("pkg");
        assertThat(PythonExtractor.absoluteModule("os.path", "pkg.mod", false)).isEqualTo("os.path");
    }

    @Test
    void extract_withTripleQuotedStringAtColumnZero_keepsMethodOpen() throws ExtractionException {
        // Given: a method whose multi-line string closes at the start of a line
        String content = "class A:\n"
            + "    def p(self):\n"
            + "        s = \"\"\"\n"
            + "text\n"
            + "\"\"\"\n"
            + "        return helper(s)\n";

        // When: extracting
        FileExtraction extraction = extract("a.py", content);

        // Then: the class and the method reach the last line
        assertThat(declaration(extraction, "A").span().endLine()).isEqualTo(6);
        assertThat(declaration(extraction, "A.p").span().endLine()).isEqualTo(6);
        assertThat(targets(extraction, "A.p", RelationKind.CALL)).containsExactly("helper");
    }

    @Test
    void extract_withBracketContinuationAtColumnZero_keepsFunctionOpen() throws ExtractionException {
        // Given: a call whose arguments continue at the start of a line
        String content = "def f(x,\n"
            + " y):\n"
            + "    return g(\n"
            + "1)\n"
            + "\n"
            + "def h():\n"
            + "    return 2\n";

        // When: extracting
        FileExtraction extraction = extract("f.py", content);

        // Then: the continuation line belongs to f and h still starts a new block
        assertThat(declaration(extraction, "f").span().endLine()).isEqualTo(4);
        assertThat(declaration(extraction, "f").parameters()).containsExactly("x", "y");
        assertThat(targets(extraction, "f", RelationKind.CALL)).containsExactly("g");
        assertThat(declaration(extraction, "h").span().startLine()).isEqualTo(6);
    }

    @Test
    void continuationLines_withBackslashAndBrackets_marksFollowingLines() {
        // Given: a backslash continuation followed by a closed bracket
        String masked = "x = 1 + \\\n2\ny = (3)\nz\n";

        // When: scanning
        BitSet continued = PythonExtractor.continuationLines(masked);

        // Then: only the line after the backslash continues
        assertThat(continued.get(masked.indexOf("2"))).isTrue();
        assertThat(continued.get(masked.indexOf("y"))).isFalse();
        assertThat(continued.get(masked.indexOf("z"))).isFalse();
    }
}

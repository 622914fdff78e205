package com.codepartition.core.extractor.impl.c;

import com.codepartition.core.extractor.EntityExtractor;
import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.ExtractorTestBase;
import com.codepartition.core.model.CodeDeclaration;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.RelationKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link CExtractor}.
 */
class CExtractorTest extends ExtractorTestBase {

    private static final String MAIN = """
        #include "util.h"
        #include <stdio.h>

        struct Point {
            int x;
            int y;
        };

        typedef struct Node {
            struct Node *next;
        } Node;

        static int add(int a, int b) {
            return helper(a) + b;
        }

        int main(void) {
            struct Point p = {1, 2};
            if (p.x > 0) {
                printf("%d", add(p.x, p.y));
            }
            return 0;
        }
        """;

    private final CExtractor extractor = new CExtractor();

    @Override
    protected EntityExtractor extractor() {
        return extractor;
    }

    @Test
    void extract_withDefinitions_declaresStructsAndFunctions() throws ExtractionException {
        // When: extracting a source file with structs and functions
        FileExtraction extraction = extract("src/main.c", MAIN);

        // Then: initializer and control flow braces are not declarations
        assertThat(localNames(extraction)).containsExactly("Point", "Node", "add", "main");
        assertThat(extraction.declarations()).extracting(CodeDeclaration::kind).containsExactly(
            EntityKind.STRUCT, EntityKind.STRUCT, EntityKind.FUNCTION, EntityKind.FUNCTION);
        assertThat(declaration(extraction, "add").parameters()).containsExactly("a", "b");
        assertThat(declaration(extraction, "main").parameters()).isEmpty();
    }

    @Test
    void extract_withCalls_attributesToFunctions() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("src/main.c", MAIN);

        // Then: calls nested in blocks and arguments belong to the function
        assertThat(targets(extraction, "add", RelationKind.CALL)).containsExactly("helper");
        assertThat(targets(extraction, "main", RelationKind.CALL)).containsExactly("printf", "add");
    }

    @Test
    void extract_withIncludes_resolvesQuotedIncludesOnly() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("src/main.c", MAIN);

        // Then: quoted includes resolve against the file's directory and system includes are skipped
        assertThat(pathTargets(extraction)).containsExactly("src/util.h");
    }

    @Test
    void extract_withPrototypesOnly_declaresNothing() throws ExtractionException {
        // Given: a header with a prototype and a forward declaration
        String content = """
            #ifndef UTIL_H
            #define UTIL_H
            int helper(int v);
            struct Config;
            #endif
            """;

        // When: extracting
        FileExtraction extraction = extract("src/util.h", content);

        // Then: no entity is declared
        assertThat(extraction.declarations()).isEmpty();
    }

    @Test
    void extract_withMacroBraces_ignoresPreprocessorLines() throws ExtractionException {
        // Given: a macro body with an unbalanced brace on a continued directive
        String content = """
            #define BEGIN_BLOCK { \\
                int guard = 0;
            int square(int v) {
                return v * v;
            }
            """;

        // When: extracting
        FileExtraction extraction = extract("macro.c", content);

        // Then: the directive is skipped and the function is found
        assertThat(localNames(extraction)).containsExactly("square");
    }
}

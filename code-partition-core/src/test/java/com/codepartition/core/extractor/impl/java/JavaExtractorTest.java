package com.codepartition.core.extractor.impl.java;

import com.codepartition.core.extractor.EntityExtractor;
import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.ExtractorTestBase;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.RelationKind;
import com.codepartition.core.model.SourceSpan;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link JavaExtractor}.
 */
class JavaExtractorTest extends ExtractorTestBase {

    private static final String USER_SERVICE = """
        package com.acme.service;

        import com.acme.model.User;
        import java.util.*;
        import static com.acme.util.Strings.trim;

        public class UserService extends BaseService implements Auditable {
            private final UserRepository repository;
            public UserService(UserRepository repository) { this.repository = repository; }
            public User find(String id) { return repository.findById(trim(id)); }
            public User find(long id) { return new User(id); }
            static class Cache { void clear() { } }
        }
        """;

    private final JavaExtractor extractor = new JavaExtractor();

    @Override
    protected EntityExtractor extractor() {
        return extractor;
    }

    @Test
    void extract_withClass_declaresMembersAndOverloads() throws ExtractionException {
        // When: extracting a class with overloads and a nested class
        FileExtraction extraction = extract("src/main/java/com/acme/service/UserService.java", USER_SERVICE);

        // Then: overloads get ordinal suffixes and nested members are qualified by their parents
        assertThat(extraction.namespace()).isEqualTo("com.acme.service");
        assertThat(localNames(extraction)).containsExactly(
            "UserService",
            "UserService.UserService",
            "UserService.find",
            "UserService.find#2",
            "UserService.Cache",
            "UserService.Cache.clear");
        assertThat(declaration(extraction, "UserService.UserService").kind()).isEqualTo(EntityKind.CONSTRUCTOR);
        assertThat(declaration(extraction, "UserService.UserService").parameters()).containsExactly("repository");
        assertThat(declaration(extraction, "UserService.find#2").kind()).isEqualTo(EntityKind.METHOD);
        assertThat(declaration(extraction, "UserService.Cache").kind()).isEqualTo(EntityKind.CLASS);
        assertThat(declaration(extraction, "UserService.Cache.clear").parentLocalName())
            .isEqualTo("UserService.Cache");
    }

    @Test
    void extract_withImports_recordsBindings() throws ExtractionException {
        // When: extracting a file with single type, wildcard and static imports
        FileExtraction extraction = extract("UserService.java", USER_SERVICE);

        // Then: static imports refer to their declaring class, wildcards only bind
        assertThat(extraction.imports()).containsExactly(
            ImportBinding.named("User", "com.acme.model.User"),
            ImportBinding.wildcard("java.util"),
            ImportBinding.named("trim", "com.acme.util.Strings.trim"));
        assertThat(targets(extraction, "", RelationKind.IMPORT))
            .containsExactly("com.acme.model.User", "com.acme.util.Strings");
    }

    @Test
    void extract_withClassBody_recordsCallsInheritanceAndTypeReferences() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("UserService.java", USER_SERVICE);

        // Then: every relation is attributed to its declaring member
        assertThat(targets(extraction, "UserService", RelationKind.INHERIT))
            .containsExactly("BaseService", "Auditable");
        assertThat(targets(extraction, "UserService", RelationKind.REFERENCE)).contains("UserRepository");
        assertThat(targets(extraction, "UserService.UserService", RelationKind.REFERENCE))
            .containsExactly("UserRepository");
        assertThat(targets(extraction, "UserService.find", RelationKind.CALL))
            .containsExactly("repository.findById", "trim");
        assertThat(targets(extraction, "UserService.find#2", RelationKind.CALL)).containsExactly("User");
        assertThat(targets(extraction, "UserService.find", RelationKind.REFERENCE)).contains("User", "String");
    }

    @Test
    void extract_withInterfaceEnumAndRecord_mapsKinds() throws ExtractionException {
        // Given: one file with an interface, an enum and a record
        String content = """
            package shapes;

            interface Shape { double area(); }

            enum Color { RED, GREEN }

            record Point(int x, int y) implements Shape {
                public double area() { return 0; }
            }
            """;

        // When: extracting
        FileExtraction extraction = extract("shapes/Shape.java", content);

        // Then: each type maps to its kind and records inherit their interfaces
        assertThat(declaration(extraction, "Shape").kind()).isEqualTo(EntityKind.INTERFACE);
        assertThat(declaration(extraction, "Color").kind()).isEqualTo(EntityKind.ENUM);
        assertThat(declaration(extraction, "Point").kind()).isEqualTo(EntityKind.CLASS);
        assertThat(declaration(extraction, "Point.area").kind()).isEqualTo(EntityKind.METHOD);
        assertThat(targets(extraction, "Point", RelationKind.INHERIT)).containsExactly("Shape");
    }

    @Test
    void extract_withSpan_coversWholeDeclaration() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("UserService.java", USER_SERVICE);

        // Then: the class span covers its header and closing brace
        SourceSpan span = declaration(extraction, "UserService").span();
        String text = USER_SERVICE.substring(span.startOffset(), span.endOffset());
        assertThat(text).startsWith("public class UserService").endsWith("}");
        assertThat(span.startLine()).isEqualTo(7);
        assertThat(span.endLine()).isEqualTo(13);
    }

    @Test
    void extract_withMissingBrace_throwsSyntaxError() {
        // Given: a class whose body never closes
        String content = "package a;\npublic class Broken {\n    void run() {\n}\n";

        // When/Then: the file is rejected as a syntax error
        assertThatThrownBy(() -> extract("Broken.java", content))
            .isInstanceOfSatisfying(ExtractionException.class,
                e -> assertThat(e.getErrorType()).isEqualTo("Syntax error"));
    }
}

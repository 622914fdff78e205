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
 * Functional tests for {@link CppExtractor}.
 */
class CppExtractorTest extends ExtractorTestBase {

    private static final String CIRCLE = """
        #include "shape.hpp"

        namespace geo {

        class Circle : public Shape {
        public:
            Circle(double r) : radius_(r) {}
            double area() const override { return compute(radius_); }
        private:
            double radius_;
        };

        double Circle::perimeter() const {
            return 2 * radius_;
        }

        }
        """;

    private final CppExtractor extractor = new CppExtractor();

    @Override
    protected EntityExtractor extractor() {
        return extractor;
    }

    @Test
    void extract_withClass_declaresInClassAndOutOfLineMembers() throws ExtractionException {
        // When: extracting a class inside a namespace with an out-of-line method
        FileExtraction extraction = extract("geo/circle.cpp", CIRCLE);

        // Then: the namespace is transparent and Circle::perimeter becomes Circle.perimeter
        assertThat(localNames(extraction)).containsExactly(
            "Circle", "Circle.Circle", "Circle.area", "Circle.perimeter");
        assertThat(extraction.declarations()).extracting(CodeDeclaration::kind).containsExactly(
            EntityKind.CLASS, EntityKind.CONSTRUCTOR, EntityKind.METHOD, EntityKind.METHOD);
        assertThat(declaration(extraction, "Circle.Circle").parameters()).containsExactly("r");
        assertThat(declaration(extraction, "Circle.perimeter").name()).isEqualTo("perimeter");
    }

    @Test
    void extract_withBaseClauseAndCalls_recordsRelations() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("geo/circle.cpp", CIRCLE);

        // Then: access specifiers are stripped from base names
        assertThat(targets(extraction, "Circle", RelationKind.INHERIT)).containsExactly("Shape");
        assertThat(targets(extraction, "Circle.area", RelationKind.CALL)).containsExactly("compute");
        assertThat(pathTargets(extraction)).containsExactly("geo/shape.hpp");
    }
}

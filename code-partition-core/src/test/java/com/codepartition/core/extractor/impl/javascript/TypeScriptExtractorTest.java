package com.codepartition.core.extractor.impl.javascript;

import com.codepartition.core.extractor.EntityExtractor;
import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.ExtractorTestBase;
import com.codepartition.core.model.CodeDeclaration;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.FileExtraction;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.RelationKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link TypeScriptExtractor}.
 */
class TypeScriptExtractorTest extends ExtractorTestBase {

    private static final String SERVICE = """
        import { Repo } from './repo';

        export interface Entity extends Base<string> {
          id: string;
        }

        export enum Status {
          Active,
          Inactive
        }

        export class UserService implements Service {
          private cache: Map<string, string> = new Map();

          constructor(private readonly repo: Repo) {}

          async find(id: string): Promise<Entity> {
            return this.repo.load(id);
          }
        }
        """;

    private final TypeScriptExtractor extractor = new TypeScriptExtractor();

    @Override
    protected EntityExtractor extractor() {
        return extractor;
    }

    @Test
    void extract_withTypeDeclarations_mapsInterfacesAndEnums() throws ExtractionException {
        // When: extracting a module with an interface, an enum and a class
        FileExtraction extraction = extract("src/service.ts", SERVICE);

        // Then: every declaration is found with its kind
        assertThat(localNames(extraction)).containsExactly(
            "Entity", "Status", "UserService", "UserService.constructor", "UserService.find");
        assertThat(extraction.declarations()).extracting(CodeDeclaration::kind).containsExactly(
            EntityKind.INTERFACE, EntityKind.ENUM, EntityKind.CLASS, EntityKind.CONSTRUCTOR, EntityKind.METHOD);
    }

    @Test
    void extract_withTypeAnnotations_reportsParameterNamesOnly() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("src/service.ts", SERVICE);

        // Then: modifiers and annotations are dropped from parameter names
        assertThat(declaration(extraction, "UserService.constructor").parameters()).containsExactly("repo");
        assertThat(declaration(extraction, "UserService.find").parameters()).containsExactly("id");
    }

    @Test
    void extract_withHeritageClauses_recordsInheritance() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("src/service.ts", SERVICE);

        // Then: generic arguments are stripped from base names
        assertThat(targets(extraction, "Entity", RelationKind.INHERIT)).containsExactly("Base");
        assertThat(targets(extraction, "UserService", RelationKind.INHERIT)).containsExactly("Service");
    }

    @Test
    void extract_withCallsAndImports_recordsRelations() throws ExtractionException {
        // When: extracting
        FileExtraction extraction = extract("src/service.ts", SERVICE);

        // Then: field initializers belong to the class and receiver prefixes are dropped
        assertThat(targets(extraction, "UserService", RelationKind.CALL)).containsExactly("Map");
        assertThat(targets(extraction, "UserService.find", RelationKind.CALL)).containsExactly("repo.load");
        assertThat(pathTargets(extraction)).containsExactly("src/repo");
        assertThat(extraction.imports()).containsExactly(ImportBinding.named("Repo", "src/repo.Repo"));
    }

    @Test
    void extract_withRegexLiteralBraces_keepsBracesBalanced() throws ExtractionException {
        // Given: regex literals containing braces next to a division
        String content = """
            const r = /}/;
            export function strip(value: string, total: number): string {
              const half = total / 2 / 1;
              return value.replace(/[{}]/g, '');
            }
            """;

        // When: extracting
        FileExtraction extraction = extract("src/strip.ts", content);

        // Then: the function is found
        assertThat(localNames(extraction)).containsExactly("strip");
    }
}

package com.codepartition.core.renderer.impl;

import com.codepartition.core.renderer.GeneratedFile;
import com.codepartition.core.renderer.GeneratedOutput;
import com.codepartition.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleFiles_writesAllFilesToOutputDirectory() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.json("module_tree.json", "{}\n"),
            GeneratedFile.json("components.json", "{ \"a\" : 1 }\n")));
        Path outputDir = tempDir.resolve("docs/module-tree");

        // When
        renderer.render(output, new RenderContext(outputDir, false));

        // Then
        assertThat(Files.readString(outputDir.resolve("module_tree.json"))).isEqualTo("{}\n");
        assertThat(Files.readString(outputDir.resolve("components.json"))).isEqualTo("{ \"a\" : 1 }\n");
    }

    @Test
    void render_withNestedPath_createsParentDirectories() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.json("nested/deep/tree.json", "[]")));

        // When
        renderer.render(output, new RenderContext(tempDir, false));

        // Then
        assertThat(tempDir.resolve("nested/deep/tree.json")).exists();
    }

    @Test
    void render_withExistingFile_overwritesIt() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("metadata.json"), "old content that is longer");
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.json("metadata.json", "new")));

        // When
        renderer.render(output, new RenderContext(tempDir, false));

        // Then
        assertThat(Files.readString(tempDir.resolve("metadata.json"))).isEqualTo("new");
    }

    @Test
    void render_withNonAsciiContent_writesUtf8() throws IOException {
        // Given
        String content = "{ \"name\" : \"Größe\" }";
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.json("u.json", content)));

        // When
        renderer.render(output, new RenderContext(tempDir, false));

        // Then
        assertThat(Files.readAllBytes(tempDir.resolve("u.json")))
            .isEqualTo(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void render_inDryRun_writesNothing() {
        // Given
        Path outputDir = tempDir.resolve("out");
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.json("module_tree.json", "{}")));

        // When
        renderer.render(output, new RenderContext(outputDir, true));

        // Then
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void generatedFile_withPathLeavingOutputDirectory_isRejected() {
        assertThatThrownBy(() -> GeneratedFile.json("../escape.json", "{}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GeneratedFile.json("/abs.json", "{}"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.codepartition;

import com.codepartition.cli.ExitCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CodePartitionCLI} and its subcommands, run in-process.
 */
class CodePartitionCLITest {

    @TempDir
    Path tempDir;

    @Test
    void list_returnsSuccess() {
        int exitCode = CodePartitionCLI.createCommandLine().execute("-q", "list");

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
    }

    @Test
    void validate_withMissingFile_returnsConfigurationError() {
        int exitCode = CodePartitionCLI.createCommandLine()
            .execute("-q", "validate", tempDir.resolve("absent.yaml").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
    }

    @Test
    void validate_withZeroDepth_returnsConfigurationError() throws IOException {
        Path config = tempDir.resolve("codepartition.yaml");
        Files.writeString(config, """
            clustering:
              maxDepth: 0
            """);

        int exitCode = CodePartitionCLI.createCommandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
    }

    @Test
    void validate_withMalformedYaml_returnsConfigurationError() throws IOException {
        Path config = tempDir.resolve("codepartition.yaml");
        Files.writeString(config, "clustering: [unclosed");

        int exitCode = CodePartitionCLI.createCommandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
    }

    @Test
    void validate_withValidConfig_returnsSuccess() throws IOException {
        Path config = tempDir.resolve("codepartition.yaml");
        Files.writeString(config, """
            clustering:
              maxTokenPerModule: 20000
              maxTokenPerLeafModule: 8000
              maxDepth: 3
            """);

        int exitCode = CodePartitionCLI.createCommandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
    }

    @Test
    void analyze_withOutputOption_writesArtifacts() throws IOException {
        // Given
        Path repo = createRepository();
        Path output = tempDir.resolve("out");

        // When
        int exitCode = CodePartitionCLI.createCommandLine()
            .execute("-q", "analyze", repo.toString(), "-o", output.toString());

        // Then
        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(output.resolve("module_tree.json")).exists();
        assertThat(output.resolve("components.json")).exists();
        assertThat(output.resolve("metadata.json")).exists();
        assertThat(Files.readString(output.resolve("components.json"))).contains("app/util.py::helper");
    }

    @Test
    void analyze_withDryRun_writesNothing() throws IOException {
        // Given
        Path repo = createRepository();
        Path output = tempDir.resolve("out");

        // When
        int exitCode = CodePartitionCLI.createCommandLine()
            .execute("-q", "analyze", repo.toString(), "-o", output.toString(), "--dry-run");

        // Then
        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(output).doesNotExist();
    }

    @Test
    void analyze_withInvalidOverride_returnsConfigurationError() throws IOException {
        Path repo = createRepository();

        int exitCode = CodePartitionCLI.createCommandLine()
            .execute("-q", "analyze", repo.toString(), "--max-depth", "0", "--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
    }

    @Test
    void analyze_withMissingSavedGrouping_returnsFailure() throws IOException {
        Path repo = createRepository();
        Files.writeString(repo.resolve("codepartition.yaml"), """
            clustering:
              savedGrouping: "absent/module_tree.json"
            """);

        int exitCode = CodePartitionCLI.createCommandLine().execute("-q", "analyze", repo.toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
    }

    private Path createRepository() throws IOException {
        Path repo = tempDir.resolve("repo");
        Files.createDirectories(repo.resolve("app"));
        Files.writeString(repo.resolve("app/main.py"), "from app.util import helper\n\ndef main():\n    return helper()\n");
        Files.writeString(repo.resolve("app/util.py"), "def helper():\n    return 42\n");
        return repo;
    }
}

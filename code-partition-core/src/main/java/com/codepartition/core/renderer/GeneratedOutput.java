package com.codepartition.core.renderer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The artifacts of one partition run.
 *
 * @param files generated files in writing order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Looks up a file by its relative path.
     *
     * @param relativePath path below the output directory
     * @return the file, or empty if absent
     */
    public Optional<GeneratedFile> file(String relativePath) {
        return files.stream().filter(file -> file.relativePath().equals(relativePath)).findFirst();
    }
}

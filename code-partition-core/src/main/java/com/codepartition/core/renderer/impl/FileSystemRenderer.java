package com.codepartition.core.renderer.impl;

import com.codepartition.core.renderer.GeneratedFile;
import com.codepartition.core.renderer.GeneratedOutput;
import com.codepartition.core.renderer.OutputRenderer;
import com.codepartition.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes artifacts below the output directory, creating directories as needed and
 * overwriting existing files. Content is written as UTF-8.
 *
 * <p>In dry-run mode nothing is written; each file that would be written is logged.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        if (context.dryRun()) {
            for (GeneratedFile file : output.files()) {
                log.info("[dry-run] Would write {} ({} bytes)", outputDir.resolve(file.relativePath()),
                    file.sizeInBytes());
            }
            return;
        }

        log.info("Writing {} artifacts to: {}", output.files().size(), outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} bytes)", file.relativePath(), file.sizeInBytes());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}

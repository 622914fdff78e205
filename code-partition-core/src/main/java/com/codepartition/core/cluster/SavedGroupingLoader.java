package com.codepartition.core.cluster;

import com.codepartition.core.PartitionException;
import com.codepartition.core.model.Module;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a previously written, possibly hand-edited {@code module_tree.json}.
 *
 * <p>Only the structure, names and entity ids are used; the
 * {@link ModuleTreeAssembler} recomputes everything else.
 */
public class SavedGroupingLoader {

    private static final Logger log = LoggerFactory.getLogger(SavedGroupingLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);

    private SavedGroupingLoader() {
    }

    /**
     * Loads the root module of a saved tree.
     *
     * @param path path to the saved {@code module_tree.json}
     * @return root module as saved
     * @throws PartitionException if the file is missing or malformed
     */
    public static Module load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PartitionException("Saved grouping not found: " + path);
        }
        try {
            Module root = JSON_MAPPER.readValue(path.toFile(), Module.class);
            if (root == null) {
                throw new PartitionException("Saved grouping is empty: " + path);
            }
            log.info("Loaded saved grouping from: {}", path);
            return root;
        } catch (IOException e) {
            throw new PartitionException("Failed to read saved grouping " + path + ": " + e.getMessage(), e);
        }
    }
}

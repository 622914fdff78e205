package com.codepartition.cli;

import com.codepartition.core.ConfigurationException;
import com.codepartition.core.config.ConfigLoader;
import com.codepartition.core.config.PartitionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file.
 *
 * <p>Unlike {@code analyze}, a file that is missing or cannot be parsed is an error
 * here rather than a fallback to defaults.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        if (!Files.isRegularFile(configFile)) {
            System.err.println("✗ Configuration file not found: " + configFile);
            return ExitCodes.CONFIGURATION_ERROR;
        }
        try {
            PartitionConfig config = ConfigLoader.parse(Files.readString(configFile));
            config.validate();
            PartitionConfig.ClusteringConfig clustering = config.clustering();
            System.out.println("✓ Configuration is valid: " + configFile);
            System.out.printf("  maxTokenPerModule=%d, maxTokenPerLeafModule=%d, maxDepth=%d%n",
                clustering.maxTokenPerModule(), clustering.maxTokenPerLeafModule(), clustering.maxDepth());
            return ExitCodes.SUCCESS;
        } catch (IOException e) {
            log.debug("Failed to parse {}", configFile, e);
            System.err.println("✗ Cannot parse " + configFile + ": " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (ConfigurationException e) {
            for (String violation : e.getViolations()) {
                System.err.println("✗ " + violation);
            }
            return ExitCodes.CONFIGURATION_ERROR;
        }
    }
}

package com.codepartition;

import ch.qos.logback.classic.Level;
import com.codepartition.cli.AnalyzeCommand;
import com.codepartition.cli.ListCommand;
import com.codepartition.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the code partitioner.
 *
 * <p>Partitions a source repository into a token-budgeted module tree and writes the
 * {@code module_tree.json}, {@code components.json} and {@code metadata.json} artifacts.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Partition a repository and write the artifacts</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 *   <li>{@code list} - List supported languages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * codepartition analyze /path/to/repo --max-depth 3
 * codepartition -v analyze --dry-run
 * codepartition validate codepartition.yaml
 * }</pre>
 */
@Command(
    name = "codepartition",
    mixinStandardHelpOptions = true,
    version = "code-partition 1.0.0-SNAPSHOT",
    description = "Partitions a source repository into a hierarchical, token-budgeted module tree",
    subcommands = {
        AnalyzeCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class CodePartitionCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodePartitionCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("code-partition - hierarchical module tree partitioner");
        System.out.println();
        System.out.println("Use 'codepartition --help' to see available commands");
        System.out.println("Use 'codepartition <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        CodePartitionCLI cli = new CodePartitionCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}

package com.distindex;

import com.distindex.cli.GenerateCommand;
import com.distindex.cli.ListCommand;
import com.distindex.cli.ShowCommand;
import com.distindex.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DistIndex.
 *
 * <p>DistIndex merges package index, dependency, upload, tester, rating,
 * metadata and bug tracker extracts into one indexed SQLite database, and
 * computes the weight and volatility of every distribution.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate the index database</li>
 *   <li>{@code validate} - Validate configuration and extract availability</li>
 *   <li>{@code list} - List the pipeline stages</li>
 *   <li>{@code show} - Show one distribution of a generated index</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Generate with distindex.yaml from the current directory
 * distindex generate
 *
 * # Generate into a specific file, keeping staging tables
 * distindex -v generate -o /tmp/cpandb.sqlite --keep-staging
 *
 * # Inspect the result
 * distindex show Test-Simple --db /tmp/cpandb.sqlite
 * }</pre>
 */
@Command(
    name = "distindex",
    mixinStandardHelpOptions = true,
    version = "DistIndex 1.0.0-SNAPSHOT",
    description = "Package ecosystem index generator",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        ListCommand.class,
        ShowCommand.class
    }
)
public class DistIndexCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DistIndexCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("DistIndex - Package Ecosystem Index Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'distindex --help' to see available commands");
        System.out.println("Use 'distindex <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DistIndexCLI cli = new DistIndexCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

package com.furiflow;

import com.furiflow.cli.GenerateCommand;
import com.furiflow.cli.ListCommand;
import com.furiflow.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for FuriFlow.
 *
 * <p>FuriFlow turns a visual block graph into Flipper Zero application source.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate application source from a graph and a manifest</li>
 *   <li>{@code validate} - Check a C source file for the required application structure</li>
 *   <li>{@code list} - List block categories or block types of a catalog</li>
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
 * furiflow generate -g blinky.json -m manifest.yaml -o build/blinky
 * furiflow validate build/blinky/main.c --app-id blinky --entry-point blinky_app
 * furiflow list blocks --category actions
 * }</pre>
 */
@Command(
    name = "furiflow",
    mixinStandardHelpOptions = true,
    version = "FuriFlow 1.0.0-SNAPSHOT",
    description = "Visual block graph to Flipper Zero application code generator",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class FuriFlowCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FuriFlowCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("FuriFlow - Visual Flipper Zero Application Builder");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'furiflow --help' to see available commands");
        System.out.println("Use 'furiflow <command> --help' for command-specific help");
    }

    /**
     * Configures the root log level from the global options.
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

    /**
     * Builds the command line, applying the global log options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        FuriFlowCLI cli = new FuriFlowCLI();
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

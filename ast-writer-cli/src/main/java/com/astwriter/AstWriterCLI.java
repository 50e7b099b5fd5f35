package com.astwriter;

import ch.qos.logback.classic.Level;
import com.astwriter.cli.ListCommand;
import com.astwriter.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for AstWriter.
 *
 * <p>AstWriter renders JSON syntax trees back to source text, optionally producing a
 * source map from every node to the byte range of its text.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a JSON tree to source</li>
 *   <li>{@code list} - List available writer mappings</li>
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
 * # Render a tree and its source map
 * astwriter render contract.json -o Contract.sol -m Contract.map.json
 *
 * # Render for an older compiler
 * astwriter render contract.json --target-version 0.7.6
 * }</pre>
 */
@Command(
    name = "astwriter",
    mixinStandardHelpOptions = true,
    version = "AstWriter 1.0.0-SNAPSHOT",
    description = "Renders syntax trees to source code with byte-accurate source maps",
    subcommands = {
        RenderCommand.class,
        ListCommand.class
    }
)
public class AstWriterCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AstWriterCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("AstWriter - Syntax tree to source renderer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'astwriter --help' to see available commands");
        System.out.println("Use 'astwriter <command> --help' for command-specific help");
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        AstWriterCLI cli = new AstWriterCLI();
        return new CommandLine(cli)
            .setExecutionStrategy(parseResult -> {
                cli.configureLogging();
                return new CommandLine.RunLast().execute(parseResult);
            });
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

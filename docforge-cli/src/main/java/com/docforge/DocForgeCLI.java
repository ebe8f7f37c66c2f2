package com.docforge;

import com.docforge.cli.BatchCommand;
import com.docforge.cli.GenerateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocForge.
 *
 * <p>DocForge writes Python docstrings: it extracts functions, methods and classes, infers
 * missing types, generates a block per element, reviews and scores it, refines it up to a
 * fixed number of times and writes the result back into the source.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Document a single Python file</li>
 *   <li>{@code batch} - Document every Python file under a directory</li>
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
 * # Preview the changes for one file
 * docforge generate app/service.py --diff --dry-run
 *
 * # Document a package with four workers and a Markdown report
 * docforge -v batch src --workers 4 --report md --report-file docforge-report.md
 * }</pre>
 */
@Command(
    name = "docforge",
    mixinStandardHelpOptions = true,
    version = "DocForge 1.0.0-SNAPSHOT",
    description = "Generates, reviews and refines Python docstrings",
    subcommands = {
        GenerateCommand.class,
        BatchCommand.class
    }
)
public class DocForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("DocForge - Python docstring generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docforge --help' to see available commands");
        System.out.println("Use 'docforge <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options. Subcommands call this before they run.
     */
    public void configureLogging() {
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
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new DocForgeCLI()).execute(args);
        System.exit(exitCode);
    }
}

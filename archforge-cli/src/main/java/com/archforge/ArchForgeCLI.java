package com.archforge;

import com.archforge.cli.GenerateCommand;
import com.archforge.cli.LinkCommand;
import com.archforge.cli.PlanCommand;
import com.archforge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for ArchForge.
 *
 * <p>ArchForge turns Mermaid architecture diagrams into a linked, buildable TypeScript
 * application tree.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Run the full pipeline: parse, plan, generate, link, validate, deploy</li>
 *   <li>{@code plan} - Parse and plan only; write the task-plan record</li>
 *   <li>{@code link} - Re-run linking over an existing output tree</li>
 *   <li>{@code validate} - Parse diagrams and report anomalies and signature drift</li>
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
 * # Generate the project described under ./diagrams/shop
 * archforge generate --project-id shop
 *
 * # Preview the generation order
 * archforge plan --project-id shop
 *
 * # Relink after an interrupted run
 * archforge link ./generated
 * }</pre>
 */
@Command(
    name = "archforge",
    mixinStandardHelpOptions = true,
    version = "ArchForge 1.0.0-SNAPSHOT",
    description = "Generates application code from architecture diagrams",
    subcommands = {
        GenerateCommand.class,
        PlanCommand.class,
        LinkCommand.class,
        ValidateCommand.class
    }
)
public class ArchForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArchForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("ArchForge - Architecture Diagrams to Application Code");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'archforge --help' to see available commands");
        System.out.println("Use 'archforge <command> --help' for command-specific help");
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
     * Creates the command line with logging configured before any command executes.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ArchForgeCLI cli = new ArchForgeCLI();
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

package com.symmetryvaults;

import ch.qos.logback.classic.Level;
import com.symmetryvaults.cli.GenerateCommand;
import com.symmetryvaults.cli.ListCommand;
import com.symmetryvaults.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for Symmetry Vaults.
 *
 * <p>Generates puzzle level documents from graph symmetries and validates
 * persisted levels against the recomputed group theory.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate one level document</li>
 *   <li>{@code list} - List group or graph families</li>
 *   <li>{@code validate} - Validate level files</li>
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
 * # Level 5 of act 1 on the full symmetry group of a 5-cycle
 * symmetry-vaults generate --graph cycle_5 --auto --level-id 5 -o levels/act1_level05.json
 *
 * # The same graph with only its rotations
 * symmetry-vaults generate --graph cycle_5 --group Z5 --level-id 6
 *
 * # Validate every level in a directory
 * symmetry-vaults validate levels/
 * }</pre>
 */
@Command(
    name = "symmetry-vaults",
    mixinStandardHelpOptions = true,
    version = "Symmetry Vaults 1.0.0-SNAPSHOT",
    description = "Group-theory level generator and validator",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class SymmetryVaultsCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SymmetryVaultsCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("Symmetry Vaults - level generator and validator");
        spec.commandLine().getOut().println("Use 'symmetry-vaults --help' to see available commands");
    }

    /**
     * Sets the root logger level from the global options.
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Builds the command line with logging applied before any sub-command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SymmetryVaultsCLI cli = new SymmetryVaultsCLI();
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

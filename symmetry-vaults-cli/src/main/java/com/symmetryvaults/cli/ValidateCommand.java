package com.symmetryvaults.cli;

import com.symmetryvaults.core.config.ConfigLoader;
import com.symmetryvaults.core.config.EngineConfig;
import com.symmetryvaults.core.validation.LevelValidator;
import com.symmetryvaults.core.validation.ValidationIssue;
import com.symmetryvaults.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate persisted level files.
 *
 * <p>Every file is checked independently and every issue is printed. The exit
 * code is 0 when no ERROR issue was found and 1 otherwise.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * symmetry-vaults validate levels/
 * symmetry-vaults validate act1_level01.json act1_level02.json
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate level files against the recomputed group theory",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Level files or directories containing *.json levels")
    private List<Path> paths;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: symmetry-vaults.yaml if present)")
    private Path configPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        EngineConfig config = ConfigLoader.loadOrDefaults(configPath);
        log.info("Validating {} path(s)", paths.size());

        ValidationReport report;
        try {
            report = new LevelValidator(config).validate(paths);
        } catch (UncheckedIOException e) {
            log.error("Cannot read level files", e);
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return 1;
        }
        for (ValidationIssue issue : report.issues()) {
            out.println(issue.describe());
        }
        if (!report.issues().isEmpty()) {
            out.println();
        }
        if (report.passed()) {
            out.println("✓ Validation passed: " + report.summary());
            return 0;
        }
        spec.commandLine().getErr().println("✗ Validation failed: " + report.summary());
        return 1;
    }
}

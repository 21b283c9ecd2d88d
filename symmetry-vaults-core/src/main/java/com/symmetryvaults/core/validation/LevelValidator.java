package com.symmetryvaults.core.validation;

import com.symmetryvaults.core.config.EngineConfig;
import com.symmetryvaults.core.level.LevelCodec;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.symmetry.SearchLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Re-derives the algebra of persisted level documents and reports every discrepancy.
 *
 * <p>Validation is exhaustive: a broken subgroup does not stop the checks of
 * the next one, and a broken file does not stop the next file. Unreadable or
 * unparseable files become {@code document/parse} errors.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * LevelValidator validator = new LevelValidator(EngineConfig.defaults());
 * ValidationReport report = validator.validate(List.of(Path.of("levels")));
 * if (!report.passed()) {
 *     report.issues().forEach(issue -> System.err.println(issue.describe()));
 * }
 * }</pre>
 */
public class LevelValidator {

    private static final Logger log = LoggerFactory.getLogger(LevelValidator.class);

    private final SearchLimits limits;
    private final List<LevelCheck> checks;

    public LevelValidator(EngineConfig config) {
        this(config.searchLimits());
    }

    public LevelValidator(SearchLimits limits) {
        this(limits, discoverChecks());
    }

    public LevelValidator(SearchLimits limits, List<LevelCheck> checks) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        List<LevelCheck> ordered = new ArrayList<>(checks);
        ordered.sort(Comparator.comparingInt(LevelCheck::getPriority));
        this.checks = List.copyOf(ordered);
    }

    private static List<LevelCheck> discoverChecks() {
        log.debug("Discovering level checks via ServiceLoader");
        List<LevelCheck> discovered = new ArrayList<>();
        ServiceLoader.load(LevelCheck.class).forEach(discovered::add);
        log.debug("Discovered {} level checks", discovered.size());
        return discovered;
    }

    public List<LevelCheck> checks() {
        return checks;
    }

    /**
     * Validates one parsed document.
     *
     * @param document level document
     * @return issues of this document
     */
    public ValidationReport validate(LevelDocument document) {
        ValidationContext context = new ValidationContext(document, limits);
        for (LevelCheck check : checks) {
            log.trace("Running {} on {}", check.section(), context.levelId());
            check.check(context);
        }
        List<ValidationIssue> issues = context.issues();
        if (issues.isEmpty()) {
            log.debug("Level {} passed", context.levelId());
        } else {
            log.debug("Level {}: {} issue(s)", context.levelId(), issues.size());
        }
        return new ValidationReport(issues, 1);
    }

    /**
     * Validates level files; directories are searched recursively for {@code *.json}.
     *
     * @param paths files or directories
     * @return combined report over all files
     */
    public ValidationReport validate(List<Path> paths) {
        ValidationReport report = ValidationReport.empty();
        for (Path file : collectFiles(paths)) {
            report = report.merge(validateFile(file));
        }
        log.info("Validation finished: {}", report.summary());
        return report;
    }

    private ValidationReport validateFile(Path file) {
        String name = String.valueOf(file.getFileName());
        LevelDocument document;
        try {
            document = LevelCodec.read(file);
        } catch (IOException e) {
            log.warn("Cannot parse {}: {}", file, e.getMessage());
            return new ValidationReport(List.of(
                ValidationIssue.error(name, "document", null, "parse", "valid level JSON", e.getMessage())), 1);
        }
        return validate(document);
    }

    private static List<Path> collectFiles(List<Path> paths) {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".json"))
                        .sorted()
                        .forEach(files::add);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to list level files in " + path, e);
                }
            } else {
                files.add(path);
            }
        }
        return files;
    }
}

package com.symmetryvaults.cli;

import com.symmetryvaults.core.config.ConfigLoader;
import com.symmetryvaults.core.config.EngineConfig;
import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.exception.LevelSpecificationException;
import com.symmetryvaults.core.level.LevelCodec;
import com.symmetryvaults.core.level.LevelGenerator;
import com.symmetryvaults.core.level.LevelRequest;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.renderer.GeneratedFile;
import com.symmetryvaults.core.renderer.GeneratedOutput;
import com.symmetryvaults.core.renderer.OutputRenderer;
import com.symmetryvaults.core.renderer.RenderContext;
import com.symmetryvaults.core.renderer.impl.ConsoleRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to generate one level document.
 *
 * <p>The document is written atomically to {@code --output}, or printed to
 * standard output when no file is given. Nothing is written when generation fails.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Full symmetry group of the triangle
 * symmetry-vaults generate --graph complete_3 --auto --level-id 2 -o act1_level02.json
 *
 * # Named group acting on a graph, without subgroup layers
 * symmetry-vaults generate --graph cycle_4 --group Z4 --level-id 3 --no-subgroups
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate a level document from a graph and its symmetry group",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--graph", required = true, description = "Graph name, e.g. cycle_5 or petersen")
    private String graphName;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private GroupChoice groupChoice;

    @Option(names = "--level-id", required = true, description = "Level number within the act")
    private int levelNumber;

    @Option(names = "--act", defaultValue = "1", description = "Act number (default: ${DEFAULT-VALUE})")
    private int act;

    @Option(names = "--title", description = "Level title (default: generated)")
    private String title;

    @Option(names = "--subtitle", description = "Level subtitle (default: generated)")
    private String subtitle;

    @Option(names = "--no-subgroups", description = "Skip subgroup, normality and quotient layers")
    private boolean noSubgroups;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: symmetry-vaults.yaml if present)")
    private Path configPath;

    static class GroupChoice {
        @Option(names = "--group", description = "Named group such as Z5, D4, S3, A4 or V4")
        String groupName;

        @Option(names = "--auto", description = "Use the automorphism group of the graph")
        boolean auto;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            EngineConfig config = ConfigLoader.loadOrDefaults(configPath);
            LevelRequest request = new LevelRequest(graphName, groupChoice.auto ? null : groupChoice.groupName,
                levelNumber, act, title, subtitle, !noSubgroups);
            log.info("Generating {} from graph {} ({})", request.levelId(), graphName,
                request.autoGroup() ? "automorphism group" : request.groupName());

            LevelDocument document = new LevelGenerator(config).generate(request);
            String json = LevelCodec.write(document);

            if (output == null) {
                new ConsoleRenderer(out).render(
                    GeneratedOutput.of(new GeneratedFile(request.levelId() + ".json", json, request.levelId())),
                    new RenderContext(Path.of("."), Map.of()));
                return 0;
            }
            Path absolute = output.toAbsolutePath();
            OutputRenderer.byId("filesystem").render(
                GeneratedOutput.of(new GeneratedFile(absolute.getFileName().toString(), json, request.levelId())),
                new RenderContext(absolute.getParent(), Map.of()));
            out.println("✓ Generated " + request.levelId() + ": " + document.meta().groupName()
                + " of order " + document.meta().groupOrder() + " -> " + output);
            return 0;
        } catch (LevelSpecificationException e) {
            log.debug("Rejected level specification", e);
            err.println("✗ " + e.getMessage());
            return 1;
        } catch (InvariantViolationException e) {
            log.error("Internal invariant violated while generating level {}", levelNumber, e);
            err.println("✗ Internal error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Generation failed", e);
            err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }
}

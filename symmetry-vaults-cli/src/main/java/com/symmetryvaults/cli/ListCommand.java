package com.symmetryvaults.cli;

import com.symmetryvaults.core.graph.GraphCatalog;
import com.symmetryvaults.core.graph.GraphFamily;
import com.symmetryvaults.core.group.GroupCatalog;
import com.symmetryvaults.core.group.GroupFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Command to list the available group or graph families.
 *
 * <p>Families are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * symmetry-vaults list groups
 * symmetry-vaults list graphs
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available groups or graphs",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: groups or graphs")
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase()) {
            case "groups", "group" -> listGroups(out);
            case "graphs", "graph" -> listGraphs(out);
            default -> {
                log.error("Unknown type: {}. Use: groups or graphs", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: groups or graphs");
                yield 1;
            }
        };
    }

    private int listGroups(PrintWriter out) {
        out.println("Available Groups:");
        out.println();
        for (GroupFamily family : GroupCatalog.load().families()) {
            out.printf("  • %s (symbol: %s)%n", family.getDisplayName(), family.getSymbol());
            for (int parameter : family.getListedParameters()) {
                out.printf("    %s%d: order %d, acts on %d points%n", family.getSymbol(), parameter,
                    family.order(parameter), family.degree(parameter));
            }
            out.println();
        }
        return 0;
    }

    private int listGraphs(PrintWriter out) {
        out.println("Available Graphs:");
        out.println();
        GraphCatalog catalog = GraphCatalog.load();
        for (GraphFamily family : catalog.families()) {
            out.printf("  • %s (ID: %s)%n", family.getDisplayName(), family.getId());
            if (family.isFixedSize()) {
                out.printf("    %s: %d vertices%n", family.getId(), family.vertexCount(0));
            } else {
                for (int size : family.getListedSizes()) {
                    out.printf("    %s: %d vertices%n", catalog.canonicalName(family.getId(), size),
                        family.vertexCount(size));
                }
            }
            out.println();
        }
        return 0;
    }
}

package com.symmetryvaults.core.graph;

import com.symmetryvaults.core.exception.InvalidSizeException;
import com.symmetryvaults.core.exception.UnknownGraphFamilyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Registry of {@link GraphFamily} implementations discovered via {@link ServiceLoader}.
 *
 * <p>Graphs are addressed either by family id and size, or by a combined name
 * where the size follows the last underscore:
 * <pre>{@code
 * GraphCatalog catalog = GraphCatalog.load();
 * Graph c5 = catalog.build("cycle_5");
 * Graph d4 = catalog.build("directed_cycle", 4);
 * Graph petersen = catalog.build("petersen");
 * }</pre>
 */
public final class GraphCatalog {

    private static final Logger log = LoggerFactory.getLogger(GraphCatalog.class);

    private final Map<String, GraphFamily> families;

    public GraphCatalog(List<GraphFamily> families) {
        Map<String, GraphFamily> byId = new LinkedHashMap<>();
        for (GraphFamily family : families) {
            if (byId.putIfAbsent(family.getId(), family) != null) {
                throw new IllegalArgumentException("Duplicate graph family id: " + family.getId());
            }
        }
        this.families = Collections.unmodifiableMap(byId);
    }

    /**
     * Discovers all graph families registered in {@code META-INF/services}.
     *
     * @return catalog of discovered families
     */
    public static GraphCatalog load() {
        log.debug("Discovering graph families via ServiceLoader");
        ServiceLoader<GraphFamily> loader = ServiceLoader.load(GraphFamily.class);
        List<GraphFamily> discovered = new ArrayList<>();
        loader.forEach(discovered::add);
        log.debug("Discovered {} graph families", discovered.size());
        return new GraphCatalog(discovered);
    }

    public List<GraphFamily> families() {
        return List.copyOf(families.values());
    }

    /**
     * Looks up a family by id.
     *
     * @param familyId family id such as {@code cycle}
     * @return the family
     * @throws UnknownGraphFamilyException if no family has that id
     */
    public GraphFamily family(String familyId) {
        GraphFamily family = families.get(familyId);
        if (family == null) {
            throw new UnknownGraphFamilyException(familyId);
        }
        return family;
    }

    public Graph build(String familyId, int size) {
        return family(familyId).build(size);
    }

    /**
     * Builds a graph from a combined name such as {@code cycle_5} or {@code petersen}.
     *
     * @param graphName family id, optionally followed by {@code _<size>}
     * @return the graph
     * @throws UnknownGraphFamilyException if the family is unknown
     * @throws InvalidSizeException if the size is missing or invalid
     */
    public Graph build(String graphName) {
        GraphName parsed = parse(graphName);
        return build(parsed.familyId(), parsed.size());
    }

    /**
     * Splits a graph name into family id and size. Fixed graphs may omit the size.
     *
     * @param graphName name to parse
     * @return family id and size ({@code 0} when omitted)
     */
    public GraphName parse(String graphName) {
        if (graphName == null || graphName.isBlank()) {
            throw new UnknownGraphFamilyException(String.valueOf(graphName));
        }
        String name = graphName.trim().toLowerCase();
        if (families.containsKey(name)) {
            GraphFamily family = families.get(name);
            if (!family.isFixedSize()) {
                throw new InvalidSizeException(name, 0, "a size is required, e.g. " + name + "_" + family.getMinSize());
            }
            return new GraphName(name, 0);
        }
        int underscore = name.lastIndexOf('_');
        if (underscore <= 0 || underscore == name.length() - 1) {
            throw new UnknownGraphFamilyException(name);
        }
        String familyId = name.substring(0, underscore);
        String sizeText = name.substring(underscore + 1);
        family(familyId);
        try {
            return new GraphName(familyId, Integer.parseInt(sizeText));
        } catch (NumberFormatException e) {
            throw new InvalidSizeException(familyId, -1, "'" + sizeText + "' is not a number");
        }
    }

    /**
     * Canonical graph name for a family and size, as written to level metadata.
     *
     * @param familyId family id
     * @param size size parameter
     * @return {@code familyId} for fixed graphs, otherwise {@code familyId_size}
     */
    public String canonicalName(String familyId, int size) {
        return family(familyId).isFixedSize() ? familyId : familyId + "_" + size;
    }

    /**
     * Family id and size parameter of a graph name.
     *
     * @param familyId family id
     * @param size size parameter, {@code 0} for fixed graphs addressed without size
     */
    public record GraphName(String familyId, int size) {
    }
}

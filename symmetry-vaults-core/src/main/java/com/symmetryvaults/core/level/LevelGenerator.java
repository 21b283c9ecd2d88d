package com.symmetryvaults.core.level;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.config.EngineConfig;
import com.symmetryvaults.core.exception.GraphTooLargeException;
import com.symmetryvaults.core.exception.GroupGraphMismatchException;
import com.symmetryvaults.core.exception.LevelSpecificationException;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.GraphCatalog;
import com.symmetryvaults.core.group.GroupCatalog;
import com.symmetryvaults.core.layout.LayoutEngine;
import com.symmetryvaults.core.layout.RoomLayout;
import com.symmetryvaults.core.model.ConjugationLayer;
import com.symmetryvaults.core.model.KeyringLayer;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.model.LevelMeta;
import com.symmetryvaults.core.model.Layers;
import com.symmetryvaults.core.model.QuotientLayer;
import com.symmetryvaults.core.model.SubgroupLatticeSection;
import com.symmetryvaults.core.quotient.QuotientBuilder;
import com.symmetryvaults.core.quotient.QuotientGroup;
import com.symmetryvaults.core.subgroup.ClassifiedSubgroup;
import com.symmetryvaults.core.subgroup.FilteredSubgroups;
import com.symmetryvaults.core.subgroup.GeneratorFinder;
import com.symmetryvaults.core.subgroup.NormalityClassifier;
import com.symmetryvaults.core.subgroup.Subgroup;
import com.symmetryvaults.core.subgroup.SubgroupEnumerator;
import com.symmetryvaults.core.symmetry.AutomorphismFinder;
import com.symmetryvaults.core.symmetry.CayleyTable;
import com.symmetryvaults.core.symmetry.CayleyTableBuilder;
import com.symmetryvaults.core.symmetry.SearchLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the full level pipeline: graph, group, Cayley table, subgroups,
 * filter, normality, quotients and layout, producing a {@link LevelDocument}.
 *
 * <p>Each call builds a fresh graph and group; nothing is shared between runs.
 * Specification errors surface as {@link LevelSpecificationException} before
 * any document exists, so callers never see a partial result.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * LevelGenerator generator = new LevelGenerator(EngineConfig.defaults());
 * LevelDocument level = generator.generate(LevelRequest.auto("complete_3", 12));
 * String json = LevelCodec.write(level);
 * }</pre>
 */
public class LevelGenerator {

    private static final Logger log = LoggerFactory.getLogger(LevelGenerator.class);

    private final EngineConfig config;
    private final GraphCatalog graphs;
    private final GroupCatalog groups;

    public LevelGenerator(EngineConfig config) {
        this(config, GraphCatalog.load(), GroupCatalog.load());
    }

    public LevelGenerator(EngineConfig config, GraphCatalog graphs, GroupCatalog groups) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.graphs = Objects.requireNonNull(graphs, "graphs must not be null");
        this.groups = Objects.requireNonNull(groups, "groups must not be null");
    }

    /**
     * Generates one level document.
     *
     * @param request level parameters
     * @return the complete document
     * @throws LevelSpecificationException if the graph, group or size is not acceptable
     */
    public LevelDocument generate(LevelRequest request) {
        GraphCatalog.GraphName parsed = graphs.parse(request.graphName());
        String graphName = graphs.canonicalName(parsed.familyId(), parsed.size());
        Graph graph = graphs.build(parsed.familyId(), parsed.size());
        log.info("Generating {} from {} ({} vertices)", request.levelId(), graphName, graph.vertexCount());

        SearchLimits limits = config.searchLimits();
        if (graph.vertexCount() > limits.maxVertices()) {
            throw new GraphTooLargeException(graph.vertexCount(), limits.maxVertices());
        }

        String groupName;
        List<Permutation> elements;
        if (request.autoGroup()) {
            groupName = "Aut(" + graphName + ")";
            elements = new AutomorphismFinder(limits).findAll(graph, groupName);
        } else {
            GroupCatalog.NamedGroup named = groups.resolve(request.groupName());
            groupName = named.name();
            elements = groups.generate(groupName, limits.maxGroupOrder());
            checkActsOn(groupName, elements, graph, graphName);
        }
        AutomorphismFinder.verifyGroupAxioms(elements);
        log.info("Group {} has order {}", groupName, elements.size());

        CayleyTable table = new CayleyTableBuilder().build(elements);
        List<Integer> generators = GeneratorFinder.findForGroup(table);

        SubgroupLatticeSection lattice = null;
        Layers layers = null;
        if (request.includeSubgroups()) {
            List<Subgroup> all = new SubgroupEnumerator().enumerate(table);
            FilteredSubgroups filtered = config.subgroupFilter().filter(table, all);
            NormalityClassifier classifier = new NormalityClassifier();
            List<ClassifiedSubgroup> classified = classifier.classifyAll(table, filtered.subgroups());
            List<ClassifiedSubgroup> proper = classified.stream()
                .filter(c -> !c.subgroup().isTrivial() && !c.subgroup().isWholeGroup(table.order()))
                .toList();
            QuotientBuilder quotientBuilder = new QuotientBuilder();
            List<QuotientGroup> quotients = proper.stream()
                .filter(ClassifiedSubgroup::normal)
                .map(c -> quotientBuilder.build(table, c))
                .toList();
            log.info("{} subgroups ({} listed), {} proper, {} quotients",
                all.size(), filtered.subgroups().size(), proper.size(), quotients.size());

            lattice = LevelDocumentAssembler.latticeSection(filtered.subgroups());
            KeyringLayer layer3 = LevelDocumentAssembler.keyringLayer(table, filtered, classified);
            ConjugationLayer layer4 = LevelDocumentAssembler.conjugationLayer(table, proper);
            QuotientLayer layer5 = LevelDocumentAssembler.quotientLayer(table, quotients);
            layers = new Layers(layer3, layer4, layer5);
        }

        RoomLayout layout = new LayoutEngine(config.layoutSettings()).compute(table);

        LevelMeta meta = new LevelMeta(
            request.levelId(),
            request.act(),
            request.levelNumber(),
            request.title() != null ? request.title() : "Hall of " + graphName,
            request.subtitle() != null ? request.subtitle() : "Group " + groupName + ", order " + table.order(),
            groupName,
            table.order(),
            graphName
        );
        return new LevelDocument(
            meta,
            LevelDocumentAssembler.graphSection(graph),
            LevelDocumentAssembler.symmetrySection(table, generators, config.output().cayleyTableMaxOrder()),
            lattice,
            layers,
            LevelDocumentAssembler.roomLayoutSection(layout)
        );
    }

    private static void checkActsOn(String groupName, List<Permutation> elements, Graph graph, String graphName) {
        int degree = elements.get(0).size();
        if (degree != graph.vertexCount()) {
            throw new GroupGraphMismatchException("Group " + groupName + " acts on " + degree
                + " points, but graph " + graphName + " has " + graph.vertexCount() + " vertices");
        }
        for (Permutation p : elements) {
            if (!AutomorphismFinder.isAutomorphism(graph, p)) {
                throw new GroupGraphMismatchException("Element " + p.toCycleNotation() + " of " + groupName
                    + " is not a symmetry of " + graphName);
            }
        }
    }
}

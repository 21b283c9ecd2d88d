package com.symmetryvaults.core.level;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;
import com.symmetryvaults.core.layout.NodePosition;
import com.symmetryvaults.core.layout.RoomLayout;
import com.symmetryvaults.core.model.ConjugationLayer;
import com.symmetryvaults.core.model.ConjugationLayer.ClassifyEntry;
import com.symmetryvaults.core.model.ConjugationLayer.WitnessEntry;
import com.symmetryvaults.core.model.GraphSection;
import com.symmetryvaults.core.model.KeyringLayer;
import com.symmetryvaults.core.model.KeyringLayer.SubgroupEntry;
import com.symmetryvaults.core.model.QuotientLayer;
import com.symmetryvaults.core.model.QuotientLayer.CosetEntry;
import com.symmetryvaults.core.model.QuotientLayer.QuotientEntry;
import com.symmetryvaults.core.model.RoomLayoutSection;
import com.symmetryvaults.core.model.SubgroupLatticeSection;
import com.symmetryvaults.core.model.SymmetrySection;
import com.symmetryvaults.core.model.SymmetrySection.AutomorphismEntry;
import com.symmetryvaults.core.quotient.Coset;
import com.symmetryvaults.core.quotient.QuotientGroup;
import com.symmetryvaults.core.subgroup.ClassifiedSubgroup;
import com.symmetryvaults.core.subgroup.ConjugationWitness;
import com.symmetryvaults.core.subgroup.FilteredSubgroups;
import com.symmetryvaults.core.subgroup.Subgroup;
import com.symmetryvaults.core.subgroup.SubgroupLattice;
import com.symmetryvaults.core.symmetry.Automorphism;
import com.symmetryvaults.core.symmetry.CayleyTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts engine results into the persisted level document sections.
 *
 * <p>Element indices become ids through the Cayley table, so every id written
 * to a document exists in its {@code symmetries.automorphisms} list.
 */
public final class LevelDocumentAssembler {

    private LevelDocumentAssembler() {
    }

    public static GraphSection graphSection(Graph graph) {
        List<GraphSection.NodeEntry> nodes = new ArrayList<>(graph.vertexCount());
        for (Node node : graph.nodes()) {
            nodes.add(new GraphSection.NodeEntry(node.id(), node.color(), node.label()));
        }
        List<GraphSection.EdgeEntry> edges = new ArrayList<>(graph.edges().size());
        for (Edge edge : graph.edges()) {
            edges.add(new GraphSection.EdgeEntry(edge.from(), edge.to(), edge.type(),
                edge.directed() ? Boolean.TRUE : null));
        }
        return new GraphSection(nodes, edges);
    }

    /**
     * Group section; the Cayley table is included only up to {@code cayleyTableMaxOrder}.
     */
    public static SymmetrySection symmetrySection(CayleyTable table, List<Integer> generators,
                                                  int cayleyTableMaxOrder) {
        List<AutomorphismEntry> automorphisms = new ArrayList<>(table.order());
        for (Automorphism a : table.group().elements()) {
            automorphisms.add(new AutomorphismEntry(a.id(), a.mapping().toList(), a.name(),
                a.description(), a.cycleNotation(), a.order()));
        }
        List<String> generatorIds = generators.stream().map(table::id).toList();
        Map<String, Map<String, String>> cayley = table.order() <= cayleyTableMaxOrder ? table.toIdMap() : null;
        return new SymmetrySection(automorphisms, generatorIds, cayley);
    }

    public static SubgroupLatticeSection latticeSection(List<Subgroup> subgroups) {
        List<SubgroupLatticeSection.LatticeEdgeEntry> edges = SubgroupLattice.coveringEdges(subgroups).stream()
            .map(e -> new SubgroupLatticeSection.LatticeEdgeEntry(e.from(), e.to()))
            .toList();
        return new SubgroupLatticeSection(edges);
    }

    /**
     * Layer 3 keyring over the filtered subgroup list.
     *
     * @param table Cayley table
     * @param filtered filter outcome
     * @param classified classification of {@code filtered.subgroups()}, same order
     * @return the layer
     */
    public static KeyringLayer keyringLayer(CayleyTable table, FilteredSubgroups filtered,
                                            List<ClassifiedSubgroup> classified) {
        List<Subgroup> subgroups = filtered.subgroups();
        List<String> names = SubgroupLattice.names(table, subgroups);
        List<SubgroupEntry> entries = new ArrayList<>(subgroups.size());
        for (int i = 0; i < subgroups.size(); i++) {
            Subgroup subgroup = subgroups.get(i);
            entries.add(new SubgroupEntry(
                names.get(i),
                subgroup.order(),
                subgroup.ids(table),
                subgroup.generatorIds(table),
                classified.get(i).normal(),
                subgroup.isTrivial(),
                SubgroupLattice.latticeLevel(subgroup.order(), table.order())
            ));
        }
        if (!filtered.filtered()) {
            return new KeyringLayer(entries.size(), entries, false, null, null, null);
        }
        return new KeyringLayer(entries.size(), entries, true, filtered.fullSubgroupCount(),
            filtered.filterStrategy(), filtered.targetCount());
    }

    /**
     * Layer 4 over the proper non-trivial subgroups.
     *
     * @param table Cayley table
     * @param classified proper non-trivial classified subgroups
     * @return the layer
     */
    public static ConjugationLayer conjugationLayer(CayleyTable table, List<ClassifiedSubgroup> classified) {
        List<ClassifyEntry> entries = new ArrayList<>(classified.size());
        int normal = 0;
        for (ClassifiedSubgroup c : classified) {
            Subgroup subgroup = c.subgroup();
            if (c.normal()) {
                normal++;
            }
            entries.add(new ClassifyEntry(
                subgroup.order(),
                subgroup.ids(table),
                subgroup.generatorIds(table),
                c.normal(),
                minAttempts(subgroup.order(), table.order()),
                c.normal() ? null : witnessEntry(table, c.witness())
            ));
        }
        return new ConjugationLayer(entries.size(), normal, entries.size() - normal, entries);
    }

    private static WitnessEntry witnessEntry(CayleyTable table, ConjugationWitness witness) {
        return new WitnessEntry(table.id(witness.g()), table.id(witness.h()),
            table.id(witness.gInv()), table.id(witness.result()));
    }

    public static QuotientLayer quotientLayer(CayleyTable table, List<QuotientGroup> quotients) {
        List<QuotientEntry> entries = new ArrayList<>(quotients.size());
        for (QuotientGroup quotient : quotients) {
            List<CosetEntry> cosets = new ArrayList<>(quotient.quotientOrder());
            for (Coset coset : quotient.cosets()) {
                cosets.add(new CosetEntry(coset.elements().stream().map(table::id).toList(),
                    table.id(coset.representative())));
            }
            List<String> representatives = quotient.representatives().stream().map(table::id).toList();
            Map<String, Map<String, String>> quotientTable = new LinkedHashMap<>();
            for (int a = 0; a < quotient.quotientOrder(); a++) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int b = 0; b < quotient.quotientOrder(); b++) {
                    row.put(representatives.get(b), representatives.get(quotient.multiply(a, b)));
                }
                quotientTable.put(representatives.get(a), row);
            }
            entries.add(new QuotientEntry(
                quotient.normalSubgroup().ids(table),
                quotient.quotientOrder(),
                quotient.quotientType(),
                cosets,
                representatives,
                quotientTable
            ));
        }
        return new QuotientLayer(entries);
    }

    public static RoomLayoutSection roomLayoutSection(RoomLayout layout) {
        List<RoomLayoutSection.PositionEntry> positions = new ArrayList<>(layout.positions().size());
        for (NodePosition p : layout.positions()) {
            positions.add(new RoomLayoutSection.PositionEntry(p.id(), p.layer(), round(p.x()), round(p.y())));
        }
        return new RoomLayoutSection(layout.width(), layout.height(), layout.nodeSize(), positions);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Conjugation attempts a player is expected to need before finding a witness.
     *
     * @param subgroupOrder order of {@code H}
     * @param groupOrder order of {@code G}
     * @return 0 without candidate pairs, all pairs up to 6, otherwise half of them but at least 10
     */
    public static int minAttempts(int subgroupOrder, int groupOrder) {
        int total = (subgroupOrder - 1) * (groupOrder - subgroupOrder);
        if (total <= 0) {
            return 0;
        }
        if (total <= 6) {
            return total;
        }
        return Math.max(10, (int) Math.ceil(total * 0.5));
    }
}

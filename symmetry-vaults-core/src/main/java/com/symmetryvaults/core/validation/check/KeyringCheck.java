package com.symmetryvaults.core.validation.check;

import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.model.KeyringLayer;
import com.symmetryvaults.core.model.KeyringLayer.SubgroupEntry;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.model.SubgroupLatticeSection;
import com.symmetryvaults.core.model.SubgroupLatticeSection.LatticeEdgeEntry;
import com.symmetryvaults.core.subgroup.Subgroup;
import com.symmetryvaults.core.subgroup.SubgroupEnumerator;
import com.symmetryvaults.core.subgroup.SubgroupLattice;
import com.symmetryvaults.core.validation.LevelCheck;
import com.symmetryvaults.core.validation.StoredGroup;
import com.symmetryvaults.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Layer 3: every listed subgroup is a subgroup with the flags it claims, the
 * count matches a fresh enumeration, and the lattice edges are the covering
 * relation of the listed subgroups.
 */
public class KeyringCheck implements LevelCheck {

    @Override
    public String section() {
        return "layer_3";
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public void check(ValidationContext context) {
        LevelDocument document = context.document();
        if (document.layers() == null || document.layers().layer3() == null) {
            return;
        }
        KeyringLayer layer = document.layers().layer3();
        List<SubgroupEntry> entries = layer.subgroups() == null ? List.of() : layer.subgroups();
        if (layer.subgroupCount() == null || layer.subgroupCount() != entries.size()) {
            context.error(section(), null, "subgroup_count", entries.size(), layer.subgroupCount());
        }
        StoredGroup group = context.group();
        if (group == null || group.order() == 0) {
            return;
        }

        List<Subgroup> resolved = new ArrayList<>(entries.size());
        Set<Set<String>> seen = new HashSet<>();
        boolean allResolved = true;
        boolean hasTrivial = false;
        boolean hasWhole = false;
        for (int i = 0; i < entries.size(); i++) {
            SubgroupEntry entry = entries.get(i);
            Subgroup subgroup = checkEntry(context, i, entry);
            if (subgroup == null) {
                allResolved = false;
                continue;
            }
            resolved.add(subgroup);
            if (!seen.add(new HashSet<>(entry.elements()))) {
                context.error(section(), i, "unique_subgroups", "subgroup listed once", entry.elements());
            }
            hasTrivial |= subgroup.isTrivial();
            hasWhole |= subgroup.isWholeGroup(group.order());
        }

        if (context.table() == null) {
            return;
        }
        if (allResolved) {
            if (!hasTrivial) {
                context.error(section(), null, "trivial_retained", "trivial subgroup listed", "absent");
            }
            if (!hasWhole) {
                context.error(section(), null, "whole_group_retained", "whole group listed", "absent");
            }
        }
        checkCounts(context, layer, entries.size());
        if (allResolved) {
            checkLattice(context, document.subgroupLattice(), resolved);
        }
    }

    private Subgroup checkEntry(ValidationContext context, int index, SubgroupEntry entry) {
        if (entry == null || !ElementSets.checkKnown(context, section(), index, entry.elements())) {
            return null;
        }
        StoredGroup group = context.group();
        List<String> elements = entry.elements();
        if (entry.order() == null || entry.order() != elements.size()) {
            context.error(section(), index, "order", elements.size(), entry.order());
        }
        if (!ElementSets.checkSubgroup(context, section(), index, elements)) {
            return null;
        }
        if (entry.isTrivial() != null && entry.isTrivial() != (elements.size() == 1)) {
            context.error(section(), index, "is_trivial", elements.size() == 1, entry.isTrivial());
        }
        if (context.groupValid()) {
            boolean normal = group.isNormal(elements);
            if (entry.isNormal() == null || entry.isNormal() != normal) {
                context.error(section(), index, "is_normal", normal, entry.isNormal());
            }
            checkGenerators(context, index, entry);
        }
        return ElementSets.toSubgroup(context, elements);
    }

    private void checkGenerators(ValidationContext context, int index, SubgroupEntry entry) {
        List<String> generators = entry.generators();
        if (generators == null) {
            return;
        }
        StoredGroup group = context.group();
        for (String generator : generators) {
            if (!entry.elements().contains(generator)) {
                context.error(section(), index, "generator_in_subgroup", "element of the subgroup", generator);
                return;
            }
        }
        Set<String> generated = group.generatedBy(generators);
        if (!generated.equals(new HashSet<>(entry.elements()))) {
            context.error(section(), index, "subgroup_generators", entry.elements().size() + " element(s)",
                generated.size() + " element(s)");
        }
    }

    private void checkCounts(ValidationContext context, KeyringLayer layer, int listed) {
        int total;
        try {
            total = new SubgroupEnumerator().enumerate(context.table()).size();
        } catch (InvariantViolationException e) {
            context.error(section(), null, "enumeration", "subgroup enumeration", e.getMessage());
            return;
        }
        if (!layer.filteredSelection()) {
            if (listed != total) {
                context.error(section(), null, "complete_enumeration", total + " subgroup(s)", listed);
            }
            return;
        }
        if (layer.fullSubgroupCount() == null || layer.fullSubgroupCount() != total) {
            context.error(section(), null, "full_subgroup_count", total, layer.fullSubgroupCount());
        }
        if (layer.filterStrategy() == null) {
            context.error(section(), null, "filter_strategy", "strategy name", "missing");
        }
        if (layer.targetCount() == null) {
            context.error(section(), null, "target_count", "integer", "missing");
        }
        if (listed > total) {
            context.error(section(), null, "filtered_count", "at most " + total, listed);
        }
    }

    private void checkLattice(ValidationContext context, SubgroupLatticeSection lattice, List<Subgroup> subgroups) {
        Set<List<Integer>> expected = new HashSet<>();
        for (SubgroupLattice.Edge edge : SubgroupLattice.coveringEdges(subgroups)) {
            expected.add(List.of(edge.from(), edge.to()));
        }
        Set<List<Integer>> actual = new HashSet<>();
        if (lattice != null && lattice.edges() != null) {
            for (LatticeEdgeEntry edge : lattice.edges()) {
                if (edge == null || edge.from() == null || edge.to() == null) {
                    context.error("subgroup_lattice", null, "edge_endpoints", "from and to indices", edge);
                    continue;
                }
                actual.add(List.of(edge.from(), edge.to()));
            }
        }
        if (!expected.equals(actual)) {
            Set<List<Integer>> missing = new HashSet<>(expected);
            missing.removeAll(actual);
            Set<List<Integer>> extra = new HashSet<>(actual);
            extra.removeAll(expected);
            context.error("subgroup_lattice", null, "covering_edges", "missing none, extra none",
                "missing " + missing + ", extra " + extra);
        }
    }
}

package com.symmetryvaults.core.validation.check;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.exception.LevelSpecificationException;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.model.SymmetrySection;
import com.symmetryvaults.core.model.SymmetrySection.AutomorphismEntry;
import com.symmetryvaults.core.symmetry.AutomorphismFinder;
import com.symmetryvaults.core.symmetry.CayleyTableBuilder;
import com.symmetryvaults.core.validation.LevelCheck;
import com.symmetryvaults.core.validation.StoredGroup;
import com.symmetryvaults.core.validation.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Group elements, generators and the stored Cayley table.
 *
 * <p>Checks each mapping, identity, uniqueness and closure, that every element
 * preserves the embedded graph, and compares the stored group with a fresh
 * automorphism search of that graph. A stored group that is a proper subgroup
 * of the recomputed one is a warning, since named groups may act by a subset
 * of the graph's symmetries.
 */
public class SymmetryCheck implements LevelCheck {

    private static final Logger log = LoggerFactory.getLogger(SymmetryCheck.class);

    @Override
    public String section() {
        return "symmetries";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public void check(ValidationContext context) {
        SymmetrySection symmetries = context.document().symmetries();
        if (symmetries == null || symmetries.automorphisms() == null || symmetries.automorphisms().isEmpty()) {
            return;
        }
        List<AutomorphismEntry> entries = symmetries.automorphisms();
        Graph graph = context.graph();
        int degree = graph != null ? graph.vertexCount() : firstMappingSize(entries);

        boolean valid = checkEntries(context, entries, degree);
        StoredGroup group = StoredGroup.from(entries, degree);
        if (group.order() == 0) {
            context.group(group, false);
            return;
        }
        if (group.identityId() == null) {
            context.error(section(), null, "identity", "identity mapping present", "missing");
            valid = false;
        }
        int failedProducts = countFailedProducts(group);
        if (failedProducts > 0) {
            context.error(section(), null, "closure", "all products inside the group",
                failedProducts + " product(s) outside");
            valid = false;
        }
        context.group(group, valid);
        if (valid) {
            buildTable(context, group);
        }

        if (graph != null) {
            checkPreservesGraph(context, graph, group);
            if (context.groupValid()) {
                compareWithRecomputed(context, graph, group);
            }
        }
        checkGenerators(context, symmetries.generators(), group, context.groupValid());
        if (context.groupValid() && symmetries.cayleyTable() != null) {
            checkCayleyTable(context, symmetries.cayleyTable(), group);
        }
    }

    private void buildTable(ValidationContext context, StoredGroup group) {
        try {
            context.table(new CayleyTableBuilder().build(group.permutations()));
        } catch (InvariantViolationException e) {
            context.error(section(), null, "cayley_latin_square", "Latin square", e.getMessage());
            context.group(group, false);
        }
    }

    private boolean checkEntries(ValidationContext context, List<AutomorphismEntry> entries, int degree) {
        boolean valid = true;
        Set<String> ids = new HashSet<>();
        Set<List<Integer>> mappings = new HashSet<>();
        for (AutomorphismEntry entry : entries) {
            if (entry == null || entry.id() == null) {
                context.error(section(), null, "automorphism_id", "non-empty id", "missing");
                valid = false;
                continue;
            }
            if (entry.mapping() == null || entry.mapping().size() != degree
                || !Permutation.isBijection(entry.mapping())) {
                context.error(section(), null, "valid_permutation",
                    "bijection on 0.." + (degree - 1) + " for " + entry.id(), entry.mapping());
                valid = false;
                continue;
            }
            if (!ids.add(entry.id())) {
                context.error(section(), null, "unique_ids", "unique id", entry.id());
                valid = false;
            }
            if (!mappings.add(entry.mapping())) {
                context.error(section(), null, "unique_mappings", "unique mapping", entry.mapping());
                valid = false;
            }
        }
        return valid;
    }

    private static int firstMappingSize(List<AutomorphismEntry> entries) {
        for (AutomorphismEntry entry : entries) {
            if (entry != null && entry.mapping() != null) {
                return entry.mapping().size();
            }
        }
        return 0;
    }

    private static int countFailedProducts(StoredGroup group) {
        int failed = 0;
        for (String a : group.ids()) {
            for (String b : group.ids()) {
                if (group.multiply(a, b) == null) {
                    failed++;
                }
            }
        }
        return failed;
    }

    private void checkPreservesGraph(ValidationContext context, Graph graph, StoredGroup group) {
        for (String id : group.ids()) {
            if (!AutomorphismFinder.isAutomorphism(graph, group.permutation(id))) {
                context.error(section(), null, "preserves_graph", id + " maps the graph onto itself",
                    group.permutation(id).toCycleNotation());
            }
        }
    }

    private void compareWithRecomputed(ValidationContext context, Graph graph, StoredGroup group) {
        List<Permutation> recomputed;
        try {
            recomputed = new AutomorphismFinder(context.limits()).findAll(graph);
        } catch (LevelSpecificationException e) {
            log.debug("Skipping automorphism recomputation for {}: {}", context.levelId(), e.getMessage());
            context.warning(section(), null, "automorphism_recompute", "search within limits", e.getMessage());
            return;
        }
        Set<Permutation> stored = new LinkedHashSet<>(group.permutations());
        Set<Permutation> truth = new LinkedHashSet<>(recomputed);
        if (stored.equals(truth)) {
            return;
        }
        if (truth.containsAll(stored)) {
            context.warning(section(), null, "automorphism_group", "Aut(graph) of order " + truth.size(),
                "proper subgroup of order " + stored.size());
        }
    }

    private void checkGenerators(ValidationContext context, List<String> generators, StoredGroup group,
                                 boolean groupValid) {
        if (generators == null) {
            context.error(section(), null, "generators", "generator list", "missing");
            return;
        }
        boolean allKnown = true;
        for (String generator : generators) {
            if (!group.contains(generator)) {
                context.error(section(), null, "generator_exists", "known element id", generator);
                allKnown = false;
            }
        }
        if (!allKnown || !groupValid) {
            return;
        }
        Set<String> generated = group.generatedBy(generators);
        if (!generated.equals(new HashSet<>(group.ids()))) {
            context.error(section(), null, "generators_generate", "group of order " + group.order(),
                "generated " + generated.size() + " element(s)");
        }
    }

    private void checkCayleyTable(ValidationContext context, Map<String, Map<String, String>> table,
                                  StoredGroup group) {
        int mismatches = 0;
        String example = null;
        for (String a : group.ids()) {
            Map<String, String> row = table.get(a);
            for (String b : group.ids()) {
                String expected = group.multiply(a, b);
                String actual = row == null ? null : row.get(b);
                if (!expected.equals(actual)) {
                    mismatches++;
                    if (example == null) {
                        example = a + "*" + b + " = " + actual + " (expected " + expected + ")";
                    }
                }
            }
        }
        if (table.size() != group.order()) {
            context.error(section(), null, "cayley_table_size", group.order() + " rows", table.size());
        }
        if (mismatches > 0) {
            context.error(section(), null, "cayley_table", "table[a][b] = id(a.compose(b))",
                mismatches + " mismatch(es), e.g. " + example);
        }
    }
}

package com.symmetryvaults.core.validation.check;

import com.symmetryvaults.core.model.ConjugationLayer.ClassifyEntry;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.model.QuotientLayer;
import com.symmetryvaults.core.model.QuotientLayer.CosetEntry;
import com.symmetryvaults.core.model.QuotientLayer.QuotientEntry;
import com.symmetryvaults.core.quotient.QuotientTypeIdentifier;
import com.symmetryvaults.core.validation.LevelCheck;
import com.symmetryvaults.core.validation.StoredGroup;
import com.symmetryvaults.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layer 5: coset decompositions and quotient tables.
 *
 * <p>Cosets must partition the group into left cosets {@code rep * N} of equal
 * size, each containing its representative. The quotient table and type are
 * recomputed from the stored cosets once the partition holds.
 */
public class QuotientCheck implements LevelCheck {

    @Override
    public String section() {
        return "layer_5";
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public void check(ValidationContext context) {
        LevelDocument document = context.document();
        if (document.layers() == null || document.layers().layer5() == null) {
            return;
        }
        QuotientLayer layer = document.layers().layer5();
        List<QuotientEntry> entries = layer.quotientGroups() == null ? List.of() : layer.quotientGroups();
        checkQuotientCount(context, document, entries.size());

        StoredGroup group = context.group();
        if (group == null || group.order() == 0 || !context.groupValid()) {
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            QuotientEntry entry = entries.get(i);
            if (entry == null) {
                context.error(section(), i, "quotient_entry", "quotient group", "null");
                continue;
            }
            checkEntry(context, i, entry);
        }
    }

    private void checkQuotientCount(ValidationContext context, LevelDocument document, int listed) {
        if (document.layers().layer4() == null || document.layers().layer4().subgroups() == null) {
            return;
        }
        int normal = 0;
        for (ClassifyEntry entry : document.layers().layer4().subgroups()) {
            if (entry != null && Boolean.TRUE.equals(entry.isNormal())) {
                normal++;
            }
        }
        if (listed != normal) {
            context.error(section(), null, "quotient_count", normal + " normal subgroup(s) in layer_4", listed);
        }
    }

    private void checkEntry(ValidationContext context, int index, QuotientEntry entry) {
        StoredGroup group = context.group();
        List<String> normal = entry.normalSubgroupElements();
        if (!ElementSets.checkKnown(context, section(), index, normal)
            || !ElementSets.checkSubgroup(context, section(), index, normal)) {
            return;
        }
        if (!group.isNormal(normal)) {
            context.error(section(), index, "normal_subgroup", "normal subgroup", "not normal");
            return;
        }
        int expectedOrder = group.order() / normal.size();
        if (entry.quotientOrder() == null || entry.quotientOrder() != expectedOrder) {
            context.error(section(), index, "quotient_order", expectedOrder, entry.quotientOrder());
        }

        List<CosetEntry> cosets = entry.cosets() == null ? List.of() : entry.cosets();
        if (cosets.size() != expectedOrder) {
            context.error(section(), index, "coset_count", expectedOrder, cosets.size());
        }
        Map<String, Integer> cosetOf = new HashMap<>();
        boolean partition = cosets.size() == expectedOrder;
        for (int c = 0; c < cosets.size(); c++) {
            if (!checkCoset(context, index, c, cosets.get(c), normal, cosetOf)) {
                partition = false;
            }
        }
        for (String id : group.ids()) {
            if (!cosetOf.containsKey(id)) {
                context.error(section(), index, "coset_gap", "every element in a coset", id);
                partition = false;
            }
        }
        checkRepresentatives(context, index, entry, cosets);
        if (partition) {
            checkQuotientTable(context, index, entry, cosets, cosetOf);
        }
    }

    private boolean checkCoset(ValidationContext context, int index, int position, CosetEntry coset,
                               List<String> normal, Map<String, Integer> cosetOf) {
        StoredGroup group = context.group();
        if (coset == null || coset.elements() == null) {
            context.error(section(), index, "coset_elements", "coset " + position, "missing");
            return false;
        }
        boolean ok = true;
        if (coset.elements().size() != normal.size()) {
            context.error(section(), index, "coset_size", normal.size(), coset.elements().size());
            ok = false;
        }
        for (String id : coset.elements()) {
            if (!group.contains(id)) {
                context.error(section(), index, "element_exists", "known element id", id);
                ok = false;
                continue;
            }
            Integer previous = cosetOf.putIfAbsent(id, position);
            if (previous != null) {
                context.error(section(), index, "coset_overlap", "element in one coset", id
                    + " in cosets " + previous + " and " + position);
                ok = false;
            }
        }
        String representative = coset.representative();
        if (representative == null || !coset.elements().contains(representative)) {
            context.error(section(), index, "representative_in_coset", "member of coset " + position,
                representative);
            return false;
        }
        if (ok) {
            Set<String> expected = new HashSet<>();
            for (String n : normal) {
                expected.add(group.multiply(representative, n));
            }
            if (!expected.equals(new HashSet<>(coset.elements()))) {
                context.error(section(), index, "coset_elements", representative + " * N", coset.elements());
                ok = false;
            }
        }
        return ok;
    }

    private void checkRepresentatives(ValidationContext context, int index, QuotientEntry entry,
                                      List<CosetEntry> cosets) {
        List<String> expected = new ArrayList<>(cosets.size());
        for (CosetEntry coset : cosets) {
            expected.add(coset == null ? null : coset.representative());
        }
        if (!expected.equals(entry.cosetRepresentatives())) {
            context.error(section(), index, "coset_representatives", expected, entry.cosetRepresentatives());
        }
    }

    private void checkQuotientTable(ValidationContext context, int index, QuotientEntry entry,
                                    List<CosetEntry> cosets, Map<String, Integer> cosetOf) {
        StoredGroup group = context.group();
        int m = cosets.size();
        List<Integer> order = new ArrayList<>(m);
        int identityCoset = cosetOf.get(group.identityId());
        order.add(identityCoset);
        for (int c = 0; c < m; c++) {
            if (c != identityCoset) {
                order.add(c);
            }
        }
        int[] position = new int[m];
        for (int i = 0; i < m; i++) {
            position[order.get(i)] = i;
        }

        int[][] quotient = new int[m][m];
        int mismatches = 0;
        String example = null;
        Map<String, Map<String, String>> stored = entry.quotientTable();
        for (int a = 0; a < m; a++) {
            String repA = cosets.get(a).representative();
            for (int b = 0; b < m; b++) {
                String repB = cosets.get(b).representative();
                int product = cosetOf.get(group.multiply(repA, repB));
                quotient[position[a]][position[b]] = position[product];
                String expected = cosets.get(product).representative();
                Map<String, String> row = stored == null ? null : stored.get(repA);
                String actual = row == null ? null : row.get(repB);
                if (!expected.equals(actual)) {
                    mismatches++;
                    if (example == null) {
                        example = repA + "*" + repB + " = " + actual + " (expected " + expected + ")";
                    }
                }
            }
        }
        if (mismatches > 0) {
            context.error(section(), index, "quotient_table", "products of representatives",
                mismatches + " mismatch(es), e.g. " + example);
        }
        String type = QuotientTypeIdentifier.identify(quotient);
        if (!type.equals(entry.quotientType())) {
            context.error(section(), index, "quotient_type", type, entry.quotientType());
        }
    }
}

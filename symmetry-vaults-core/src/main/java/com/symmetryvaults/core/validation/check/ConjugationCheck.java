package com.symmetryvaults.core.validation.check;

import com.symmetryvaults.core.level.LevelDocumentAssembler;
import com.symmetryvaults.core.model.ConjugationLayer;
import com.symmetryvaults.core.model.ConjugationLayer.ClassifyEntry;
import com.symmetryvaults.core.model.ConjugationLayer.WitnessEntry;
import com.symmetryvaults.core.model.KeyringLayer;
import com.symmetryvaults.core.model.KeyringLayer.SubgroupEntry;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.validation.LevelCheck;
import com.symmetryvaults.core.validation.StoredGroup;
import com.symmetryvaults.core.validation.ValidationContext;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layer 4: normality flags and conjugation witnesses.
 *
 * <p>A witness must satisfy {@code h in H}, {@code g_inv = g^-1},
 * {@code g * h * g_inv = result} and {@code result not in H}. When {@code h}
 * is not in {@code H} the remaining witness checks are skipped, since they
 * only make sense for a candidate pair.
 *
 * <p>The layer lists exactly the proper non-trivial subgroups of layer 3;
 * each missing or extra element set is reported once.
 */
public class ConjugationCheck implements LevelCheck {

    @Override
    public String section() {
        return "layer_4";
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public void check(ValidationContext context) {
        LevelDocument document = context.document();
        if (document.layers() == null || document.layers().layer4() == null) {
            return;
        }
        ConjugationLayer layer = document.layers().layer4();
        List<ClassifyEntry> entries = layer.subgroups() == null ? List.of() : layer.subgroups();
        checkCounts(context, layer, entries);

        StoredGroup group = context.group();
        if (group == null || group.order() == 0) {
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            ClassifyEntry entry = entries.get(i);
            if (entry == null || !ElementSets.checkKnown(context, section(), i, entry.elements())) {
                continue;
            }
            checkEntry(context, i, entry);
        }
        checkCoverage(context, document.layers().layer3(), entries);
    }

    private void checkCoverage(ValidationContext context, KeyringLayer keyring, List<ClassifyEntry> entries) {
        if (keyring == null || keyring.subgroups() == null) {
            return;
        }
        int groupOrder = context.group().order();
        Map<Set<String>, List<String>> expected = new LinkedHashMap<>();
        for (SubgroupEntry subgroup : keyring.subgroups()) {
            if (subgroup == null || subgroup.elements() == null) {
                continue;
            }
            Set<String> elements = new HashSet<>(subgroup.elements());
            if (elements.size() > 1 && elements.size() < groupOrder) {
                expected.putIfAbsent(elements, subgroup.elements());
            }
        }
        Set<Set<String>> listed = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            ClassifyEntry entry = entries.get(i);
            if (entry == null || entry.elements() == null) {
                continue;
            }
            Set<String> elements = new HashSet<>(entry.elements());
            listed.add(elements);
            if (elements.size() > 1 && elements.size() < groupOrder && !expected.containsKey(elements)) {
                context.error(section(), i, "layer_3_listed", "subgroup listed in layer_3", entry.elements());
            }
        }
        for (Map.Entry<Set<String>, List<String>> subgroup : expected.entrySet()) {
            if (!listed.contains(subgroup.getKey())) {
                context.error(section(), null, "layer_3_coverage", subgroup.getValue(), "absent");
            }
        }
    }

    private void checkCounts(ValidationContext context, ConjugationLayer layer, List<ClassifyEntry> entries) {
        int normal = 0;
        for (ClassifyEntry entry : entries) {
            if (entry != null && Boolean.TRUE.equals(entry.isNormal())) {
                normal++;
            }
        }
        if (layer.classifyCount() == null || layer.classifyCount() != entries.size()) {
            context.error(section(), null, "classify_count", entries.size(), layer.classifyCount());
        }
        if (layer.normalCount() == null || layer.normalCount() != normal) {
            context.error(section(), null, "normal_count", normal, layer.normalCount());
        }
        if (layer.crackedCount() == null || layer.crackedCount() != entries.size() - normal) {
            context.error(section(), null, "cracked_count", entries.size() - normal, layer.crackedCount());
        }
    }

    private void checkEntry(ValidationContext context, int index, ClassifyEntry entry) {
        StoredGroup group = context.group();
        List<String> elements = entry.elements();
        if (entry.order() == null || entry.order() != elements.size()) {
            context.error(section(), index, "order", elements.size(), entry.order());
        }
        if (elements.size() == 1 || elements.size() == group.order()) {
            context.error(section(), index, "proper_nontrivial", "proper non-trivial subgroup",
                "order " + elements.size());
        }
        boolean isSubgroup = ElementSets.checkSubgroup(context, section(), index, elements);

        boolean claimedNormal = Boolean.TRUE.equals(entry.isNormal());
        WitnessEntry witness = entry.conjugationWitness();
        if (claimedNormal && witness != null) {
            context.error(section(), index, "witness_absent", "no witness for a normal subgroup", witness);
        } else if (!claimedNormal && witness == null) {
            context.error(section(), index, "witness_present", "witness for a non-normal subgroup", "null");
        }
        if (isSubgroup && context.groupValid()) {
            boolean normal = group.isNormal(elements);
            if (entry.isNormal() == null || entry.isNormal() != normal) {
                context.error(section(), index, "is_normal", normal, entry.isNormal());
            }
        }
        if (witness != null && !claimedNormal) {
            checkWitness(context, index, elements, witness);
        }
        int expectedAttempts = LevelDocumentAssembler.minAttempts(elements.size(), group.order());
        if (entry.minAttempts() != null && entry.minAttempts() != expectedAttempts) {
            context.warning(section(), index, "min_attempts", expectedAttempts, entry.minAttempts());
        }
    }

    private void checkWitness(ValidationContext context, int index, List<String> elements, WitnessEntry witness) {
        StoredGroup group = context.group();
        boolean known = true;
        for (String id : new String[] {witness.g(), witness.h(), witness.gInv(), witness.result()}) {
            if (!group.contains(id)) {
                context.error(section(), index, "witness_ids", "known element id", id);
                known = false;
            }
        }
        if (!known) {
            return;
        }
        if (!elements.contains(witness.h())) {
            context.error(section(), index, "witness_h_in_subgroup", "h in " + elements, witness.h());
            return;
        }
        String gInv = group.inverse(witness.g());
        if (!witness.gInv().equals(gInv)) {
            context.error(section(), index, "witness_g_inv", gInv, witness.gInv());
        }
        String result = group.multiply(group.multiply(witness.g(), witness.h()), gInv);
        if (result != null && !witness.result().equals(result)) {
            context.error(section(), index, "witness_result", result, witness.result());
        }
        if (elements.contains(witness.result())) {
            context.error(section(), index, "witness_result_outside", "result outside H", witness.result());
        }
    }
}

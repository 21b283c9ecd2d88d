package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.symmetry.CayleyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Selects a teachable subset of subgroups when a group has too many.
 *
 * <p>The trivial subgroup and the whole group are always kept. Remaining slots
 * are filled round-robin over the distinct subgroup orders, smallest first;
 * within an order normal subgroups come before non-normal ones and ties keep
 * enumeration order. The selection is returned in enumeration order together
 * with the full count, so the reduction stays visible in the level document.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * SubgroupFilter filter = new SubgroupFilter("pedagogical_top10", 10);
 * FilteredSubgroups selected = filter.filter(table, enumerator.enumerate(table));
 * }</pre>
 */
public class SubgroupFilter {

    public static final String DEFAULT_STRATEGY = "pedagogical_top10";
    public static final int DEFAULT_TARGET_COUNT = 10;

    private static final Logger log = LoggerFactory.getLogger(SubgroupFilter.class);

    private final String strategy;
    private final int targetCount;

    public SubgroupFilter(String strategy, int targetCount) {
        if (targetCount < 2) {
            throw new IllegalArgumentException("targetCount must be >= 2 to keep the trivial subgroup and the whole group");
        }
        this.strategy = strategy == null ? DEFAULT_STRATEGY : strategy;
        this.targetCount = targetCount;
    }

    public static SubgroupFilter defaults() {
        return new SubgroupFilter(DEFAULT_STRATEGY, DEFAULT_TARGET_COUNT);
    }

    /**
     * Applies the filter to a full enumeration.
     *
     * @param table Cayley table of the group
     * @param all every subgroup, in enumeration order
     * @return the selection with its audit fields
     */
    public FilteredSubgroups filter(CayleyTable table, List<Subgroup> all) {
        if (all.size() <= targetCount) {
            return new FilteredSubgroups(all, false, all.size(), strategy, targetCount);
        }

        boolean[] keep = new boolean[all.size()];
        Map<Integer, List<Integer>> byOrder = new TreeMap<>();
        for (int i = 0; i < all.size(); i++) {
            Subgroup subgroup = all.get(i);
            if (subgroup.isTrivial() || subgroup.isWholeGroup(table.order())) {
                keep[i] = true;
            } else {
                byOrder.computeIfAbsent(subgroup.order(), k -> new ArrayList<>()).add(i);
            }
        }
        for (List<Integer> candidates : byOrder.values()) {
            candidates.sort(Comparator
                .comparing((Integer i) -> !NormalityClassifier.isNormal(table, all.get(i)))
                .thenComparingInt(i -> i));
        }

        int selected = countKept(keep);
        for (int round = 0; selected < targetCount; round++) {
            boolean progressed = false;
            for (List<Integer> candidates : byOrder.values()) {
                if (round < candidates.size() && selected < targetCount) {
                    keep[candidates.get(round)] = true;
                    selected++;
                    progressed = true;
                }
            }
            if (!progressed) {
                break;
            }
        }

        List<Subgroup> result = new ArrayList<>(targetCount);
        for (int i = 0; i < all.size(); i++) {
            if (keep[i]) {
                result.add(all.get(i));
            }
        }
        log.info("Filtered subgroups with {}: kept {} of {}", strategy, result.size(), all.size());
        return new FilteredSubgroups(result, true, all.size(), strategy, targetCount);
    }

    private static int countKept(boolean[] keep) {
        int count = 0;
        for (boolean k : keep) {
            if (k) {
                count++;
            }
        }
        return count;
    }
}

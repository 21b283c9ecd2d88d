package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.symmetry.CayleyTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hasse diagram of a subgroup list plus the display names and lattice levels
 * written to level documents.
 */
public final class SubgroupLattice {

    private SubgroupLattice() {
    }

    /**
     * Covering edge: {@code from} is a maximal proper subgroup of {@code to}.
     *
     * @param from index of the smaller subgroup in the list
     * @param to index of the larger subgroup in the list
     */
    public record Edge(int from, int to) {
    }

    /**
     * Covering relation over the given subgroups.
     *
     * @param subgroups subgroups of one group
     * @return edges {@code i -> j} where {@code S_i < S_j} with no {@code S_k} strictly between
     */
    public static List<Edge> coveringEdges(List<Subgroup> subgroups) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < subgroups.size(); i++) {
            for (int j = 0; j < subgroups.size(); j++) {
                if (i != j && subgroups.get(i).isProperSubgroupOf(subgroups.get(j))
                    && !hasIntermediate(subgroups, i, j)) {
                    edges.add(new Edge(i, j));
                }
            }
        }
        return edges;
    }

    private static boolean hasIntermediate(List<Subgroup> subgroups, int i, int j) {
        Subgroup lower = subgroups.get(i);
        Subgroup upper = subgroups.get(j);
        for (int k = 0; k < subgroups.size(); k++) {
            Subgroup middle = subgroups.get(k);
            if (k != i && k != j && lower.isProperSubgroupOf(middle) && middle.isProperSubgroupOf(upper)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Coarse height in the lattice: 0 trivial, 3 whole group, 1 for orders up
     * to a quarter of the group, 2 otherwise.
     *
     * @param order subgroup order
     * @param groupOrder parent group order
     * @return level in {@code 0..3}
     */
    public static int latticeLevel(int order, int groupOrder) {
        if (order == 1) {
            return 0;
        }
        if (order == groupOrder) {
            return 3;
        }
        if (order <= groupOrder / 4) {
            return 1;
        }
        return 2;
    }

    /**
     * Display names: {@code Trivial}, {@code Full_group}, {@code Z2_<id>} for
     * order 2, {@code Subgroup_order_<k>} otherwise, suffixed with a running
     * number when several subgroups share an order.
     *
     * @param table Cayley table of the parent group
     * @param subgroups subgroups in list order
     * @return names in the same order, all distinct
     */
    public static List<String> names(CayleyTable table, List<Subgroup> subgroups) {
        Map<Integer, Integer> perOrder = new HashMap<>();
        for (Subgroup subgroup : subgroups) {
            perOrder.merge(subgroup.order(), 1, Integer::sum);
        }
        Map<Integer, Integer> seen = new HashMap<>();
        List<String> names = new ArrayList<>(subgroups.size());
        for (Subgroup subgroup : subgroups) {
            int order = subgroup.order();
            if (order == 1) {
                names.add("Trivial");
            } else if (order == table.order()) {
                names.add("Full_group");
            } else if (order == 2) {
                names.add("Z2_" + table.id(subgroup.elements().get(1)));
            } else {
                int running = seen.merge(order, 1, Integer::sum);
                names.add(perOrder.get(order) > 1
                    ? "Subgroup_order_" + order + "_" + running
                    : "Subgroup_order_" + order);
            }
        }
        return names;
    }
}

package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.symmetry.CayleyTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Finds small generating sets and computes the subgroup generated by a set of elements.
 *
 * <p>Generating sets are searched by size: a single element, then pairs, then
 * triples, all in canonical order. If none of those suffice, every
 * non-identity element is returned.
 */
public final class GeneratorFinder {

    private GeneratorFinder() {
    }

    /**
     * Subgroup generated by the given elements.
     *
     * @param table Cayley table of the parent group
     * @param seeds generating elements
     * @return element set of the generated subgroup, always containing the identity
     */
    public static BitSet closure(CayleyTable table, Collection<Integer> seeds) {
        BitSet generated = new BitSet(table.order());
        generated.set(table.identityIndex());
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(table.identityIndex());
        while (!queue.isEmpty()) {
            int x = queue.poll();
            for (int g : seeds) {
                int product = table.multiply(x, g);
                if (!generated.get(product)) {
                    generated.set(product);
                    queue.add(product);
                }
            }
        }
        return generated;
    }

    /**
     * Minimal generating set of the subgroup with the given elements.
     *
     * @param table Cayley table of the parent group
     * @param elements element indices of a subgroup, ascending
     * @return generator indices; empty for the trivial subgroup
     */
    public static List<Integer> find(CayleyTable table, List<Integer> elements) {
        BitSet target = new BitSet(table.order());
        elements.forEach(target::set);
        List<Integer> candidates = elements.stream()
            .filter(e -> e != table.identityIndex())
            .toList();
        int n = candidates.size();

        for (int i = 0; i < n; i++) {
            if (generates(table, target, List.of(candidates.get(i)))) {
                return List.of(candidates.get(i));
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                List<Integer> pair = List.of(candidates.get(i), candidates.get(j));
                if (generates(table, target, pair)) {
                    return pair;
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                for (int k = j + 1; k < n; k++) {
                    List<Integer> triple = List.of(candidates.get(i), candidates.get(j), candidates.get(k));
                    if (generates(table, target, triple)) {
                        return triple;
                    }
                }
            }
        }
        return new ArrayList<>(candidates);
    }

    /**
     * Minimal generating set of the whole group.
     *
     * @param table Cayley table
     * @return generator indices
     */
    public static List<Integer> findForGroup(CayleyTable table) {
        List<Integer> all = new ArrayList<>(table.order());
        for (int i = 0; i < table.order(); i++) {
            all.add(i);
        }
        return find(table, all);
    }

    private static boolean generates(CayleyTable table, BitSet target, List<Integer> seeds) {
        return closure(table, seeds).equals(target);
    }
}

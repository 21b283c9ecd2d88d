package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.symmetry.CayleyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates every subgroup of a finite group given by its Cayley table.
 *
 * <p>Every subgroup is the join of cyclic subgroups, so the enumeration starts
 * from the cyclic subgroup of each element and joins each newly found
 * subgroup with every element outside it until no new element set appears.
 * The result is sorted by order, then by element indices.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * List<Subgroup> subgroups = new SubgroupEnumerator().enumerate(table);
 * // S3: 6 subgroups (1 trivial, 3 of order 2, 1 of order 3, the whole group)
 * }</pre>
 */
public class SubgroupEnumerator {

    private static final Logger log = LoggerFactory.getLogger(SubgroupEnumerator.class);

    /**
     * Orders subgroups by size, then lexicographically by element indices.
     */
    public static final Comparator<Subgroup> CANONICAL_ORDER = Comparator
        .comparingInt(Subgroup::order)
        .thenComparing(Subgroup::elements, SubgroupEnumerator::compareIndices);

    /**
     * Returns every subgroup of the group, without any filtering.
     *
     * @param table Cayley table of the group
     * @return all subgroups in canonical order, from the trivial subgroup to the whole group
     */
    public List<Subgroup> enumerate(CayleyTable table) {
        int n = table.order();
        Set<BitSet> found = new LinkedHashSet<>();
        Deque<BitSet> pending = new ArrayDeque<>();

        for (int a = 0; a < n; a++) {
            BitSet cyclic = GeneratorFinder.closure(table, List.of(a));
            if (found.add(cyclic)) {
                pending.add(cyclic);
            }
        }
        int cyclicCount = found.size();

        while (!pending.isEmpty()) {
            BitSet current = pending.poll();
            List<Integer> seeds = current.stream().boxed().toList();
            for (int a = current.nextClearBit(0); a < n; a = current.nextClearBit(a + 1)) {
                List<Integer> joined = new ArrayList<>(seeds);
                joined.add(a);
                BitSet join = GeneratorFinder.closure(table, joined);
                if (found.add(join)) {
                    pending.add(join);
                }
            }
        }

        List<Subgroup> subgroups = new ArrayList<>(found.size());
        for (BitSet elements : found) {
            List<Integer> indices = elements.stream().boxed().toList();
            subgroups.add(new Subgroup(indices, GeneratorFinder.find(table, indices)));
        }
        subgroups.sort(CANONICAL_ORDER);

        log.debug("Group of order {}: {} cyclic subgroups, {} subgroups in total",
            n, cyclicCount, subgroups.size());
        return List.copyOf(subgroups);
    }

    private static int compareIndices(List<Integer> a, List<Integer> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = Integer.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}

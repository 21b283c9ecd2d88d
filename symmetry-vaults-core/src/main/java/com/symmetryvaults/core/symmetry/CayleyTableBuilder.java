package com.symmetryvaults.core.symmetry;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.exception.InvariantViolationException.Check;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns canonical ids and names to group elements and builds the Cayley table.
 *
 * <p>Canonical order: the identity {@code e} first, then the remaining elements
 * by element order and, within an order, by mapping in lexicographic order.
 * Rotations of the whole point set are named {@code r<k>}, the remaining
 * involutions {@code s1, s2, ...} and everything else {@code g1, g2, ...}.
 * The result depends only on the set of elements, so building twice yields
 * identical ids and tables.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * CayleyTable table = new CayleyTableBuilder().build(finder.findAll(graph));
 * int product = table.multiply(table.indexOf("r1"), table.indexOf("s1"));
 * }</pre>
 */
public class CayleyTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(CayleyTableBuilder.class);

    // the identity is the only element of order 1
    private static final Comparator<Permutation> CANONICAL_ORDER =
        Comparator.comparingInt(Permutation::order).thenComparing(Comparator.naturalOrder());

    /**
     * Builds the canonical group and its multiplication table.
     *
     * @param elements distinct permutations of equal size forming a group
     * @return the table
     * @throws IllegalArgumentException if the elements are empty, of mixed size or repeated
     * @throws InvariantViolationException if a product leaves the set or the table is not a Latin square
     */
    public CayleyTable build(List<Permutation> elements) {
        AutomorphismGroup group = canonicalGroup(elements);
        int n = group.order();

        Map<Permutation, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(group.get(i).mapping(), i);
        }

        int[][] table = new int[n][n];
        for (int a = 0; a < n; a++) {
            Permutation row = group.get(a).mapping();
            for (int b = 0; b < n; b++) {
                Integer product = index.get(row.compose(group.get(b).mapping()));
                if (product == null) {
                    throw new InvariantViolationException(Check.CLOSED_PRODUCT,
                        group.get(a).id() + " * " + group.get(b).id() + " is not in the group");
                }
                table[a][b] = product;
            }
        }
        verifyLatinSquare(table, group);

        log.debug("Built {}x{} Cayley table", n, n);
        return new CayleyTable(group, table);
    }

    /**
     * Sorts and names the elements without building the table.
     *
     * @param elements distinct permutations of equal size containing the identity
     * @return elements in canonical order with ids and names
     */
    public AutomorphismGroup canonicalGroup(List<Permutation> elements) {
        if (elements == null || elements.isEmpty()) {
            throw new IllegalArgumentException("Group must have at least one element");
        }
        int degree = elements.get(0).size();
        Set<Permutation> distinct = new HashSet<>();
        for (Permutation p : elements) {
            if (p.size() != degree) {
                throw new IllegalArgumentException("Mixed permutation sizes: " + degree + " and " + p.size());
            }
            if (!distinct.add(p)) {
                throw new IllegalArgumentException("Duplicate element " + p);
            }
        }
        if (!distinct.contains(Permutation.identity(degree))) {
            throw new InvariantViolationException(Check.GROUP_AXIOMS, "Identity is missing");
        }

        List<Permutation> sorted = new ArrayList<>(elements);
        sorted.sort(CANONICAL_ORDER);

        List<Automorphism> named = new ArrayList<>(sorted.size());
        int involutions = 0;
        int others = 0;
        for (Permutation p : sorted) {
            int order = p.order();
            String cycles = p.toCycleNotation();
            if (p.isIdentity()) {
                named.add(new Automorphism("e", p, "Identity", "Everything stays in place", cycles, 1));
            } else if (p.isRotation()) {
                int k = p.rotationAmount();
                named.add(new Automorphism("r" + k, p, "Rotation by " + (360 * k / degree) + "°",
                    "Cyclic shift by " + k + " (order " + order + ")", cycles, order));
            } else if (order == 2) {
                involutions++;
                named.add(new Automorphism("s" + involutions, p, "Flip " + cycles,
                    "Involution (order 2)", cycles, order));
            } else {
                others++;
                named.add(new Automorphism("g" + others, p, "Permutation " + cycles,
                    "Order " + order, cycles, order));
            }
        }
        return new AutomorphismGroup(named);
    }

    private static void verifyLatinSquare(int[][] table, AutomorphismGroup group) {
        int n = table.length;
        for (int a = 0; a < n; a++) {
            boolean[] inRow = new boolean[n];
            boolean[] inColumn = new boolean[n];
            for (int b = 0; b < n; b++) {
                if (inRow[table[a][b]]) {
                    throw new InvariantViolationException(Check.LATIN_SQUARE,
                        "Row " + group.get(a).id() + " repeats " + group.get(table[a][b]).id());
                }
                inRow[table[a][b]] = true;
                if (inColumn[table[b][a]]) {
                    throw new InvariantViolationException(Check.LATIN_SQUARE,
                        "Column " + group.get(a).id() + " repeats " + group.get(table[b][a]).id());
                }
                inColumn[table[b][a]] = true;
            }
            if (table[0][a] != a || table[a][0] != a) {
                throw new InvariantViolationException(Check.LATIN_SQUARE,
                    "Identity row or column is not the identity map at " + group.get(a).id());
            }
        }
    }
}

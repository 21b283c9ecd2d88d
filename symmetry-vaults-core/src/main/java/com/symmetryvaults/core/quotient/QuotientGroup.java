package com.symmetryvaults.core.quotient;

import com.symmetryvaults.core.subgroup.Subgroup;

import java.util.List;
import java.util.Objects;

/**
 * Quotient {@code G/H} of a group by a normal subgroup.
 *
 * @param normalSubgroup the normal subgroup {@code H}
 * @param cosets cosets in construction order; the first one is {@code H} itself
 * @param table quotient multiplication table over coset indices
 * @param quotientType isomorphism class name such as {@code Z2} or {@code Z2xZ2}
 */
public record QuotientGroup(
    Subgroup normalSubgroup,
    List<Coset> cosets,
    List<List<Integer>> table,
    String quotientType
) {
    /**
     * Compact constructor with validation.
     */
    public QuotientGroup {
        Objects.requireNonNull(normalSubgroup, "normalSubgroup must not be null");
        Objects.requireNonNull(cosets, "cosets must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(quotientType, "quotientType must not be null");
        cosets = List.copyOf(cosets);
        table = table.stream().map(List::copyOf).toList();
    }

    public int quotientOrder() {
        return cosets.size();
    }

    public List<Integer> representatives() {
        return cosets.stream().map(Coset::representative).toList();
    }

    /**
     * Product of two cosets.
     *
     * @param a coset index
     * @param b coset index
     * @return index of the coset containing {@code rep(a) * rep(b)}
     */
    public int multiply(int a, int b) {
        return table.get(a).get(b);
    }
}

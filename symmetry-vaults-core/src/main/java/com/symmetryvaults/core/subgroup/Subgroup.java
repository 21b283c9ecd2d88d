package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.symmetry.CayleyTable;

import java.util.List;
import java.util.Objects;

/**
 * A subgroup as a set of element indices of its parent group.
 *
 * @param elements element indices in ascending (canonical group) order; always contains 0
 * @param generators indices of a minimal generating set
 */
public record Subgroup(
    List<Integer> elements,
    List<Integer> generators
) {
    /**
     * Compact constructor with validation.
     */
    public Subgroup {
        Objects.requireNonNull(elements, "elements must not be null");
        Objects.requireNonNull(generators, "generators must not be null");
        elements = List.copyOf(elements);
        generators = List.copyOf(generators);
        if (elements.isEmpty() || elements.get(0) != 0) {
            throw new IllegalArgumentException("Subgroup must contain the identity: " + elements);
        }
        for (int i = 1; i < elements.size(); i++) {
            if (elements.get(i) <= elements.get(i - 1)) {
                throw new IllegalArgumentException("Subgroup elements must be strictly ascending: " + elements);
            }
        }
    }

    public int order() {
        return elements.size();
    }

    public boolean contains(int element) {
        return elements.contains(element);
    }

    public boolean isTrivial() {
        return elements.size() == 1;
    }

    public boolean isWholeGroup(int groupOrder) {
        return elements.size() == groupOrder;
    }

    /**
     * Whether this subgroup is a proper subset of {@code other}.
     *
     * @param other candidate supergroup
     * @return true for strict inclusion
     */
    public boolean isProperSubgroupOf(Subgroup other) {
        return order() < other.order() && other.elements.containsAll(elements);
    }

    public List<String> ids(CayleyTable table) {
        return elements.stream().map(table::id).toList();
    }

    public List<String> generatorIds(CayleyTable table) {
        return generators.stream().map(table::id).toList();
    }
}

package com.symmetryvaults.core.quotient;

import java.util.List;
import java.util.Objects;

/**
 * Left coset {@code gH} of a normal subgroup.
 *
 * @param elements element indices of the coset, in construction order {@code g*h} for {@code h} in {@code H}
 * @param representative the element {@code g} the coset was built from
 */
public record Coset(
    List<Integer> elements,
    int representative
) {
    /**
     * Compact constructor with validation.
     */
    public Coset {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean contains(int element) {
        return elements.contains(element);
    }
}

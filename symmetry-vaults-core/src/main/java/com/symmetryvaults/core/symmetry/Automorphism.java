package com.symmetryvaults.core.symmetry;

import com.symmetryvaults.core.algebra.Permutation;

import java.util.Objects;

/**
 * A group element with its canonical id and display metadata.
 *
 * @param id canonical id ({@code e}, {@code r1}, {@code s2}, {@code g1}, ...)
 * @param mapping the permutation
 * @param name display name
 * @param description short description including the element order
 * @param cycleNotation cycle notation of the mapping
 * @param order element order
 */
public record Automorphism(
    String id,
    Permutation mapping,
    String name,
    String description,
    String cycleNotation,
    int order
) {
    /**
     * Compact constructor with validation.
     */
    public Automorphism {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (cycleNotation == null) {
            cycleNotation = mapping.toCycleNotation();
        }
        if (order < 1) {
            throw new IllegalArgumentException("order must be >= 1");
        }
    }

    public boolean isIdentity() {
        return mapping.isIdentity();
    }
}

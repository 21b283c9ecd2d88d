package com.symmetryvaults.core.symmetry;

import com.symmetryvaults.core.algebra.Permutation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered group elements with canonical ids, identity first.
 *
 * @param elements elements in canonical order
 */
public record AutomorphismGroup(
    List<Automorphism> elements
) {
    /**
     * Compact constructor with validation.
     */
    public AutomorphismGroup {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
        if (elements.isEmpty() || !elements.get(0).isIdentity()) {
            throw new IllegalArgumentException("Group must start with the identity");
        }
    }

    public int order() {
        return elements.size();
    }

    public Automorphism get(int index) {
        return elements.get(index);
    }

    public List<String> ids() {
        return elements.stream().map(Automorphism::id).toList();
    }

    public List<Permutation> permutations() {
        return elements.stream().map(Automorphism::mapping).toList();
    }

    /**
     * Index of an element, by permutation.
     *
     * @param permutation element to look up
     * @return index, or {@code -1} if the permutation is not in the group
     */
    public int indexOf(Permutation permutation) {
        return indexByPermutation().getOrDefault(permutation, -1);
    }

    /**
     * Number of points every element acts on.
     *
     * @return permutation degree
     */
    public int degree() {
        return elements.get(0).mapping().size();
    }

    private Map<Permutation, Integer> indexByPermutation() {
        Map<Permutation, Integer> index = new HashMap<>();
        for (int i = 0; i < elements.size(); i++) {
            index.put(elements.get(i).mapping(), i);
        }
        return index;
    }
}

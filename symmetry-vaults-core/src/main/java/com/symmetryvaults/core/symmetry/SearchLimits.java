package com.symmetryvaults.core.symmetry;

/**
 * Ceilings that make oversized automorphism searches fail fast.
 *
 * @param maxVertices largest vertex count searched at all
 * @param maxGroupOrder search aborts once more automorphisms than this are found
 */
public record SearchLimits(
    int maxVertices,
    int maxGroupOrder
) {
    public static final int DEFAULT_MAX_VERTICES = 16;
    public static final int DEFAULT_MAX_GROUP_ORDER = 48;

    /**
     * Compact constructor with validation.
     */
    public SearchLimits {
        if (maxVertices < 1) {
            throw new IllegalArgumentException("maxVertices must be >= 1");
        }
        if (maxGroupOrder < 1) {
            throw new IllegalArgumentException("maxGroupOrder must be >= 1");
        }
    }

    public static SearchLimits defaults() {
        return new SearchLimits(DEFAULT_MAX_VERTICES, DEFAULT_MAX_GROUP_ORDER);
    }
}

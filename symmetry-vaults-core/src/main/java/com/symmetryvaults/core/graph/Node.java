package com.symmetryvaults.core.graph;

import java.util.Objects;

/**
 * A vertex of a level graph.
 *
 * @param id dense vertex id in {@code 0..n-1}
 * @param color color class; automorphisms map vertices only to same-colored vertices
 * @param label display label
 */
public record Node(
    int id,
    String color,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0");
        }
        Objects.requireNonNull(color, "color must not be null");
        if (label == null) {
            label = String.valueOf(id);
        }
    }
}

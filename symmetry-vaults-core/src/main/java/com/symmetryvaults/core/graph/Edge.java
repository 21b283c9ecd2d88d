package com.symmetryvaults.core.graph;

import java.util.Objects;

/**
 * An edge of a level graph.
 *
 * @param from source vertex id
 * @param to target vertex id
 * @param type edge type; automorphisms must preserve it
 * @param directed whether the edge is only traversable from {@code from} to {@code to}
 */
public record Edge(
    int from,
    int to,
    String type,
    boolean directed
) {
    public static final String STANDARD = "standard";
    public static final String THICK = "thick";

    /**
     * Compact constructor with validation.
     */
    public Edge {
        if (from == to) {
            throw new IllegalArgumentException("Self-loop on vertex " + from + " is not allowed");
        }
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Edge undirected(int from, int to, String type) {
        return new Edge(from, to, type, false);
    }

    public static Edge directed(int from, int to, String type) {
        return new Edge(from, to, type, true);
    }
}

package com.symmetryvaults.core.graph;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable labeled graph built once per level.
 *
 * <p>Invariants: node ids are dense {@code 0..n-1} in list order, every edge
 * references existing nodes, and no {@code (from, to, type)} triple repeats.
 * For undirected edges the triple is compared without orientation.
 *
 * @param nodes vertices in id order
 * @param edges edges in construction order
 */
public record Graph(
    List<Node> nodes,
    List<Edge> edges
) {
    /**
     * Compact constructor with validation.
     */
    public Graph {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);

        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() != i) {
                throw new IllegalArgumentException("Node ids must be dense 0.." + (nodes.size() - 1)
                    + " in order, found " + nodes.get(i).id() + " at position " + i);
            }
        }
        Set<String> seen = new HashSet<>();
        for (Edge edge : edges) {
            if (edge.from() >= nodes.size() || edge.to() >= nodes.size() || edge.from() < 0 || edge.to() < 0) {
                throw new IllegalArgumentException("Edge " + edge + " references a missing node");
            }
            if (!seen.add(edgeKey(edge))) {
                throw new IllegalArgumentException("Duplicate edge " + edge);
            }
        }
    }

    private static String edgeKey(Edge edge) {
        if (edge.directed()) {
            return edge.from() + ">" + edge.to() + ":" + edge.type();
        }
        int a = Math.min(edge.from(), edge.to());
        int b = Math.max(edge.from(), edge.to());
        return a + "-" + b + ":" + edge.type();
    }

    public int vertexCount() {
        return nodes.size();
    }

    public String colorOf(int vertex) {
        return nodes.get(vertex).color();
    }

    public boolean hasDirectedEdges() {
        return edges.stream().anyMatch(Edge::directed);
    }

    /**
     * Whether every vertex is reachable from vertex 0, ignoring direction.
     *
     * @return true for connected (or empty) graphs
     */
    public boolean isConnected() {
        if (nodes.isEmpty()) {
            return true;
        }
        boolean[] visited = new boolean[nodes.size()];
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        visited[0] = true;
        int reached = 1;
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (Edge edge : edges) {
                int next = -1;
                if (edge.from() == v) {
                    next = edge.to();
                } else if (edge.to() == v) {
                    next = edge.from();
                }
                if (next >= 0 && !visited[next]) {
                    visited[next] = true;
                    reached++;
                    queue.add(next);
                }
            }
        }
        return reached == nodes.size();
    }
}

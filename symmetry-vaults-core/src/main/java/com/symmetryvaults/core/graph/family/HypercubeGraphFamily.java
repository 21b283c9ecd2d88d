package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Hypercube graph Q_d: vertices are d-bit words, joined when they differ in one bit.
 */
public class HypercubeGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "hypercube";
    }

    @Override
    public String getDisplayName() {
        return "Hypercube graph Q_d";
    }

    @Override
    public int getMinSize() {
        return 1;
    }

    @Override
    public List<Integer> getListedSizes() {
        return List.of(1, 2, 3);
    }

    @Override
    public int vertexCount(int size) {
        return 1 << size;
    }

    @Override
    protected Graph doBuild(int dimension) {
        int n = 1 << dimension;
        List<Edge> edges = new ArrayList<>();
        for (int v = 0; v < n; v++) {
            for (int bit = 0; bit < dimension; bit++) {
                int w = v ^ (1 << bit);
                if (v < w) {
                    edges.add(Edge.undirected(v, w, Edge.STANDARD));
                }
            }
        }
        return new Graph(uniformNodes(n, "blue"), edges);
    }
}

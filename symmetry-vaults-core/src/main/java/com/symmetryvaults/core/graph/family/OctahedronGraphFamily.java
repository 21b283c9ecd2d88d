package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Octahedron graph: every vertex is joined to all others except its opposite.
 */
public class OctahedronGraphFamily extends FixedGraphFamily {

    // top, left, front, right, back, bottom
    private static final int[][] ADJACENCY = {
        {0, 1}, {0, 2}, {0, 3}, {0, 4},
        {5, 1}, {5, 2}, {5, 3}, {5, 4},
        {1, 2}, {2, 3}, {3, 4}, {4, 1}
    };

    @Override
    public String getId() {
        return "octahedron";
    }

    @Override
    public String getDisplayName() {
        return "Octahedron graph";
    }

    @Override
    protected int fixedVertexCount() {
        return 6;
    }

    @Override
    protected Graph doBuild(int size) {
        List<Edge> edges = new ArrayList<>(ADJACENCY.length);
        for (int[] pair : ADJACENCY) {
            edges.add(Edge.undirected(pair[0], pair[1], Edge.STANDARD));
        }
        return new Graph(uniformNodes(6, "red"), edges);
    }
}

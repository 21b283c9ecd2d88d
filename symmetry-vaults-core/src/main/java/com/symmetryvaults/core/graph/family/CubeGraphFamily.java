package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Cube graph: front face 0-3, back face 4-7 and four connecting edges.
 */
public class CubeGraphFamily extends FixedGraphFamily {

    @Override
    public String getId() {
        return "cube";
    }

    @Override
    public String getDisplayName() {
        return "Cube graph";
    }

    @Override
    protected int fixedVertexCount() {
        return 8;
    }

    @Override
    protected Graph doBuild(int size) {
        List<Edge> edges = new ArrayList<>(ringEdges(0, 4, Edge.STANDARD, false));
        edges.addAll(ringEdges(4, 4, Edge.STANDARD, false));
        for (int i = 0; i < 4; i++) {
            edges.add(Edge.undirected(i, i + 4, Edge.STANDARD));
        }
        return new Graph(uniformNodes(8, "blue"), edges);
    }
}

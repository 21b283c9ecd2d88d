package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Petersen graph: outer pentagon, inner pentagram and thick spokes.
 */
public class PetersenGraphFamily extends FixedGraphFamily {

    @Override
    public String getId() {
        return "petersen";
    }

    @Override
    public String getDisplayName() {
        return "Petersen graph";
    }

    @Override
    protected int fixedVertexCount() {
        return 10;
    }

    @Override
    protected Graph doBuild(int size) {
        List<Node> nodes = new ArrayList<>(10);
        for (int i = 0; i < 10; i++) {
            nodes.add(new Node(i, "green", label(i, "P")));
        }
        List<Edge> edges = new ArrayList<>(ringEdges(0, 5, Edge.STANDARD, false));
        for (int i = 0; i < 5; i++) {
            edges.add(Edge.undirected(5 + i, 5 + (i + 2) % 5, Edge.STANDARD));
        }
        for (int i = 0; i < 5; i++) {
            edges.add(Edge.undirected(i, 5 + i, Edge.THICK));
        }
        return new Graph(nodes, edges);
    }
}

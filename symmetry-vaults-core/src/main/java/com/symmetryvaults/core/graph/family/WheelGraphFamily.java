package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Wheel graph W_n: a hub (vertex 0) joined by thick spokes to a rim of n vertices.
 */
public class WheelGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "wheel";
    }

    @Override
    public String getDisplayName() {
        return "Wheel graph W_n";
    }

    @Override
    public int getMinSize() {
        return 3;
    }

    @Override
    public List<Integer> getListedSizes() {
        return IntStream.rangeClosed(3, 8).boxed().toList();
    }

    @Override
    public int vertexCount(int size) {
        return size + 1;
    }

    @Override
    protected Graph doBuild(int n) {
        List<Node> nodes = new ArrayList<>(n + 1);
        nodes.add(new Node(0, "gold", "H"));
        for (int i = 0; i < n; i++) {
            nodes.add(new Node(i + 1, "blue", label(i, "R")));
        }
        List<Edge> edges = new ArrayList<>(ringEdges(1, n, Edge.STANDARD, false));
        for (int i = 0; i < n; i++) {
            edges.add(Edge.undirected(0, i + 1, Edge.THICK));
        }
        return new Graph(nodes, edges);
    }
}

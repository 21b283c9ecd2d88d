package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Prism graph: two differently colored copies of C_n joined by thick rungs.
 */
public class PrismGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "prism";
    }

    @Override
    public String getDisplayName() {
        return "Prism graph C_n x K_2";
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
        return 2 * size;
    }

    @Override
    protected Graph doBuild(int n) {
        List<Node> nodes = new ArrayList<>(2 * n);
        for (int i = 0; i < n; i++) {
            nodes.add(new Node(i, "cyan", label(i, "T") + "0"));
        }
        for (int i = 0; i < n; i++) {
            nodes.add(new Node(n + i, "purple", label(i, "B") + "1"));
        }
        List<Edge> edges = new ArrayList<>(ringEdges(0, n, Edge.STANDARD, false));
        edges.addAll(ringEdges(n, n, Edge.STANDARD, false));
        for (int i = 0; i < n; i++) {
            edges.add(Edge.undirected(i, n + i, Edge.THICK));
        }
        return new Graph(nodes, edges);
    }
}

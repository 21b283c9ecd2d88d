package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Star graph K_{1,n}: a colored centre joined to n leaves.
 */
public class StarGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "star";
    }

    @Override
    public String getDisplayName() {
        return "Star graph K_{1,n}";
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
        nodes.add(new Node(0, "cyan", "A"));
        List<Edge> edges = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            nodes.add(new Node(i, "purple", label(i, "L")));
            edges.add(Edge.undirected(0, i, Edge.STANDARD));
        }
        return new Graph(nodes, edges);
    }
}

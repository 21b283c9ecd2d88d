package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Path graph P_n: n vertices in a line.
 */
public class PathGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "path";
    }

    @Override
    public String getDisplayName() {
        return "Path graph P_n";
    }

    @Override
    public int getMinSize() {
        return 2;
    }

    @Override
    public List<Integer> getListedSizes() {
        return IntStream.rangeClosed(2, 12).boxed().toList();
    }

    @Override
    public int vertexCount(int size) {
        return size;
    }

    @Override
    protected Graph doBuild(int n) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < n - 1; i++) {
            edges.add(Edge.undirected(i, i + 1, Edge.STANDARD));
        }
        return new Graph(uniformNodes(n, "blue"), edges);
    }
}

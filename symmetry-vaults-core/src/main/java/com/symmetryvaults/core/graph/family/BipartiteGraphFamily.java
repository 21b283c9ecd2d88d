package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.exception.InvalidSizeException;
import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Balanced complete bipartite graph K_{m,m}; the size is the total vertex
 * count and must split evenly. The two sides carry different colors.
 */
public class BipartiteGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "bipartite";
    }

    @Override
    public String getDisplayName() {
        return "Complete bipartite graph K_{m,m}";
    }

    @Override
    public int getMinSize() {
        return 2;
    }

    @Override
    public List<Integer> getListedSizes() {
        return List.of(2, 4, 6, 8, 10);
    }

    @Override
    public int vertexCount(int size) {
        return size;
    }

    @Override
    protected void checkSize(int size) {
        if (size % 2 != 0) {
            throw new InvalidSizeException(getId(), size, "complete bipartite graph needs an even split");
        }
    }

    @Override
    protected Graph doBuild(int size) {
        int m = size / 2;
        List<Node> nodes = new ArrayList<>(size);
        for (int i = 0; i < m; i++) {
            nodes.add(new Node(i, "cyan", label(i, "A")));
        }
        for (int j = 0; j < m; j++) {
            nodes.add(new Node(m + j, "purple", label(m + j, "B")));
        }
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < m; j++) {
                edges.add(Edge.undirected(i, m + j, Edge.STANDARD));
            }
        }
        return new Graph(nodes, edges);
    }
}

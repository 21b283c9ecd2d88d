package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Complete graph K_n: every pair of vertices joined.
 */
public class CompleteGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "complete";
    }

    @Override
    public String getDisplayName() {
        return "Complete graph K_n";
    }

    @Override
    public int getMinSize() {
        return 2;
    }

    @Override
    public List<Integer> getListedSizes() {
        return IntStream.rangeClosed(2, 7).boxed().toList();
    }

    @Override
    public int vertexCount(int size) {
        return size;
    }

    @Override
    protected Graph doBuild(int n) {
        return new Graph(uniformNodes(n, "red"), completeEdges(n, Edge.STANDARD));
    }
}

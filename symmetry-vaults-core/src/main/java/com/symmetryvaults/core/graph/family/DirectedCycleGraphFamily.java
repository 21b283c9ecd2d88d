package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Directed polygon: a ring whose edges all point the same way, so only
 * rotations survive as automorphisms.
 */
public class DirectedCycleGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "directed_cycle";
    }

    @Override
    public String getDisplayName() {
        return "Directed cycle (rotations only)";
    }

    @Override
    public int getMinSize() {
        return 3;
    }

    @Override
    public List<Integer> getListedSizes() {
        return IntStream.rangeClosed(3, 12).boxed().toList();
    }

    @Override
    public int vertexCount(int size) {
        return size;
    }

    @Override
    protected Graph doBuild(int n) {
        return new Graph(uniformNodes(n, "gold"), ringEdges(0, n, Edge.STANDARD, true));
    }
}

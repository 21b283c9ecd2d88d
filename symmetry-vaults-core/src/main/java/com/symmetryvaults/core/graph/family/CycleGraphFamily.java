package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Cycle graph C_n: n uniformly colored vertices joined in a ring.
 */
public class CycleGraphFamily extends AbstractGraphFamily {

    @Override
    public String getId() {
        return "cycle";
    }

    @Override
    public String getDisplayName() {
        return "Cycle graph C_n";
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
        return new Graph(uniformNodes(n, "gold"), ringEdges(0, n, Edge.STANDARD, false));
    }
}

package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;

/**
 * Tetrahedron graph (K_4 with uniform colors).
 */
public class TetrahedronGraphFamily extends FixedGraphFamily {

    @Override
    public String getId() {
        return "tetrahedron";
    }

    @Override
    public String getDisplayName() {
        return "Tetrahedron graph";
    }

    @Override
    protected int fixedVertexCount() {
        return 4;
    }

    @Override
    protected Graph doBuild(int size) {
        return new Graph(uniformNodes(4, "red"), completeEdges(4, Edge.STANDARD));
    }
}

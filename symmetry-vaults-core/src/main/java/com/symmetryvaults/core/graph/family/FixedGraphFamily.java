package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.exception.InvalidSizeException;

import java.util.List;

/**
 * Base class for named graphs with a single vertex count.
 *
 * <p>The size parameter is optional: {@code 0} or the graph's own vertex
 * count are accepted, anything else is rejected.
 */
public abstract class FixedGraphFamily extends AbstractGraphFamily {

    /**
     * Vertex count of the named graph.
     *
     * @return number of vertices
     */
    protected abstract int fixedVertexCount();

    @Override
    public boolean isFixedSize() {
        return true;
    }

    @Override
    public int getMinSize() {
        return 0;
    }

    @Override
    public List<Integer> getListedSizes() {
        return List.of(fixedVertexCount());
    }

    @Override
    public int vertexCount(int size) {
        return fixedVertexCount();
    }

    @Override
    protected void checkSize(int size) {
        if (size != 0 && size != fixedVertexCount()) {
            throw new InvalidSizeException(getId(), size,
                "named graph has exactly " + fixedVertexCount() + " vertices");
        }
    }
}

package com.symmetryvaults.core.exception;

/**
 * Thrown before an automorphism search starts when the graph has more
 * vertices than the configured ceiling.
 */
public class GraphTooLargeException extends LevelSpecificationException {

    private final int vertexCount;
    private final int maxVertices;

    public GraphTooLargeException(int vertexCount, int maxVertices) {
        super("Graph has " + vertexCount + " vertices, above the search ceiling of " + maxVertices
            + ". Choose a smaller graph family or size.");
        this.vertexCount = vertexCount;
        this.maxVertices = maxVertices;
    }

    public int getVertexCount() {
        return vertexCount;
    }

    public int getMaxVertices() {
        return maxVertices;
    }
}

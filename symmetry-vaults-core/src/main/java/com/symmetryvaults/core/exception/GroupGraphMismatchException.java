package com.symmetryvaults.core.exception;

/**
 * Thrown when a named group cannot act on the requested graph: either it
 * permutes a different number of points than the graph has vertices, or one
 * of its elements does not preserve the graph.
 */
public class GroupGraphMismatchException extends LevelSpecificationException {

    public GroupGraphMismatchException(String message) {
        super(message);
    }
}

package com.symmetryvaults.core.graph.family;

import com.symmetryvaults.core.exception.InvalidSizeException;
import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.GraphFamily;
import com.symmetryvaults.core.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Abstract base class for graph families providing size validation and
 * node/edge construction helpers.
 *
 * <p>Concrete families implement {@link #doBuild(int)}; {@link #build(int)}
 * checks the minimum size and any additional constraint from
 * {@link #checkSize(int)} first.
 *
 * @see GraphFamily
 */
public abstract class AbstractGraphFamily implements GraphFamily {

    /**
     * Logger instance for this family.
     */
    protected final Logger log;

    protected AbstractGraphFamily() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final Graph build(int size) {
        if (size < getMinSize()) {
            throw new InvalidSizeException(getId(), size, "minimum size is " + getMinSize());
        }
        checkSize(size);
        Graph graph = doBuild(size);
        log.debug("Built {} graph of size {}: {} nodes, {} edges",
            getId(), size, graph.vertexCount(), graph.edges().size());
        return graph;
    }

    @Override
    public List<Integer> getListedSizes() {
        return IntStream.rangeClosed(getMinSize(), getMinSize() + 7).boxed().toList();
    }

    /**
     * Hook for family-specific constraints beyond the minimum size.
     *
     * @param size requested size
     * @throws InvalidSizeException if the size is not acceptable
     */
    protected void checkSize(int size) {
    }

    /**
     * Builds the graph for an already validated size.
     *
     * @param size size parameter
     * @return the graph
     */
    protected abstract Graph doBuild(int size);

    // ==================== Construction Helpers ====================

    /**
     * Letter label for a vertex: A..Z, then a prefixed index.
     */
    protected static String label(int index, String fallbackPrefix) {
        return index < 26 ? String.valueOf((char) ('A' + index)) : fallbackPrefix + index;
    }

    protected static List<Node> uniformNodes(int count, String color) {
        List<Node> nodes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            nodes.add(new Node(i, color, label(i, "N")));
        }
        return nodes;
    }

    /**
     * Edges {@code offset+i -> offset+(i+1) mod n} for a ring of {@code n} vertices.
     */
    protected static List<Edge> ringEdges(int offset, int n, String type, boolean directed) {
        List<Edge> edges = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            edges.add(new Edge(offset + i, offset + (i + 1) % n, type, directed));
        }
        return edges;
    }

    protected static List<Edge> completeEdges(int n, String type) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                edges.add(Edge.undirected(i, j, type));
            }
        }
        return edges;
    }
}

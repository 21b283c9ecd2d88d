package com.symmetryvaults.core.graph;

import com.symmetryvaults.core.exception.InvalidSizeException;

import java.util.List;

/**
 * A named, parameterized family of level graphs.
 *
 * <p>Families are discovered via Java Service Provider Interface (SPI). Each
 * family owns its coloring and edge-typing rule, so building the same family
 * and size always yields the same nodes, edges and ids.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CycleGraphFamily extends AbstractGraphFamily {
 *     public String getId() { return "cycle"; }
 *     public String getDisplayName() { return "Cycle graph C_n"; }
 *     public int getMinSize() { return 3; }
 *
 *     protected Graph doBuild(int n) {
 *         return new Graph(uniformNodes(n, "gold"), ringEdges(0, n, Edge.STANDARD, false));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.symmetryvaults.core.graph.GraphFamily}
 *
 * @see GraphCatalog
 */
public interface GraphFamily {

    /**
     * Returns the unique family identifier used in graph names
     * (e.g., "cycle" in {@code cycle_5}, "petersen").
     *
     * @return lowercase family id
     */
    String getId();

    /**
     * Returns a human-readable name for listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Smallest size parameter this family accepts.
     *
     * @return minimum size
     */
    int getMinSize();

    /**
     * Whether the family is a single named graph that takes no size parameter.
     *
     * @return true for fixed graphs such as the Petersen graph
     */
    default boolean isFixedSize() {
        return false;
    }

    /**
     * Sizes advertised by {@code list graphs}.
     *
     * @return listed sizes in ascending order
     */
    List<Integer> getListedSizes();

    /**
     * Number of vertices the graph of the given size has.
     *
     * @param size size parameter
     * @return vertex count
     */
    int vertexCount(int size);

    /**
     * Builds the graph of the given size.
     *
     * @param size size parameter
     * @return the graph
     * @throws InvalidSizeException if the size violates the family's constraints
     */
    Graph build(int size);
}

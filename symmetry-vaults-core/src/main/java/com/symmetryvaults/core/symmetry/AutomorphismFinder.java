package com.symmetryvaults.core.symmetry;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.GraphTooLargeException;
import com.symmetryvaults.core.exception.GroupTooLargeException;
import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the full automorphism group of a colored, edge-typed graph.
 *
 * <p>The search assigns images to vertices {@code 0..n-1} in order, keeping the
 * partial assignment and a per-depth candidate cursor on an explicit stack.
 * A candidate image must match the vertex's degree signature (its color plus
 * the multiset of incident edge direction, type and neighbour color) and
 * must agree with every already assigned vertex on edge presence, type and
 * direction. Complete assignments are re-checked over all ordered vertex pairs.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * AutomorphismFinder finder = new AutomorphismFinder(SearchLimits.defaults());
 * List<Permutation> automorphisms = finder.findAll(graphCatalog.build("cycle_4"));
 * // 8 elements: D4 acting on the square
 * }</pre>
 */
public class AutomorphismFinder {

    private static final Logger log = LoggerFactory.getLogger(AutomorphismFinder.class);

    private final SearchLimits limits;

    public AutomorphismFinder(SearchLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public List<Permutation> findAll(Graph graph) {
        return findAll(graph, "Aut(graph)");
    }

    /**
     * Finds every automorphism of the graph.
     *
     * @param graph graph to search
     * @param groupLabel name used in error messages, e.g. {@code Aut(cycle_5)}
     * @return distinct automorphisms in discovery order; the identity is always first
     * @throws GraphTooLargeException if the graph exceeds the vertex ceiling
     * @throws GroupTooLargeException if more automorphisms than the order ceiling exist
     */
    public List<Permutation> findAll(Graph graph, String groupLabel) {
        Objects.requireNonNull(graph, "graph must not be null");
        int n = graph.vertexCount();
        if (n == 0) {
            throw new IllegalArgumentException("Graph has no vertices");
        }
        if (n > limits.maxVertices()) {
            throw new GraphTooLargeException(n, limits.maxVertices());
        }

        String[][] relation = relation(graph);
        String[] signature = signatures(graph, relation);

        Set<Permutation> found = new LinkedHashSet<>();
        int[] mapping = new int[n];
        int[] cursor = new int[n];
        boolean[] used = new boolean[n];
        long visited = 0;

        int depth = 0;
        while (depth >= 0) {
            if (depth == n) {
                Permutation candidate = Permutation.of(mapping);
                if (preserves(relation, graph, candidate) && found.add(candidate)
                    && found.size() > limits.maxGroupOrder()) {
                    throw new GroupTooLargeException(groupLabel, limits.maxGroupOrder());
                }
                depth--;
                used[mapping[depth]] = false;
                continue;
            }
            int image = nextCandidate(depth, cursor[depth], mapping, used, relation, signature);
            if (image < 0) {
                depth--;
                if (depth >= 0) {
                    used[mapping[depth]] = false;
                }
                continue;
            }
            visited++;
            cursor[depth] = image + 1;
            mapping[depth] = image;
            used[image] = true;
            depth++;
            if (depth < n) {
                cursor[depth] = 0;
            }
        }

        log.debug("Automorphism search on {} vertices: {} automorphisms, {} partial assignments",
            n, found.size(), visited);
        return List.copyOf(found);
    }

    private static int nextCandidate(int vertex, int from, int[] mapping, boolean[] used,
                                     String[][] relation, String[] signature) {
        for (int w = from; w < used.length; w++) {
            if (used[w] || !signature[w].equals(signature[vertex])) {
                continue;
            }
            boolean consistent = true;
            for (int a = 0; a < vertex && consistent; a++) {
                consistent = Objects.equals(relation[vertex][a], relation[w][mapping[a]])
                    && Objects.equals(relation[a][vertex], relation[mapping[a]][w]);
            }
            if (consistent) {
                return w;
            }
        }
        return -1;
    }

    /**
     * Whether the permutation maps the graph onto itself, preserving colors,
     * edge presence, edge type and edge direction.
     *
     * @param graph the graph
     * @param permutation candidate of the graph's size
     * @return true for automorphisms
     */
    public static boolean isAutomorphism(Graph graph, Permutation permutation) {
        if (permutation.size() != graph.vertexCount()) {
            return false;
        }
        return preserves(relation(graph), graph, permutation);
    }

    private static boolean preserves(String[][] relation, Graph graph, Permutation p) {
        int n = relation.length;
        for (int u = 0; u < n; u++) {
            if (!graph.colorOf(u).equals(graph.colorOf(p.apply(u)))) {
                return false;
            }
            for (int v = 0; v < n; v++) {
                if (!Objects.equals(relation[u][v], relation[p.apply(u)][p.apply(v)])) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Ordered-pair relation: {@code relation[u][v]} describes every edge between
     * {@code u} and {@code v} as seen from {@code u}, or is null when there is none.
     */
    private static String[][] relation(Graph graph) {
        int n = graph.vertexCount();
        List<List<TreeSet<String>>> parts = new ArrayList<>(n);
        for (int u = 0; u < n; u++) {
            List<TreeSet<String>> row = new ArrayList<>(n);
            for (int v = 0; v < n; v++) {
                row.add(new TreeSet<>());
            }
            parts.add(row);
        }
        for (Edge edge : graph.edges()) {
            if (edge.directed()) {
                parts.get(edge.from()).get(edge.to()).add("out:" + edge.type());
                parts.get(edge.to()).get(edge.from()).add("in:" + edge.type());
            } else {
                parts.get(edge.from()).get(edge.to()).add("both:" + edge.type());
                parts.get(edge.to()).get(edge.from()).add("both:" + edge.type());
            }
        }
        String[][] relation = new String[n][n];
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                TreeSet<String> kinds = parts.get(u).get(v);
                relation[u][v] = kinds.isEmpty() ? null : String.join(",", kinds);
            }
        }
        return relation;
    }

    private static String[] signatures(Graph graph, String[][] relation) {
        int n = graph.vertexCount();
        String[] signature = new String[n];
        for (int u = 0; u < n; u++) {
            List<String> incident = new ArrayList<>();
            for (int v = 0; v < n; v++) {
                if (relation[u][v] != null) {
                    incident.add(relation[u][v] + "@" + graph.colorOf(v));
                }
            }
            incident.sort(null);
            signature[u] = graph.colorOf(u) + "|" + String.join(";", incident);
        }
        return signature;
    }

    /**
     * Verifies that a set of permutations is a group: identity present,
     * closed under composition, closed under inversion.
     *
     * @param elements group elements
     * @throws InvariantViolationException if any axiom fails
     */
    public static void verifyGroupAxioms(Collection<Permutation> elements) {
        if (elements.isEmpty()) {
            throw new InvariantViolationException(InvariantViolationException.Check.GROUP_AXIOMS,
                "Group has no elements");
        }
        Set<Permutation> set = new HashSet<>(elements);
        int size = elements.iterator().next().size();
        if (!set.contains(Permutation.identity(size))) {
            throw new InvariantViolationException(InvariantViolationException.Check.GROUP_AXIOMS,
                "Identity is missing");
        }
        for (Permutation a : set) {
            if (!set.contains(a.inverse())) {
                throw new InvariantViolationException(InvariantViolationException.Check.GROUP_AXIOMS,
                    "Inverse of " + a + " is missing");
            }
            for (Permutation b : set) {
                if (!set.contains(a.compose(b))) {
                    throw new InvariantViolationException(InvariantViolationException.Check.GROUP_AXIOMS,
                        a + " composed with " + b + " leaves the group");
                }
            }
        }
    }
}

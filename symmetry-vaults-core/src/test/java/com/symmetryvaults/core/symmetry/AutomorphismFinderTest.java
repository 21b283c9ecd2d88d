package com.symmetryvaults.core.symmetry;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.GraphTooLargeException;
import com.symmetryvaults.core.exception.GroupTooLargeException;
import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.GraphCatalog;
import com.symmetryvaults.core.graph.Node;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AutomorphismFinder}.
 */
class AutomorphismFinderTest {

    private static GraphCatalog graphs;

    private AutomorphismFinder finder;

    @BeforeAll
    static void loadCatalog() {
        graphs = GraphCatalog.load();
    }

    @BeforeEach
    void setUp() {
        finder = new AutomorphismFinder(SearchLimits.defaults());
    }

    @ParameterizedTest
    @CsvSource({
        "cycle_3, 6",
        "cycle_5, 10",
        "directed_cycle_3, 3",
        "directed_cycle_6, 6",
        "path_4, 2",
        "complete_3, 6",
        "complete_4, 24",
        "bipartite_4, 4",
        "star_3, 6",
        "prism_4, 8",
        "wheel_5, 10",
        "hypercube_2, 8",
        "tetrahedron, 24",
        "cube, 48",
        "octahedron, 48"
    })
    void findAll_returnsFullAutomorphismGroup(String graphName, int expectedOrder) {
        Graph graph = graphs.build(graphName);

        List<Permutation> automorphisms = finder.findAll(graph);

        assertThat(automorphisms).hasSize(expectedOrder);
        assertThat(new HashSet<>(automorphisms)).hasSize(expectedOrder);
        assertThat(automorphisms).allSatisfy(p -> assertThat(AutomorphismFinder.isAutomorphism(graph, p)).isTrue());
        AutomorphismFinder.verifyGroupAxioms(automorphisms);
    }

    @Test
    void findAll_identityComesFirst() {
        List<Permutation> automorphisms = finder.findAll(graphs.build("complete_3"));

        assertThat(automorphisms.get(0)).isEqualTo(Permutation.identity(3));
    }

    @Test
    void findAll_directedCycle_findsOnlyRotations() {
        List<Permutation> automorphisms = finder.findAll(graphs.build("directed_cycle_3"));

        assertThat(automorphisms).containsExactlyInAnyOrder(
            Permutation.of(0, 1, 2), Permutation.of(1, 2, 0), Permutation.of(2, 0, 1));
    }

    @Test
    void findAll_colorsRestrictSymmetries() {
        Graph graph = new Graph(
            List.of(new Node(0, "red", "A"), new Node(1, "blue", "B"), new Node(2, "blue", "C")),
            List.of(Edge.undirected(0, 1, Edge.STANDARD), Edge.undirected(1, 2, Edge.STANDARD),
                Edge.undirected(2, 0, Edge.STANDARD)));

        assertThat(finder.findAll(graph)).containsExactlyInAnyOrder(
            Permutation.of(0, 1, 2), Permutation.of(0, 2, 1));
    }

    @Test
    void findAll_edgeTypesRestrictSymmetries() {
        Graph graph = new Graph(
            List.of(new Node(0, "blue", "A"), new Node(1, "blue", "B"), new Node(2, "blue", "C")),
            List.of(Edge.undirected(0, 1, Edge.THICK), Edge.undirected(1, 2, Edge.STANDARD),
                Edge.undirected(2, 0, Edge.STANDARD)));

        assertThat(finder.findAll(graph)).containsExactlyInAnyOrder(
            Permutation.of(0, 1, 2), Permutation.of(1, 0, 2));
    }

    @Test
    void findAll_aboveVertexCeiling_throwsBeforeSearching() {
        AutomorphismFinder small = new AutomorphismFinder(new SearchLimits(4, 48));

        assertThatThrownBy(() -> small.findAll(graphs.build("cycle_5")))
            .isInstanceOf(GraphTooLargeException.class)
            .hasMessageContaining("5 vertices");
    }

    @Test
    void findAll_aboveOrderCeiling_throwsGroupTooLarge() {
        assertThatThrownBy(() -> finder.findAll(graphs.build("complete_5"), "Aut(complete_5)"))
            .isInstanceOf(GroupTooLargeException.class)
            .hasMessageContaining("Aut(complete_5)");
    }

    @Test
    void findAll_petersenWithThickSpokes_staysUnderOrderCeiling() {
        assertThat(finder.findAll(graphs.build("petersen"))).hasSize(20);
    }

    @Test
    void isAutomorphism_rejectsEdgeBreakingPermutation() {
        Graph path = graphs.build("path_3");

        assertThat(AutomorphismFinder.isAutomorphism(path, Permutation.of(2, 1, 0))).isTrue();
        assertThat(AutomorphismFinder.isAutomorphism(path, Permutation.of(1, 0, 2))).isFalse();
    }

    @Test
    void verifyGroupAxioms_missingInverse_throwsInvariantViolation() {
        List<Permutation> notAGroup = List.of(Permutation.identity(3), Permutation.of(1, 2, 0));

        assertThatThrownBy(() -> AutomorphismFinder.verifyGroupAxioms(notAGroup))
            .isInstanceOf(InvariantViolationException.class)
            .satisfies(e -> assertThat(((InvariantViolationException) e).getCheck())
                .isEqualTo(InvariantViolationException.Check.GROUP_AXIOMS));
    }
}

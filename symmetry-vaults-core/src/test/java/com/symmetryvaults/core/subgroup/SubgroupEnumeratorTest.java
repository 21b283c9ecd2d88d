package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.graph.GraphCatalog;
import com.symmetryvaults.core.group.GroupCatalog;
import com.symmetryvaults.core.symmetry.AutomorphismFinder;
import com.symmetryvaults.core.symmetry.CayleyTable;
import com.symmetryvaults.core.symmetry.CayleyTableBuilder;
import com.symmetryvaults.core.symmetry.SearchLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SubgroupEnumerator}, {@link GeneratorFinder} and {@link SubgroupLattice}.
 */
class SubgroupEnumeratorTest {

    private SubgroupEnumerator enumerator;

    @BeforeEach
    void setUp() {
        enumerator = new SubgroupEnumerator();
    }

    @Test
    void enumerate_cyclicGroupOfPrimeOrder_findsOnlyTrivialAndWhole() {
        CayleyTable table = tableOf("Z3");

        List<Subgroup> subgroups = enumerator.enumerate(table);

        assertThat(subgroups).extracting(Subgroup::elements)
            .containsExactly(List.of(0), List.of(0, 1, 2));
    }

    @Test
    void enumerate_directedTriangle_matchesNamedCyclicGroup() {
        CayleyTable auto = new CayleyTableBuilder().build(new AutomorphismFinder(SearchLimits.defaults())
            .findAll(GraphCatalog.load().build("directed_cycle_3")));

        assertThat(auto.group().ids()).containsExactly("e", "r1", "r2");
        assertThat(enumerator.enumerate(auto)).hasSize(2);
    }

    @Test
    void enumerate_symmetricGroupOnThreePoints_findsSixSubgroups() {
        CayleyTable table = tableOf("S3");

        List<Subgroup> subgroups = enumerator.enumerate(table);

        assertThat(subgroups).extracting(Subgroup::order).containsExactly(1, 2, 2, 2, 3, 6);
        assertThat(subgroups.get(4).ids(table)).containsExactly("e", "r1", "r2");
        assertThat(subgroups.get(1).ids(table)).containsExactly("e", "s1");
    }

    @ParameterizedTest
    @CsvSource({
        "Z6, 4",
        "V4, 5",
        "D4, 10",
        "A4, 10",
        "S4, 30"
    })
    void enumerate_findsKnownSubgroupCounts(String groupName, int expectedCount) {
        assertThat(enumerator.enumerate(tableOf(groupName))).hasSize(expectedCount);
    }

    @Test
    void enumerate_everySubgroupIsClosedAndSatisfiesLagrange() {
        CayleyTable table = tableOf("D4");

        for (Subgroup subgroup : enumerator.enumerate(table)) {
            assertThat(table.order() % subgroup.order()).isZero();
            assertThat(subgroup.elements()).contains(0);
            for (int a : subgroup.elements()) {
                assertThat(subgroup.contains(table.inverse(a))).isTrue();
                for (int b : subgroup.elements()) {
                    assertThat(subgroup.contains(table.multiply(a, b))).isTrue();
                }
            }
        }
    }

    @Test
    void enumerate_generatorsRegenerateEachSubgroup() {
        CayleyTable table = tableOf("A4");

        for (Subgroup subgroup : enumerator.enumerate(table)) {
            BitSet expected = new BitSet();
            subgroup.elements().forEach(expected::set);
            assertThat(GeneratorFinder.closure(table, subgroup.generators())).isEqualTo(expected);
        }
    }

    @Test
    void findForGroup_dihedralGroupNeedsTwoGenerators() {
        assertThat(GeneratorFinder.findForGroup(tableOf("D4"))).hasSize(2);
        assertThat(GeneratorFinder.findForGroup(tableOf("Z5"))).hasSize(1);
    }

    @Test
    void coveringEdges_symmetricGroup_formsHasseDiagram() {
        List<Subgroup> subgroups = enumerator.enumerate(tableOf("S3"));

        assertThat(SubgroupLattice.coveringEdges(subgroups)).containsExactlyInAnyOrder(
            new SubgroupLattice.Edge(0, 1), new SubgroupLattice.Edge(0, 2), new SubgroupLattice.Edge(0, 3),
            new SubgroupLattice.Edge(0, 4), new SubgroupLattice.Edge(1, 5), new SubgroupLattice.Edge(2, 5),
            new SubgroupLattice.Edge(3, 5), new SubgroupLattice.Edge(4, 5));
    }

    @Test
    void names_distinguishSubgroupsOfEqualOrder() {
        CayleyTable table = tableOf("D4");
        List<String> names = SubgroupLattice.names(table, enumerator.enumerate(table));

        assertThat(names).doesNotHaveDuplicates();
        assertThat(names.get(0)).isEqualTo("Trivial");
        assertThat(names.get(names.size() - 1)).isEqualTo("Full_group");
        assertThat(names).contains("Subgroup_order_4_1", "Subgroup_order_4_2", "Subgroup_order_4_3");
    }

    @Test
    void latticeLevel_splitsByOrder() {
        assertThat(SubgroupLattice.latticeLevel(1, 8)).isZero();
        assertThat(SubgroupLattice.latticeLevel(2, 8)).isEqualTo(1);
        assertThat(SubgroupLattice.latticeLevel(4, 8)).isEqualTo(2);
        assertThat(SubgroupLattice.latticeLevel(8, 8)).isEqualTo(3);
    }

    static CayleyTable tableOf(String groupName) {
        return new CayleyTableBuilder().build(GroupCatalog.load().generate(groupName, 48));
    }
}

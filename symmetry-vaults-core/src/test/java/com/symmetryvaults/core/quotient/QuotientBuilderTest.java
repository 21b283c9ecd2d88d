package com.symmetryvaults.core.quotient;

import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.graph.GraphCatalog;
import com.symmetryvaults.core.group.GroupCatalog;
import com.symmetryvaults.core.subgroup.ClassifiedSubgroup;
import com.symmetryvaults.core.subgroup.NormalityClassifier;
import com.symmetryvaults.core.subgroup.Subgroup;
import com.symmetryvaults.core.subgroup.SubgroupEnumerator;
import com.symmetryvaults.core.symmetry.AutomorphismFinder;
import com.symmetryvaults.core.symmetry.CayleyTable;
import com.symmetryvaults.core.symmetry.CayleyTableBuilder;
import com.symmetryvaults.core.symmetry.SearchLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link QuotientBuilder}.
 */
class QuotientBuilderTest {

    private QuotientBuilder builder;
    private NormalityClassifier classifier;

    @BeforeEach
    void setUp() {
        builder = new QuotientBuilder();
        classifier = new NormalityClassifier();
    }

    @Test
    void build_directedSquareByHalfTurn_givesTwoCosets() {
        CayleyTable table = new CayleyTableBuilder().build(new AutomorphismFinder(SearchLimits.defaults())
            .findAll(GraphCatalog.load().build("directed_cycle_4")));
        Subgroup halfTurn = new Subgroup(List.of(0, 1), List.of(1));

        QuotientGroup quotient = builder.build(table, classifier.classify(table, halfTurn));

        assertThat(table.group().ids()).containsExactly("e", "r2", "r1", "r3");
        assertThat(quotient.quotientOrder()).isEqualTo(2);
        assertThat(quotient.cosets()).extracting(Coset::elements)
            .containsExactly(List.of(0, 1), List.of(2, 3));
        assertThat(quotient.representatives()).containsExactly(0, 2);
        assertThat(quotient.quotientType()).isEqualTo("Z2");
        assertThat(quotient.multiply(1, 1)).isZero();
    }

    @Test
    void build_cosetsPartitionTheGroup() {
        CayleyTable table = tableOf("D4");

        for (Subgroup subgroup : new SubgroupEnumerator().enumerate(table)) {
            ClassifiedSubgroup classified = classifier.classify(table, subgroup);
            if (!classified.normal()) {
                continue;
            }
            QuotientGroup quotient = builder.build(table, classified);

            assertThat(quotient.quotientOrder() * subgroup.order()).isEqualTo(table.order());
            assertThat(quotient.cosets().get(0).elements()).isEqualTo(subgroup.elements());
            assertThat(quotient.cosets().stream().flatMap(c -> c.elements().stream()))
                .doesNotHaveDuplicates()
                .hasSize(table.order());
        }
    }

    @Test
    void build_symmetricGroupByRotations_isCyclicOfOrderTwo() {
        CayleyTable table = tableOf("S3");
        Subgroup rotations = new SubgroupEnumerator().enumerate(table).get(4);

        QuotientGroup quotient = builder.build(table, classifier.classify(table, rotations));

        assertThat(quotient.quotientType()).isEqualTo("Z2");
        assertThat(quotient.table()).containsExactly(List.of(0, 1), List.of(1, 0));
    }

    @Test
    void build_byTrivialSubgroup_reproducesTheGroupType() {
        CayleyTable table = tableOf("D4");
        Subgroup trivial = new Subgroup(List.of(0), List.of());

        QuotientGroup quotient = builder.build(table, classifier.classify(table, trivial));

        assertThat(quotient.quotientOrder()).isEqualTo(8);
        assertThat(quotient.quotientType()).isEqualTo("D4");
    }

    @Test
    void build_nonNormalClassification_throws() {
        CayleyTable table = tableOf("S3");
        ClassifiedSubgroup reflection = classifier.classify(table, new Subgroup(List.of(0, 1), List.of(1)));

        assertThatThrownBy(() -> builder.build(table, reflection))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("normal");
    }

    @Test
    void build_nonNormalSubgroupDirectly_failsWellDefinedness() {
        CayleyTable table = tableOf("S3");

        assertThatThrownBy(() -> builder.build(table, new Subgroup(List.of(0, 1), List.of(1))))
            .isInstanceOfSatisfying(InvariantViolationException.class,
                e -> assertThat(e.getCheck()).isEqualTo(InvariantViolationException.Check.QUOTIENT_TABLE));
    }

    private static CayleyTable tableOf(String groupName) {
        return new CayleyTableBuilder().build(GroupCatalog.load().generate(groupName, 48));
    }
}

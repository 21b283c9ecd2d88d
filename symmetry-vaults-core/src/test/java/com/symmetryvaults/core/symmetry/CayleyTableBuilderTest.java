package com.symmetryvaults.core.symmetry;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.group.GroupCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CayleyTableBuilder} and {@link CayleyTable}.
 */
class CayleyTableBuilderTest {

    private CayleyTableBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new CayleyTableBuilder();
    }

    @Test
    void build_symmetricGroup_assignsCanonicalIds() {
        CayleyTable table = builder.build(GroupCatalog.load().generate("S3", 48));

        assertThat(table.group().ids()).containsExactly("e", "s1", "s2", "s3", "r1", "r2");
        assertThat(table.group().get(1).mapping()).isEqualTo(Permutation.of(0, 2, 1));
        assertThat(table.group().get(4).name()).isEqualTo("Rotation by 120°");
        assertThat(table.group().get(0).name()).isEqualTo("Identity");
    }

    @Test
    void build_productsFollowCompositionConvention() {
        CayleyTable table = builder.build(GroupCatalog.load().generate("S3", 48));

        int s1 = table.indexOf("s1");
        int s2 = table.indexOf("s2");
        assertThat(table.id(table.multiply(s1, s2))).isEqualTo("r1");
        assertThat(table.id(table.multiply(s2, s1))).isEqualTo("r2");
        assertThat(table.isAbelian()).isFalse();
    }

    @Test
    void build_identityRowAndColumnAreIdentityMaps() {
        CayleyTable table = builder.build(GroupCatalog.load().generate("D4", 48));

        for (int a = 0; a < table.order(); a++) {
            assertThat(table.multiply(0, a)).isEqualTo(a);
            assertThat(table.multiply(a, 0)).isEqualTo(a);
            assertThat(table.multiply(a, table.inverse(a))).isZero();
        }
    }

    @Test
    void build_isIndependentOfInputOrder() {
        List<Permutation> elements = new ArrayList<>(GroupCatalog.load().generate("A4", 48));
        CayleyTable first = builder.build(elements);
        Collections.shuffle(elements, new Random(42));
        CayleyTable second = builder.build(elements);

        assertThat(second.group().ids()).isEqualTo(first.group().ids());
        assertThat(second.toArray()).isDeepEqualTo(first.toArray());
        assertThat(second.toIdMap()).isEqualTo(first.toIdMap());
    }

    @Test
    void build_cyclicGroup_namesRotationsByShift() {
        CayleyTable table = builder.build(GroupCatalog.load().generate("Z4", 48));

        assertThat(table.group().ids()).containsExactly("e", "r2", "r1", "r3");
        assertThat(table.isAbelian()).isTrue();
    }

    @Test
    void toIdMap_containsEveryProduct() {
        CayleyTable table = builder.build(GroupCatalog.load().generate("Z3", 48));

        assertThat(table.toIdMap()).containsOnlyKeys("e", "r1", "r2");
        assertThat(table.toIdMap().get("r1")).containsEntry("r1", "r2").containsEntry("r2", "e");
    }

    @Test
    void build_notClosed_throwsClosedProduct() {
        List<Permutation> notClosed = List.of(Permutation.identity(3), Permutation.of(0, 2, 1),
            Permutation.of(1, 0, 2));

        assertThatThrownBy(() -> builder.build(notClosed))
            .isInstanceOf(InvariantViolationException.class)
            .satisfies(e -> assertThat(((InvariantViolationException) e).getCheck())
                .isEqualTo(InvariantViolationException.Check.CLOSED_PRODUCT));
    }

    @Test
    void build_invalidInput_throwsException() {
        assertThatThrownBy(() -> builder.build(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(List.of(Permutation.identity(2), Permutation.identity(3))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(List.of(Permutation.of(1, 0))))
            .isInstanceOf(InvariantViolationException.class);
    }
}

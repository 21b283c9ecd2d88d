package com.symmetryvaults.core.group;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.GroupTooLargeException;
import com.symmetryvaults.core.exception.InvalidSizeException;
import com.symmetryvaults.core.exception.UnknownGroupFamilyException;
import com.symmetryvaults.core.symmetry.AutomorphismFinder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GroupCatalog} and the built-in group families.
 */
class GroupCatalogTest {

    private static GroupCatalog catalog;

    @BeforeAll
    static void loadCatalog() {
        catalog = GroupCatalog.load();
    }

    @Test
    void serviceLoader_discoversAllFiveFamilies() {
        List<String> symbols = ServiceLoader.load(GroupFamily.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(GroupFamily::getSymbol)
            .toList();

        assertThat(symbols).containsExactlyInAnyOrder("Z", "D", "S", "A", "V");
    }

    @ParameterizedTest
    @CsvSource({
        "Z5, 5, 5",
        "D4, 8, 4",
        "S3, 6, 3",
        "S4, 24, 4",
        "A4, 12, 4",
        "V4, 4, 4"
    })
    void generate_producesDistinctElementsOfExpectedOrder(String name, int order, int degree) {
        List<Permutation> elements = catalog.generate(name, 48);

        assertThat(elements).hasSize(order);
        assertThat(new HashSet<>(elements)).hasSize(order);
        assertThat(elements.get(0).isIdentity()).isTrue();
        assertThat(elements).allSatisfy(p -> assertThat(p.size()).isEqualTo(degree));
        assertThat(catalog.resolve(name).order()).isEqualTo(order);
    }

    @Test
    void generate_elementsFormAGroup() {
        for (String name : List.of("Z6", "D5", "S3", "A4", "V4")) {
            AutomorphismFinder.verifyGroupAxioms(catalog.generate(name, 48));
        }
    }

    @Test
    void alternatingGroup_containsOnlyEvenPermutations() {
        assertThat(catalog.generate("A4", 48)).allSatisfy(p -> assertThat(p.sign()).isEqualTo(1));
    }

    @Test
    void resolve_lowercaseSymbol_isNormalized() {
        GroupCatalog.NamedGroup group = catalog.resolve("d6");

        assertThat(group.name()).isEqualTo("D6");
        assertThat(group.degree()).isEqualTo(6);
    }

    @Test
    void resolve_unknownSymbol_throwsException() {
        assertThatThrownBy(() -> catalog.resolve("Q8"))
            .isInstanceOf(UnknownGroupFamilyException.class);
        assertThatThrownBy(() -> catalog.resolve("dihedral"))
            .isInstanceOf(UnknownGroupFamilyException.class);
    }

    @Test
    void generate_parameterBelowMinimum_throwsInvalidSize() {
        assertThatThrownBy(() -> catalog.generate("D2", 48))
            .isInstanceOf(InvalidSizeException.class);
        assertThatThrownBy(() -> catalog.generate("V3", 48))
            .isInstanceOf(InvalidSizeException.class);
    }

    @Test
    void generate_aboveOrderCeiling_throwsBeforeBuildingElements() {
        assertThatThrownBy(() -> catalog.generate("S5", 48))
            .isInstanceOf(GroupTooLargeException.class);
    }
}

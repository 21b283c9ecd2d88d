package com.symmetryvaults.core.quotient;

import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.exception.InvariantViolationException.Check;
import com.symmetryvaults.core.subgroup.ClassifiedSubgroup;
import com.symmetryvaults.core.subgroup.Subgroup;
import com.symmetryvaults.core.symmetry.CayleyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Builds the quotient group {@code G/H} for a normal subgroup {@code H}.
 *
 * <p>Cosets are built greedily: the first element (in canonical order) not yet
 * covered becomes the representative {@code g} of the next coset
 * {@code gH = {g*h : h in H}}. The partition and the quotient table are
 * verified before the result is returned.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * QuotientGroup quotient = new QuotientBuilder().build(table, classified);
 * quotient.quotientOrder();   // |G| / |H|
 * quotient.quotientType();    // e.g. "Z2"
 * }</pre>
 */
public class QuotientBuilder {

    private static final Logger log = LoggerFactory.getLogger(QuotientBuilder.class);

    /**
     * Builds the quotient by a classified subgroup.
     *
     * @param table Cayley table of {@code G}
     * @param classified a subgroup classified as normal
     * @return the quotient group
     * @throws IllegalArgumentException if the subgroup is not normal
     * @throws InvariantViolationException if a partition or quotient-table check fails
     */
    public QuotientGroup build(CayleyTable table, ClassifiedSubgroup classified) {
        if (!classified.normal()) {
            throw new IllegalArgumentException("Quotients exist only for normal subgroups");
        }
        return build(table, classified.subgroup());
    }

    QuotientGroup build(CayleyTable table, Subgroup subgroup) {
        int n = table.order();
        int m = subgroup.order();
        if (n % m != 0) {
            throw new InvariantViolationException(Check.NON_DIVISIBLE_ORDER,
                "Subgroup order " + m + " does not divide group order " + n);
        }

        int[] cosetOf = new int[n];
        Arrays.fill(cosetOf, -1);
        List<Coset> cosets = new ArrayList<>(n / m);
        for (int g = 0; g < n; g++) {
            if (cosetOf[g] >= 0) {
                continue;
            }
            List<Integer> elements = new ArrayList<>(m);
            for (int h : subgroup.elements()) {
                int product = table.multiply(g, h);
                if (cosetOf[product] >= 0) {
                    throw new InvariantViolationException(Check.COSET_PARTITION,
                        "Element " + table.id(product) + " lies in two cosets");
                }
                cosetOf[product] = cosets.size();
                elements.add(product);
            }
            cosets.add(new Coset(elements, g));
        }
        verifyPartition(table, cosets, n, m);

        int[][] quotientTable = quotientTable(table, cosets, cosetOf);
        verifyQuotientTable(quotientTable);
        String type = QuotientTypeIdentifier.identify(quotientTable);

        log.debug("Quotient by subgroup of order {}: {} cosets, type {}", m, cosets.size(), type);
        List<List<Integer>> rows = new ArrayList<>(quotientTable.length);
        for (int[] row : quotientTable) {
            rows.add(IntStream.of(row).boxed().toList());
        }
        return new QuotientGroup(subgroup, cosets, rows, type);
    }

    private static void verifyPartition(CayleyTable table, List<Coset> cosets, int n, int m) {
        if (cosets.size() != n / m) {
            throw new InvariantViolationException(Check.COSET_PARTITION,
                "Expected " + (n / m) + " cosets, built " + cosets.size());
        }
        boolean[] covered = new boolean[n];
        for (Coset coset : cosets) {
            if (coset.size() != m) {
                throw new InvariantViolationException(Check.COSET_PARTITION,
                    "Coset of " + table.id(coset.representative()) + " has " + coset.size() + " elements");
            }
            if (!coset.contains(coset.representative())) {
                throw new InvariantViolationException(Check.COSET_PARTITION,
                    "Representative " + table.id(coset.representative()) + " is outside its coset");
            }
            for (int element : coset.elements()) {
                covered[element] = true;
            }
        }
        for (int g = 0; g < n; g++) {
            if (!covered[g]) {
                throw new InvariantViolationException(Check.COSET_PARTITION,
                    "Element " + table.id(g) + " is in no coset");
            }
        }
    }

    private static int[][] quotientTable(CayleyTable table, List<Coset> cosets, int[] cosetOf) {
        int q = cosets.size();
        int[][] result = new int[q][q];
        for (int a = 0; a < q; a++) {
            for (int b = 0; b < q; b++) {
                int expected = cosetOf[table.multiply(cosets.get(a).representative(), cosets.get(b).representative())];
                // the product must not depend on the chosen representatives
                for (int x : cosets.get(a).elements()) {
                    for (int y : cosets.get(b).elements()) {
                        if (cosetOf[table.multiply(x, y)] != expected) {
                            throw new InvariantViolationException(Check.QUOTIENT_TABLE,
                                "Coset product is not well defined for " + table.id(x) + " * " + table.id(y));
                        }
                    }
                }
                result[a][b] = expected;
            }
        }
        return result;
    }

    private static void verifyQuotientTable(int[][] quotient) {
        int q = quotient.length;
        for (int a = 0; a < q; a++) {
            if (quotient[0][a] != a || quotient[a][0] != a) {
                throw new InvariantViolationException(Check.QUOTIENT_TABLE,
                    "Coset 0 does not act as identity on coset " + a);
            }
            boolean hasInverse = false;
            for (int b = 0; b < q; b++) {
                if (quotient[a][b] == 0 && quotient[b][a] == 0) {
                    hasInverse = true;
                }
            }
            if (!hasInverse) {
                throw new InvariantViolationException(Check.QUOTIENT_TABLE, "Coset " + a + " has no inverse");
            }
        }
    }
}

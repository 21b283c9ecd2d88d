package com.symmetryvaults.core.quotient;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QuotientTypeIdentifier}.
 */
class QuotientTypeIdentifierTest {

    @Test
    void identify_singleElement_isTrivial() {
        assertThat(QuotientTypeIdentifier.identify(new int[][]{{0}})).isEqualTo("trivial");
    }

    @Test
    void identify_cyclicTable_isCyclic() {
        assertThat(QuotientTypeIdentifier.identify(cyclic(3))).isEqualTo("Z3");
        assertThat(QuotientTypeIdentifier.identify(cyclic(6))).isEqualTo("Z6");
    }

    @Test
    void identify_kleinTable_isKleinFourGroup() {
        int[][] klein = new int[4][4];
        for (int a = 0; a < 4; a++) {
            for (int b = 0; b < 4; b++) {
                klein[a][b] = a ^ b;
            }
        }

        assertThat(QuotientTypeIdentifier.identify(klein)).isEqualTo("Z2xZ2");
    }

    @Test
    void identify_elementaryAbelianOfOrderEight_isRecognized() {
        int[][] table = new int[8][8];
        for (int a = 0; a < 8; a++) {
            for (int b = 0; b < 8; b++) {
                table[a][b] = a ^ b;
            }
        }

        assertThat(QuotientTypeIdentifier.identify(table)).isEqualTo("Z2xZ2xZ2");
    }

    @Test
    void identify_unrecognizedOrder_fallsBackToOrderName() {
        // Z3 x Z3 has no element of order 9
        int[][] table = new int[9][9];
        for (int a = 0; a < 9; a++) {
            for (int b = 0; b < 9; b++) {
                table[a][b] = ((a / 3 + b / 3) % 3) * 3 + (a % 3 + b % 3) % 3;
            }
        }

        assertThat(QuotientTypeIdentifier.identify(table)).isEqualTo("order9");
    }

    @Test
    void elementOrders_cyclicGroup() {
        assertThat(QuotientTypeIdentifier.elementOrders(cyclic(4))).containsExactly(1, 4, 2, 4);
    }

    private static int[][] cyclic(int n) {
        int[][] table = new int[n][n];
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n; b++) {
                table[a][b] = (a + b) % n;
            }
        }
        return table;
    }
}

package com.symmetryvaults.core.quotient;

/**
 * Names the isomorphism class of a small group from its multiplication table.
 *
 * <p>Recognized: {@code trivial}, cyclic {@code Z<n>}, {@code Z2xZ2}, {@code S3},
 * {@code Z4xZ2}, {@code Z2xZ2xZ2}, {@code D4} and {@code Q8}. Anything else is
 * reported as {@code order<n>}. Index 0 must be the identity.
 */
public final class QuotientTypeIdentifier {

    private QuotientTypeIdentifier() {
    }

    public static String identify(int[][] table) {
        int n = table.length;
        if (n == 1) {
            return "trivial";
        }
        int[] orders = elementOrders(table);
        int maxOrder = 0;
        int involutions = 0;
        for (int order : orders) {
            maxOrder = Math.max(maxOrder, order);
            if (order == 2) {
                involutions++;
            }
        }
        if (maxOrder == n) {
            return "Z" + n;
        }
        boolean abelian = isAbelian(table);
        if (n == 4) {
            return "Z2xZ2";
        }
        if (n == 6 && !abelian) {
            return "S3";
        }
        if (n == 8) {
            if (abelian) {
                return maxOrder == 4 ? "Z4xZ2" : "Z2xZ2xZ2";
            }
            return involutions == 1 ? "Q8" : "D4";
        }
        return "order" + n;
    }

    static int[] elementOrders(int[][] table) {
        int n = table.length;
        int[] orders = new int[n];
        for (int a = 0; a < n; a++) {
            int power = a;
            int k = 1;
            while (power != 0 && k <= n) {
                power = table[power][a];
                k++;
            }
            orders[a] = k;
        }
        return orders;
    }

    static boolean isAbelian(int[][] table) {
        for (int a = 0; a < table.length; a++) {
            for (int b = a + 1; b < table.length; b++) {
                if (table[a][b] != table[b][a]) {
                    return false;
                }
            }
        }
        return true;
    }
}

package com.symmetryvaults.core.symmetry;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Multiplication table of a finite group over element indices.
 *
 * <p>Row and column order follow the group's canonical order, index 0 is the
 * identity, and {@code multiply(a, b)} is the index of
 * {@code element(a).compose(element(b))}. Instances are immutable.
 */
public final class CayleyTable {

    private final AutomorphismGroup group;
    private final int[][] table;
    private final int[] inverses;
    private final Map<String, Integer> indexById;

    CayleyTable(AutomorphismGroup group, int[][] table) {
        this.group = Objects.requireNonNull(group, "group must not be null");
        int n = group.order();
        this.table = new int[n][];
        for (int a = 0; a < n; a++) {
            this.table[a] = table[a].clone();
        }
        this.inverses = new int[n];
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n; b++) {
                if (table[a][b] == 0) {
                    inverses[a] = b;
                    break;
                }
            }
        }
        this.indexById = new HashMap<>();
        List<String> ids = group.ids();
        for (int i = 0; i < ids.size(); i++) {
            indexById.put(ids.get(i), i);
        }
    }

    public AutomorphismGroup group() {
        return group;
    }

    public int order() {
        return table.length;
    }

    public int identityIndex() {
        return 0;
    }

    public int multiply(int a, int b) {
        return table[a][b];
    }

    public int inverse(int a) {
        return inverses[a];
    }

    public String id(int index) {
        return group.get(index).id();
    }

    /**
     * Index of an element id.
     *
     * @param id element id
     * @return index, or {@code -1} for unknown ids
     */
    public int indexOf(String id) {
        Integer index = indexById.get(id);
        return index == null ? -1 : index;
    }

    /**
     * Copy of the table as indices.
     *
     * @return {@code n x n} array
     */
    public int[][] toArray() {
        int[][] copy = new int[table.length][];
        for (int a = 0; a < table.length; a++) {
            copy[a] = table[a].clone();
        }
        return copy;
    }

    /**
     * Table keyed by ids, row then column, in canonical order.
     *
     * @return {@code row -> (column -> product)}
     */
    public Map<String, Map<String, String>> toIdMap() {
        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        for (int a = 0; a < table.length; a++) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int b = 0; b < table.length; b++) {
                row.put(id(b), id(table[a][b]));
            }
            rows.put(id(a), row);
        }
        return rows;
    }

    /**
     * Whether the group is abelian.
     *
     * @return true if {@code ab == ba} for all elements
     */
    public boolean isAbelian() {
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

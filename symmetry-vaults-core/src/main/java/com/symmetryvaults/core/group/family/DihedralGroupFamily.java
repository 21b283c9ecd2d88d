package com.symmetryvaults.core.group.family;

import com.symmetryvaults.core.algebra.Permutation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Dihedral group {@code D_n} of order {@code 2n}: the symmetries of a regular n-gon.
 *
 * <p>Rotations come first, then the reflections {@code i -> (n - i + k) mod n}.
 */
public class DihedralGroupFamily extends AbstractGroupFamily {

    @Override
    public String getSymbol() {
        return "D";
    }

    @Override
    public String getDisplayName() {
        return "dihedral";
    }

    @Override
    public List<Integer> getListedParameters() {
        return IntStream.rangeClosed(3, 8).boxed().toList();
    }

    @Override
    protected int minParameter() {
        return 3;
    }

    @Override
    protected long doOrder(int n) {
        return 2L * n;
    }

    @Override
    protected List<Permutation> doElements(int n) {
        List<Permutation> elements = new ArrayList<>(2 * n);
        for (int k = 0; k < n; k++) {
            elements.add(shift(n, k));
        }
        for (int k = 0; k < n; k++) {
            int[] mapping = new int[n];
            for (int i = 0; i < n; i++) {
                mapping[i] = (n - i + k) % n;
            }
            elements.add(Permutation.of(mapping));
        }
        return elements;
    }
}

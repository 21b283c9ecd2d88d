package com.symmetryvaults.core.group.family;

import com.symmetryvaults.core.algebra.Permutation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Cyclic group {@code Z_n} as the rotations {@code i -> i + k mod n}.
 */
public class CyclicGroupFamily extends AbstractGroupFamily {

    @Override
    public String getSymbol() {
        return "Z";
    }

    @Override
    public String getDisplayName() {
        return "cyclic";
    }

    @Override
    public List<Integer> getListedParameters() {
        return IntStream.rangeClosed(2, 12).boxed().toList();
    }

    @Override
    protected int minParameter() {
        return 2;
    }

    @Override
    protected long doOrder(int n) {
        return n;
    }

    @Override
    protected List<Permutation> doElements(int n) {
        List<Permutation> elements = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            elements.add(shift(n, k));
        }
        return elements;
    }
}

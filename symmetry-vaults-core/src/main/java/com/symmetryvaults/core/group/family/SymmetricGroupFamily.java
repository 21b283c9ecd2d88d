package com.symmetryvaults.core.group.family;

import com.symmetryvaults.core.algebra.Permutation;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Symmetric group {@code S_n}: every permutation of n points.
 */
public class SymmetricGroupFamily extends AbstractGroupFamily {

    @Override
    public String getSymbol() {
        return "S";
    }

    @Override
    public String getDisplayName() {
        return "symmetric";
    }

    @Override
    public List<Integer> getListedParameters() {
        return IntStream.rangeClosed(2, 6).boxed().toList();
    }

    @Override
    protected int minParameter() {
        return 2;
    }

    @Override
    protected long doOrder(int n) {
        return factorial(n);
    }

    @Override
    protected List<Permutation> doElements(int n) {
        return allPermutations(n);
    }
}

package com.symmetryvaults.core.group.family;

import com.symmetryvaults.core.algebra.Permutation;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Alternating group {@code A_n}: the even permutations of n points.
 */
public class AlternatingGroupFamily extends AbstractGroupFamily {

    @Override
    public String getSymbol() {
        return "A";
    }

    @Override
    public String getDisplayName() {
        return "alternating";
    }

    @Override
    public List<Integer> getListedParameters() {
        return IntStream.rangeClosed(3, 6).boxed().toList();
    }

    @Override
    protected int minParameter() {
        return 3;
    }

    @Override
    protected long doOrder(int n) {
        return factorial(n) / 2;
    }

    @Override
    protected List<Permutation> doElements(int n) {
        return allPermutations(n).stream()
            .filter(p -> p.sign() == 1)
            .toList();
    }
}

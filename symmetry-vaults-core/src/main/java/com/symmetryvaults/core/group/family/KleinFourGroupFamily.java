package com.symmetryvaults.core.group.family;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.InvalidSizeException;

import java.util.List;

/**
 * Klein four-group {@code V4 = Z2 x Z2} acting on 4 points by double transpositions.
 */
public class KleinFourGroupFamily extends AbstractGroupFamily {

    @Override
    public String getSymbol() {
        return "V";
    }

    @Override
    public String getDisplayName() {
        return "klein_four";
    }

    @Override
    public List<Integer> getListedParameters() {
        return List.of(4);
    }

    @Override
    protected int minParameter() {
        return 4;
    }

    @Override
    protected void checkParameter(int parameter) {
        if (parameter != 4) {
            throw new InvalidSizeException(getSymbol(), parameter, "only V4 exists");
        }
    }

    @Override
    protected long doOrder(int parameter) {
        return 4;
    }

    @Override
    protected List<Permutation> doElements(int parameter) {
        return List.of(
            Permutation.of(0, 1, 2, 3),
            Permutation.of(1, 0, 3, 2),
            Permutation.of(2, 3, 0, 1),
            Permutation.of(3, 2, 1, 0)
        );
    }
}

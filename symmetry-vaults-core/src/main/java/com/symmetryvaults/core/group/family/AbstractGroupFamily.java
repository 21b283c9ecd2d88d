package com.symmetryvaults.core.group.family;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.InvalidSizeException;
import com.symmetryvaults.core.group.GroupFamily;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for group families with a lower bound on the parameter.
 */
public abstract class AbstractGroupFamily implements GroupFamily {

    /**
     * Smallest accepted parameter.
     *
     * @return minimum parameter
     */
    protected abstract int minParameter();

    /**
     * Builds the elements for an already validated parameter.
     *
     * @param parameter family parameter
     * @return elements, identity first
     */
    protected abstract List<Permutation> doElements(int parameter);

    /**
     * Order for an already validated parameter.
     *
     * @param parameter family parameter
     * @return group order
     */
    protected abstract long doOrder(int parameter);

    @Override
    public final long order(int parameter) {
        checkParameter(parameter);
        return doOrder(parameter);
    }

    @Override
    public final List<Permutation> elements(int parameter) {
        checkParameter(parameter);
        return List.copyOf(doElements(parameter));
    }

    @Override
    public int degree(int parameter) {
        return parameter;
    }

    protected void checkParameter(int parameter) {
        if (parameter < minParameter()) {
            throw new InvalidSizeException(getSymbol(), parameter, "minimum is " + minParameter());
        }
    }

    protected static long factorial(int n) {
        long result = 1;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }

    /**
     * Every permutation of {@code 0..n-1} in lexicographic order, identity first.
     */
    protected static List<Permutation> allPermutations(int n) {
        List<Permutation> result = new ArrayList<>();
        int[] current = new int[n];
        for (int i = 0; i < n; i++) {
            current[i] = i;
        }
        do {
            result.add(Permutation.of(current));
        } while (nextPermutation(current));
        return result;
    }

    private static boolean nextPermutation(int[] a) {
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        int j = a.length - 1;
        while (a[j] <= a[i]) {
            j--;
        }
        swap(a, i, j);
        for (int lo = i + 1, hi = a.length - 1; lo < hi; lo++, hi--) {
            swap(a, lo, hi);
        }
        return true;
    }

    private static void swap(int[] a, int i, int j) {
        int tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }

    protected static Permutation shift(int n, int k) {
        int[] mapping = new int[n];
        for (int i = 0; i < n; i++) {
            mapping[i] = (i + k) % n;
        }
        return Permutation.of(mapping);
    }
}

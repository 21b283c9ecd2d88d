package com.symmetryvaults.core.algebra;

import com.symmetryvaults.core.exception.InvariantViolationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable bijection on {@code {0..n-1}}.
 *
 * <p>{@code mapping[i]} is the image of {@code i}. Composition applies this
 * permutation first and the argument second:
 * <pre>{@code
 * p.compose(q).apply(i) == q.apply(p.apply(i))
 * }</pre>
 * The same convention is used by the Cayley table, conjugation witnesses,
 * coset construction and the level validator.
 */
public final class Permutation implements Comparable<Permutation> {

    /**
     * Upper bound for {@link #order()}; only malformed data can reach it.
     */
    public static final int ORDER_SAFETY_CAP = 1000;

    private final int[] mapping;

    private Permutation(int[] mapping) {
        this.mapping = mapping;
    }

    /**
     * Creates a permutation from an image array.
     *
     * @param mapping images of {@code 0..n-1}
     * @return the permutation
     * @throws IllegalArgumentException if the array is empty or not a bijection
     */
    public static Permutation of(int... mapping) {
        if (mapping == null || mapping.length == 0) {
            throw new IllegalArgumentException("mapping must not be empty");
        }
        boolean[] seen = new boolean[mapping.length];
        for (int image : mapping) {
            if (image < 0 || image >= mapping.length || seen[image]) {
                throw new IllegalArgumentException("Not a bijection on 0.." + (mapping.length - 1)
                    + ": " + Arrays.toString(mapping));
            }
            seen[image] = true;
        }
        return new Permutation(mapping.clone());
    }

    /**
     * Creates a permutation from a list of images.
     *
     * @param mapping images of {@code 0..n-1}
     * @return the permutation
     * @throws IllegalArgumentException if the list is not a bijection
     */
    public static Permutation of(List<Integer> mapping) {
        if (mapping == null) {
            throw new IllegalArgumentException("mapping must not be null");
        }
        int[] array = new int[mapping.size()];
        for (int i = 0; i < array.length; i++) {
            Integer image = mapping.get(i);
            if (image == null) {
                throw new IllegalArgumentException("mapping contains null at position " + i);
            }
            array[i] = image;
        }
        return of(array);
    }

    /**
     * Checks whether the given images form a bijection, without throwing.
     *
     * @param mapping candidate images
     * @return true if {@link #of(List)} would accept it
     */
    public static boolean isBijection(List<Integer> mapping) {
        if (mapping == null || mapping.isEmpty()) {
            return false;
        }
        boolean[] seen = new boolean[mapping.size()];
        for (Integer image : mapping) {
            if (image == null || image < 0 || image >= mapping.size() || seen[image]) {
                return false;
            }
            seen[image] = true;
        }
        return true;
    }

    public static Permutation identity(int n) {
        int[] mapping = new int[n];
        for (int i = 0; i < n; i++) {
            mapping[i] = i;
        }
        return of(mapping);
    }

    public int size() {
        return mapping.length;
    }

    public int apply(int i) {
        return mapping[i];
    }

    /**
     * Returns a copy of the image array.
     *
     * @return images of {@code 0..n-1}
     */
    public int[] toArray() {
        return mapping.clone();
    }

    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(mapping.length);
        for (int image : mapping) {
            list.add(image);
        }
        return List.copyOf(list);
    }

    /**
     * Applies this permutation, then {@code other}.
     *
     * @param other permutation applied second
     * @return permutation with {@code result[i] = other[this[i]]}
     * @throws IllegalArgumentException if sizes differ
     */
    public Permutation compose(Permutation other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("Cannot compose permutations of size " + size()
                + " and " + other.size());
        }
        int[] result = new int[mapping.length];
        for (int i = 0; i < mapping.length; i++) {
            result[i] = other.mapping[mapping[i]];
        }
        return new Permutation(result);
    }

    public Permutation inverse() {
        int[] result = new int[mapping.length];
        for (int i = 0; i < mapping.length; i++) {
            result[mapping[i]] = i;
        }
        return new Permutation(result);
    }

    public boolean isIdentity() {
        for (int i = 0; i < mapping.length; i++) {
            if (mapping[i] != i) {
                return false;
            }
        }
        return true;
    }

    /**
     * Smallest positive {@code k} with {@code p^k == identity}.
     *
     * @return the element order
     * @throws InvariantViolationException if no such {@code k} exists below {@link #ORDER_SAFETY_CAP}
     */
    public int order() {
        Permutation current = this;
        for (int k = 1; k <= ORDER_SAFETY_CAP; k++) {
            if (current.isIdentity()) {
                return k;
            }
            current = current.compose(this);
        }
        throw new InvariantViolationException(InvariantViolationException.Check.PERMUTATION_ORDER,
            "No finite order found within " + ORDER_SAFETY_CAP + " steps for " + this);
    }

    /**
     * Parity of the permutation.
     *
     * @return {@code +1} for even, {@code -1} for odd permutations
     */
    public int sign() {
        boolean[] visited = new boolean[mapping.length];
        int sign = 1;
        for (int i = 0; i < mapping.length; i++) {
            if (visited[i]) {
                continue;
            }
            int length = 0;
            int j = i;
            while (!visited[j]) {
                visited[j] = true;
                j = mapping[j];
                length++;
            }
            if (length % 2 == 0) {
                sign = -sign;
            }
        }
        return sign;
    }

    /**
     * Cycle notation without fixed points, e.g. {@code (0 1 2)(3 4)}; {@code ()} for the identity.
     *
     * @return cycle notation string
     */
    public String toCycleNotation() {
        boolean[] visited = new boolean[mapping.length];
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mapping.length; i++) {
            if (visited[i] || mapping[i] == i) {
                visited[i] = true;
                continue;
            }
            sb.append('(');
            int j = i;
            boolean first = true;
            while (!visited[j]) {
                visited[j] = true;
                if (!first) {
                    sb.append(' ');
                }
                sb.append(j);
                first = false;
                j = mapping[j];
            }
            sb.append(')');
        }
        return sb.length() == 0 ? "()" : sb.toString();
    }

    /**
     * Whether this permutation is a cyclic shift {@code i -> (i + k) mod n} of the whole set.
     *
     * @return true for rotations, including the identity
     */
    public boolean isRotation() {
        int offset = mapping[0];
        for (int i = 0; i < mapping.length; i++) {
            if (mapping[i] != (i + offset) % mapping.length) {
                return false;
            }
        }
        return true;
    }

    /**
     * Shift amount of a rotation.
     *
     * @return {@code k} such that {@code i -> (i + k) mod n}
     * @throws IllegalStateException if this is not a rotation
     */
    public int rotationAmount() {
        if (!isRotation()) {
            throw new IllegalStateException(this + " is not a rotation");
        }
        return mapping[0];
    }

    @Override
    public int compareTo(Permutation other) {
        return Arrays.compare(mapping, other.mapping);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Permutation)) {
            return false;
        }
        return Arrays.equals(mapping, ((Permutation) o).mapping);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(mapping);
    }

    @Override
    public String toString() {
        return "Perm" + Arrays.toString(mapping);
    }
}

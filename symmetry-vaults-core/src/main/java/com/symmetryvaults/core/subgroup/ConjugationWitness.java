package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.symmetry.CayleyTable;

import java.util.Objects;

/**
 * Proof that a subgroup is not normal: {@code h} is in the subgroup but
 * {@code g h g^-1 = result} is not.
 *
 * <p>Conjugation is computed as {@code compose(compose(g, h), gInv)} through
 * the Cayley table. Instances are created only by {@link NormalityClassifier},
 * so every index refers to an element of the table they were computed from.
 */
public final class ConjugationWitness {

    private final int g;
    private final int h;
    private final int gInv;
    private final int result;

    private ConjugationWitness(int g, int h, int gInv, int result) {
        this.g = g;
        this.h = h;
        this.gInv = gInv;
        this.result = result;
    }

    static ConjugationWitness compute(CayleyTable table, int g, int h) {
        if (g < 0 || g >= table.order() || h < 0 || h >= table.order()) {
            throw new IllegalArgumentException("Element index out of range: g=" + g + ", h=" + h);
        }
        int gInv = table.inverse(g);
        return new ConjugationWitness(g, h, gInv, table.multiply(table.multiply(g, h), gInv));
    }

    public int g() {
        return g;
    }

    public int h() {
        return h;
    }

    public int gInv() {
        return gInv;
    }

    public int result() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConjugationWitness)) {
            return false;
        }
        ConjugationWitness other = (ConjugationWitness) o;
        return g == other.g && h == other.h && gInv == other.gInv && result == other.result;
    }

    @Override
    public int hashCode() {
        return Objects.hash(g, h, gInv, result);
    }

    @Override
    public String toString() {
        return "ConjugationWitness[g=" + g + ", h=" + h + ", gInv=" + gInv + ", result=" + result + "]";
    }
}

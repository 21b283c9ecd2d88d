package com.symmetryvaults.core.subgroup;

import java.util.Objects;

/**
 * A subgroup with its normality verdict.
 *
 * @param subgroup the subgroup
 * @param normal whether {@code gHg^-1 = H} for every {@code g}
 * @param witness conjugation witness; present iff the subgroup is not normal
 */
public record ClassifiedSubgroup(
    Subgroup subgroup,
    boolean normal,
    ConjugationWitness witness
) {
    /**
     * Compact constructor with validation.
     */
    public ClassifiedSubgroup {
        Objects.requireNonNull(subgroup, "subgroup must not be null");
        if (normal == (witness != null)) {
            throw new IllegalArgumentException(normal
                ? "A normal subgroup cannot have a conjugation witness"
                : "A non-normal subgroup needs a conjugation witness");
        }
    }
}

package com.symmetryvaults.core.subgroup;

import com.symmetryvaults.core.exception.InvariantViolationException;
import com.symmetryvaults.core.exception.InvariantViolationException.Check;
import com.symmetryvaults.core.symmetry.CayleyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.List;

/**
 * Decides normality of subgroups and produces a conjugation witness for
 * each non-normal one.
 *
 * <p>For every {@code g} of the group and every {@code h} of the subgroup, both
 * in canonical order, {@code g h g^-1} is looked up in the Cayley table. The
 * first conjugate outside the subgroup becomes the witness.
 */
public class NormalityClassifier {

    private static final Logger log = LoggerFactory.getLogger(NormalityClassifier.class);

    /**
     * Classifies a single subgroup.
     *
     * @param table Cayley table of the parent group
     * @param subgroup subgroup to classify
     * @return the verdict, with a witness if the subgroup is not normal
     * @throws InvariantViolationException if a witness fails its own preconditions
     */
    public ClassifiedSubgroup classify(CayleyTable table, Subgroup subgroup) {
        BitSet members = members(subgroup);
        for (int g = 0; g < table.order(); g++) {
            for (int h : subgroup.elements()) {
                ConjugationWitness witness = ConjugationWitness.compute(table, g, h);
                if (!members.get(witness.result())) {
                    checkWitness(table, members, witness);
                    log.debug("Subgroup of order {} is not normal: {} * {} * {} = {}",
                        subgroup.order(), table.id(g), table.id(h), table.id(witness.gInv()),
                        table.id(witness.result()));
                    return new ClassifiedSubgroup(subgroup, false, witness);
                }
            }
        }
        return new ClassifiedSubgroup(subgroup, true, null);
    }

    public List<ClassifiedSubgroup> classifyAll(CayleyTable table, List<Subgroup> subgroups) {
        return subgroups.stream().map(s -> classify(table, s)).toList();
    }

    /**
     * Normality by set equality {@code gHg^-1 == H} for every {@code g}.
     *
     * @param table Cayley table of the parent group
     * @param subgroup subgroup to test
     * @return true if the subgroup is normal
     */
    public static boolean isNormal(CayleyTable table, Subgroup subgroup) {
        BitSet members = members(subgroup);
        for (int g = 0; g < table.order(); g++) {
            BitSet conjugate = new BitSet(table.order());
            int gInv = table.inverse(g);
            for (int h : subgroup.elements()) {
                conjugate.set(table.multiply(table.multiply(g, h), gInv));
            }
            if (!conjugate.equals(members)) {
                return false;
            }
        }
        return true;
    }

    private static void checkWitness(CayleyTable table, BitSet members, ConjugationWitness witness) {
        if (!members.get(witness.h())) {
            throw new InvariantViolationException(Check.WITNESS_H_NOT_IN_SUBGROUP,
                "Witness element h=" + table.id(witness.h()) + " is not in the subgroup");
        }
        if (members.get(witness.result())) {
            throw new InvariantViolationException(Check.WITNESS_RESULT_IN_SUBGROUP,
                "Witness result " + table.id(witness.result()) + " is inside the subgroup");
        }
    }

    private static BitSet members(Subgroup subgroup) {
        BitSet members = new BitSet();
        subgroup.elements().forEach(members::set);
        return members;
    }
}

package com.symmetryvaults.core.exception;

/**
 * Signals that a theorem which must hold for a genuine group did not hold.
 *
 * <p>These errors indicate a defect in the engine, not bad input. They abort
 * generation of the affected level and are never patched over.
 */
public class InvariantViolationException extends IllegalStateException {

    /**
     * Internal checks whose failure is fatal.
     */
    public enum Check {
        GROUP_AXIOMS,
        CLOSED_PRODUCT,
        LATIN_SQUARE,
        PERMUTATION_ORDER,
        WITNESS_H_NOT_IN_SUBGROUP,
        WITNESS_RESULT_IN_SUBGROUP,
        NON_DIVISIBLE_ORDER,
        COSET_PARTITION,
        QUOTIENT_TABLE
    }

    private final Check check;

    public InvariantViolationException(Check check, String message) {
        super("[" + check + "] " + message);
        this.check = check;
    }

    public Check getCheck() {
        return check;
    }
}

package com.symmetryvaults.core.validation;

/**
 * One group of checks over a level document.
 *
 * <p>Checks report every discrepancy through the {@link ValidationContext}
 * and never throw for bad document data. Implementations are discovered via
 * {@link java.util.ServiceLoader} and run by ascending priority; later checks
 * may rely on what earlier ones stored in the context.
 */
public interface LevelCheck {

    /**
     * Document section this check reports on.
     *
     * @return section name
     */
    String section();

    /**
     * Execution priority (lower = earlier execution).
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Runs the check.
     *
     * @param context shared validation state
     */
    void check(ValidationContext context);
}

package com.symmetryvaults.core.validation;

import java.util.Objects;

/**
 * One discrepancy between a stored level document and the recomputed truth.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationIssue issue = ValidationIssue.error(
 *     "act1_level05", "layer_4", 2, "witness_h_in_subgroup",
 *     "h in [e, s1]", "h = r1");
 * }</pre>
 *
 * @param levelId id of the level the issue belongs to
 * @param section document section, e.g. {@code graph} or {@code layer_4}
 * @param subgroupIndex index of the offending subgroup within its layer, or null
 * @param check name of the failed check
 * @param expected expected value
 * @param actual value found in the document
 * @param severity severity of the issue
 */
public record ValidationIssue(
    String levelId,
    String section,
    Integer subgroupIndex,
    String check,
    String expected,
    String actual,
    IssueSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationIssue {
        Objects.requireNonNull(levelId, "levelId must not be null");
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(check, "check must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static ValidationIssue error(String levelId, String section, Integer subgroupIndex,
                                        String check, String expected, String actual) {
        return new ValidationIssue(levelId, section, subgroupIndex, check, expected, actual, IssueSeverity.ERROR);
    }

    public static ValidationIssue warning(String levelId, String section, Integer subgroupIndex,
                                          String check, String expected, String actual) {
        return new ValidationIssue(levelId, section, subgroupIndex, check, expected, actual, IssueSeverity.WARNING);
    }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    /**
     * Single-line description for console output.
     *
     * @return e.g. {@code [ERROR] act1_level05 layer_4[2] witness_h_in_subgroup: expected ..., actual ...}
     */
    public String describe() {
        String location = subgroupIndex == null ? section : section + "[" + subgroupIndex + "]";
        return "[" + severity + "] " + levelId + " " + location + " " + check
            + ": expected " + expected + ", actual " + actual;
    }
}

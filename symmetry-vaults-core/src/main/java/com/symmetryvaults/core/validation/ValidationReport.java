package com.symmetryvaults.core.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating one or more level documents.
 *
 * @param issues every issue found, in check order
 * @param documentCount number of documents (or files) examined
 */
public record ValidationReport(
    List<ValidationIssue> issues,
    int documentCount
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(issues, "issues must not be null");
        issues = List.copyOf(issues);
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of(), 0);
    }

    public long errorCount() {
        return issues.stream().filter(ValidationIssue::isError).count();
    }

    public long warningCount() {
        return issues.size() - errorCount();
    }

    /**
     * A run passes iff it produced no ERROR issues.
     *
     * @return true if there are no errors
     */
    public boolean passed() {
        return errorCount() == 0;
    }

    public ValidationReport merge(ValidationReport other) {
        List<ValidationIssue> merged = new ArrayList<>(issues);
        merged.addAll(other.issues());
        return new ValidationReport(merged, documentCount + other.documentCount());
    }

    public String summary() {
        return documentCount + " document(s), " + errorCount() + " error(s), " + warningCount() + " warning(s)";
    }
}

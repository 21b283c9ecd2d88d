package com.symmetryvaults.core.validation;

/**
 * Severity of a validation issue. Only {@link #ERROR} fails a validation run.
 */
public enum IssueSeverity {
    WARNING,
    ERROR
}

package com.symmetryvaults.core.exception;

/**
 * Thrown when a graph family identifier is not in the catalog.
 */
public class UnknownGraphFamilyException extends LevelSpecificationException {

    private final String familyId;

    public UnknownGraphFamilyException(String familyId) {
        super("Unknown graph family: '" + familyId + "'. Use 'list graphs' to see available graphs.");
        this.familyId = familyId;
    }

    public String getFamilyId() {
        return familyId;
    }
}

package com.symmetryvaults.core.exception;

/**
 * Thrown when a graph or group family exists but the requested size violates
 * its constraints, such as a minimum size or an even split.
 */
public class InvalidSizeException extends LevelSpecificationException {

    private final String familyId;
    private final int size;

    public InvalidSizeException(String familyId, int size, String reason) {
        super("Invalid size " + size + " for '" + familyId + "': " + reason);
        this.familyId = familyId;
        this.size = size;
    }

    public String getFamilyId() {
        return familyId;
    }

    public int getSize() {
        return size;
    }
}

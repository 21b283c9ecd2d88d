package com.symmetryvaults.core.exception;

/**
 * Thrown when a group name cannot be resolved against the group catalog.
 */
public class UnknownGroupFamilyException extends LevelSpecificationException {

    private final String groupName;

    public UnknownGroupFamilyException(String groupName) {
        super("Unknown group: '" + groupName + "'. Use 'list groups' to see available groups.");
        this.groupName = groupName;
    }

    public String getGroupName() {
        return groupName;
    }
}

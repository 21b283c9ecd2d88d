package com.symmetryvaults.core.exception;

/**
 * Thrown when a group exceeds the configured order ceiling, either while
 * automorphisms are still being discovered or when a named group is requested.
 */
public class GroupTooLargeException extends LevelSpecificationException {

    private final int maxGroupOrder;

    public GroupTooLargeException(String groupName, int maxGroupOrder) {
        super("Group " + groupName + " has more than " + maxGroupOrder + " elements, above the configured ceiling.");
        this.maxGroupOrder = maxGroupOrder;
    }

    public int getMaxGroupOrder() {
        return maxGroupOrder;
    }
}

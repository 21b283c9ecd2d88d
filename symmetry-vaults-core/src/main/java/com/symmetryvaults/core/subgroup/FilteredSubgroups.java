package com.symmetryvaults.core.subgroup;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the pedagogical subgroup filter.
 *
 * @param subgroups selected subgroups, in enumeration order
 * @param filtered whether anything was dropped
 * @param fullSubgroupCount number of subgroups before filtering
 * @param filterStrategy name of the selection strategy
 * @param targetCount number of subgroups the strategy keeps at most
 */
public record FilteredSubgroups(
    List<Subgroup> subgroups,
    boolean filtered,
    int fullSubgroupCount,
    String filterStrategy,
    int targetCount
) {
    /**
     * Compact constructor with validation.
     */
    public FilteredSubgroups {
        Objects.requireNonNull(subgroups, "subgroups must not be null");
        Objects.requireNonNull(filterStrategy, "filterStrategy must not be null");
        subgroups = List.copyOf(subgroups);
        if (fullSubgroupCount < subgroups.size()) {
            throw new IllegalArgumentException("fullSubgroupCount " + fullSubgroupCount
                + " is below the selected count " + subgroups.size());
        }
    }
}

package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Layer 3: the subgroups the player collects, possibly filtered.
 *
 * @param subgroupCount number of listed subgroups
 * @param subgroups listed subgroups
 * @param filtered whether the list is a filtered selection
 * @param fullSubgroupCount number of subgroups before filtering; written only when filtered
 * @param filterStrategy selection strategy; written only when filtered
 * @param targetCount selection size; written only when filtered
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyringLayer(
    @JsonProperty("subgroup_count") Integer subgroupCount,
    @JsonProperty("subgroups") List<SubgroupEntry> subgroups,
    @JsonProperty("filtered") Boolean filtered,
    @JsonProperty("full_subgroup_count") Integer fullSubgroupCount,
    @JsonProperty("filter_strategy") String filterStrategy,
    @JsonProperty("target_count") Integer targetCount
) {
    public boolean filteredSelection() {
        return Boolean.TRUE.equals(filtered);
    }

    /**
     * Persisted subgroup.
     *
     * @param name display name
     * @param order subgroup order
     * @param elements element ids
     * @param generators generator ids
     * @param isNormal normality flag
     * @param isTrivial whether this is the trivial subgroup
     * @param latticeLevel coarse lattice height
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubgroupEntry(
        @JsonProperty("name") String name,
        @JsonProperty("order") Integer order,
        @JsonProperty("elements") List<String> elements,
        @JsonProperty("generators") List<String> generators,
        @JsonProperty("is_normal") Boolean isNormal,
        @JsonProperty("is_trivial") Boolean isTrivial,
        @JsonProperty("lattice_level") Integer latticeLevel
    ) {}
}

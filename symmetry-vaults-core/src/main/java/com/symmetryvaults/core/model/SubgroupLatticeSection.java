package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Hasse diagram of the layer 3 subgroups.
 *
 * @param edges covering edges by layer 3 subgroup index
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubgroupLatticeSection(
    @JsonProperty("edges") List<LatticeEdgeEntry> edges
) {
    /**
     * Covering edge from a maximal subgroup to its cover.
     *
     * @param from index of the smaller subgroup
     * @param to index of the larger subgroup
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LatticeEdgeEntry(
        @JsonProperty("from") Integer from,
        @JsonProperty("to") Integer to
    ) {}
}

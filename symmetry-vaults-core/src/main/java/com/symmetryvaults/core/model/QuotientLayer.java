package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Layer 5: quotient groups of the proper non-trivial normal subgroups.
 *
 * @param quotientGroups one entry per normal subgroup
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuotientLayer(
    @JsonProperty("quotient_groups") List<QuotientEntry> quotientGroups
) {
    /**
     * Persisted quotient group.
     *
     * @param normalSubgroupElements element ids of the normal subgroup
     * @param quotientOrder number of cosets
     * @param quotientType isomorphism class name
     * @param cosets the cosets
     * @param cosetRepresentatives representative of each coset, in coset order
     * @param quotientTable {@code rep -> (rep -> rep)} multiplication of cosets
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QuotientEntry(
        @JsonProperty("normal_subgroup_elements") List<String> normalSubgroupElements,
        @JsonProperty("quotient_order") Integer quotientOrder,
        @JsonProperty("quotient_type") String quotientType,
        @JsonProperty("cosets") List<CosetEntry> cosets,
        @JsonProperty("coset_representatives") List<String> cosetRepresentatives,
        @JsonProperty("quotient_table") Map<String, Map<String, String>> quotientTable
    ) {}

    /**
     * Persisted coset.
     *
     * @param elements element ids
     * @param representative representative id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CosetEntry(
        @JsonProperty("elements") List<String> elements,
        @JsonProperty("representative") String representative
    ) {}
}

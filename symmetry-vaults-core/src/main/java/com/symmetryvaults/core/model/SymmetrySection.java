package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Persisted group: elements, generators and, for small groups, the Cayley table.
 *
 * @param automorphisms group elements in canonical order
 * @param generators ids of a generating set
 * @param cayleyTable {@code row -> (column -> product)} by id; absent above the configured order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymmetrySection(
    @JsonProperty("automorphisms") List<AutomorphismEntry> automorphisms,
    @JsonProperty("generators") List<String> generators,
    @JsonProperty("cayley_table") Map<String, Map<String, String>> cayleyTable
) {
    /**
     * Persisted group element.
     *
     * @param id element id
     * @param mapping images of {@code 0..n-1}
     * @param name display name
     * @param description short description
     * @param cycleNotation cycle notation
     * @param order element order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AutomorphismEntry(
        @JsonProperty("id") String id,
        @JsonProperty("mapping") List<Integer> mapping,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("cycle_notation") String cycleNotation,
        @JsonProperty("order") Integer order
    ) {}
}

package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Layer 4: normal / non-normal classification of the proper non-trivial subgroups.
 *
 * @param classifyCount number of classified subgroups
 * @param normalCount number of normal ones
 * @param crackedCount number of non-normal ones
 * @param subgroups classified subgroups
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConjugationLayer(
    @JsonProperty("classify_count") Integer classifyCount,
    @JsonProperty("normal_count") Integer normalCount,
    @JsonProperty("cracked_count") Integer crackedCount,
    @JsonProperty("subgroups") List<ClassifyEntry> subgroups
) {
    /**
     * Persisted classification; the witness is written as {@code null} for normal subgroups.
     *
     * @param order subgroup order
     * @param elements element ids
     * @param generators generator ids
     * @param isNormal normality flag
     * @param minAttempts conjugation attempts the player is expected to need
     * @param conjugationWitness witness of non-normality
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClassifyEntry(
        @JsonProperty("order") Integer order,
        @JsonProperty("elements") List<String> elements,
        @JsonProperty("generators") List<String> generators,
        @JsonProperty("is_normal") Boolean isNormal,
        @JsonProperty("min_attempts") Integer minAttempts,
        @JsonInclude(JsonInclude.Include.ALWAYS)
        @JsonProperty("conjugation_witness") WitnessEntry conjugationWitness
    ) {}

    /**
     * Persisted conjugation witness: {@code g * h * g_inv = result}.
     *
     * @param g conjugating element
     * @param h subgroup element
     * @param gInv inverse of {@code g}
     * @param result conjugate, outside the subgroup
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WitnessEntry(
        @JsonProperty("g") String g,
        @JsonProperty("h") String h,
        @JsonProperty("g_inv") String gInv,
        @JsonProperty("result") String result
    ) {}
}

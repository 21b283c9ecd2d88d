package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Puzzle layers derived from the group.
 *
 * @param layer3 subgroup keyring
 * @param layer4 normality classification
 * @param layer5 quotient groups
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Layers(
    @JsonProperty("layer_3") KeyringLayer layer3,
    @JsonProperty("layer_4") ConjugationLayer layer4,
    @JsonProperty("layer_5") QuotientLayer layer5
) {
}

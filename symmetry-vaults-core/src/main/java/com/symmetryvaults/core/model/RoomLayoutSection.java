package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Persisted room map.
 *
 * @param width panel width
 * @param height panel height
 * @param nodeSize node radius
 * @param positions one position per group element
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomLayoutSection(
    @JsonProperty("width") Double width,
    @JsonProperty("height") Double height,
    @JsonProperty("node_size") Double nodeSize,
    @JsonProperty("positions") List<PositionEntry> positions
) {
    /**
     * Persisted room position.
     *
     * @param id element id
     * @param layer BFS layer
     * @param x horizontal coordinate
     * @param y vertical coordinate
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PositionEntry(
        @JsonProperty("id") String id,
        @JsonProperty("layer") Integer layer,
        @JsonProperty("x") Double x,
        @JsonProperty("y") Double y
    ) {}
}

package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Persisted level graph.
 *
 * @param nodes vertices
 * @param edges edges
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphSection(
    @JsonProperty("nodes") List<NodeEntry> nodes,
    @JsonProperty("edges") List<EdgeEntry> edges
) {
    /**
     * Persisted vertex.
     *
     * @param id vertex id
     * @param color color class
     * @param label display label
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NodeEntry(
        @JsonProperty("id") Integer id,
        @JsonProperty("color") String color,
        @JsonProperty("label") String label
    ) {}

    /**
     * Persisted edge; {@code directed} is written only for directed edges.
     *
     * @param from source vertex
     * @param to target vertex
     * @param type edge type
     * @param directed {@code true} for directed edges, otherwise absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EdgeEntry(
        @JsonProperty("from") Integer from,
        @JsonProperty("to") Integer to,
        @JsonProperty("type") String type,
        @JsonProperty("directed") Boolean directed
    ) {
        public boolean directedEdge() {
            return Boolean.TRUE.equals(directed);
        }
    }
}

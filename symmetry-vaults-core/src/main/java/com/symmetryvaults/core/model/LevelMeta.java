package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Level metadata.
 *
 * @param id level id, e.g. {@code act1_level05}
 * @param act act number
 * @param level level number within the act
 * @param title display title
 * @param subtitle display subtitle
 * @param groupName group name, e.g. {@code D4} or {@code Aut(cycle_4)}
 * @param groupOrder number of group elements
 * @param graphName graph name, e.g. {@code cycle_4}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LevelMeta(
    @JsonProperty("id") String id,
    @JsonProperty("act") Integer act,
    @JsonProperty("level") Integer level,
    @JsonProperty("title") String title,
    @JsonProperty("subtitle") String subtitle,
    @JsonProperty("group_name") String groupName,
    @JsonProperty("group_order") Integer groupOrder,
    @JsonProperty("graph_name") String graphName
) {
}

package com.symmetryvaults.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of a level JSON document.
 *
 * <p>Model records mirror the persisted JSON one to one and perform no
 * validation, so that documents with missing or inconsistent data can still
 * be read and reported on by the validator.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "meta": {"id": "act1_level05", "group_name": "Z3", "group_order": 3, ...},
 *   "graph": {"nodes": [...], "edges": [...]},
 *   "symmetries": {"automorphisms": [...], "generators": ["r1"], "cayley_table": {...}},
 *   "subgroup_lattice": {"edges": [...]},
 *   "layers": {"layer_3": {...}, "layer_4": {...}, "layer_5": {...}},
 *   "room_layout": {"width": 400.0, "height": 400.0, "node_size": 11.0, "positions": [...]}
 * }
 * }</pre>
 *
 * @param meta level metadata
 * @param graph the level graph
 * @param symmetries group elements, generators and Cayley table
 * @param subgroupLattice covering relation between layer 3 subgroups
 * @param layers per-layer puzzle data
 * @param roomLayout room map layout
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LevelDocument(
    @JsonProperty("meta") LevelMeta meta,
    @JsonProperty("graph") GraphSection graph,
    @JsonProperty("symmetries") SymmetrySection symmetries,
    @JsonProperty("subgroup_lattice") SubgroupLatticeSection subgroupLattice,
    @JsonProperty("layers") Layers layers,
    @JsonProperty("room_layout") RoomLayoutSection roomLayout
) {
    /**
     * Level id from the metadata, or {@code <unknown>} when absent.
     *
     * @return level id for reporting
     */
    public String levelId() {
        return meta != null && meta.id() != null ? meta.id() : "<unknown>";
    }
}

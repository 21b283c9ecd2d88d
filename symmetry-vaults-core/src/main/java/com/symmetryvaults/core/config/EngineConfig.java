package com.symmetryvaults.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.symmetryvaults.core.layout.LayoutSettings;
import com.symmetryvaults.core.subgroup.SubgroupFilter;
import com.symmetryvaults.core.symmetry.SearchLimits;

/**
 * Root configuration of the level engine.
 *
 * <p>Loaded from {@code symmetry-vaults.yaml}. Every section and every value
 * is optional; anything missing takes its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * search:
 *   maxVertices: 16
 *   maxGroupOrder: 48
 *
 * subgroups:
 *   filterStrategy: pedagogical_top10
 *   targetCount: 10
 *
 * output:
 *   cayleyTableMaxOrder: 24
 *
 * layout:
 *   width: 400
 *   height: 400
 *   iterations: 200
 * }</pre>
 *
 * @param search automorphism search ceilings
 * @param subgroups subgroup filter settings
 * @param output level document output settings
 * @param layout room map layout settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("search") SearchConfig search,
    @JsonProperty("subgroups") SubgroupConfig subgroups,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("layout") LayoutConfig layout
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public EngineConfig {
        search = search != null ? search : new SearchConfig(null, null);
        subgroups = subgroups != null ? subgroups : new SubgroupConfig(null, null);
        output = output != null ? output : new OutputConfig(null);
        layout = layout != null ? layout : new LayoutConfig(null, null, null, null, null, null, null, null);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    public SearchLimits searchLimits() {
        return new SearchLimits(search.maxVertices(), search.maxGroupOrder());
    }

    public SubgroupFilter subgroupFilter() {
        return new SubgroupFilter(subgroups.filterStrategy(), subgroups.targetCount());
    }

    public LayoutSettings layoutSettings() {
        return new LayoutSettings(layout.width(), layout.height(), layout.iterations(), layout.repulsion(),
            layout.springStrength(), layout.step(), layout.margin(), layout.radiusFactor());
    }

    /**
     * Automorphism search ceilings.
     *
     * @param maxVertices largest graph searched
     * @param maxGroupOrder largest group accepted
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchConfig(
        @JsonProperty("maxVertices") Integer maxVertices,
        @JsonProperty("maxGroupOrder") Integer maxGroupOrder
    ) {
        public SearchConfig {
            maxVertices = maxVertices != null ? maxVertices : SearchLimits.DEFAULT_MAX_VERTICES;
            maxGroupOrder = maxGroupOrder != null ? maxGroupOrder : SearchLimits.DEFAULT_MAX_GROUP_ORDER;
        }
    }

    /**
     * Subgroup filter settings.
     *
     * @param filterStrategy strategy name recorded in filtered documents
     * @param targetCount maximum number of subgroups kept
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubgroupConfig(
        @JsonProperty("filterStrategy") String filterStrategy,
        @JsonProperty("targetCount") Integer targetCount
    ) {
        public SubgroupConfig {
            filterStrategy = filterStrategy != null ? filterStrategy : SubgroupFilter.DEFAULT_STRATEGY;
            targetCount = targetCount != null ? targetCount : SubgroupFilter.DEFAULT_TARGET_COUNT;
        }
    }

    /**
     * Level document output settings.
     *
     * @param cayleyTableMaxOrder largest group whose Cayley table is written
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("cayleyTableMaxOrder") Integer cayleyTableMaxOrder
    ) {
        public static final int DEFAULT_CAYLEY_TABLE_MAX_ORDER = 24;

        public OutputConfig {
            cayleyTableMaxOrder = cayleyTableMaxOrder != null ? cayleyTableMaxOrder : DEFAULT_CAYLEY_TABLE_MAX_ORDER;
        }
    }

    /**
     * Room map layout settings; see {@link LayoutSettings}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LayoutConfig(
        @JsonProperty("width") Double width,
        @JsonProperty("height") Double height,
        @JsonProperty("iterations") Integer iterations,
        @JsonProperty("repulsion") Double repulsion,
        @JsonProperty("springStrength") Double springStrength,
        @JsonProperty("step") Double step,
        @JsonProperty("margin") Double margin,
        @JsonProperty("radiusFactor") Double radiusFactor
    ) {
        public LayoutConfig {
            LayoutSettings defaults = LayoutSettings.defaults();
            width = width != null ? width : defaults.width();
            height = height != null ? height : defaults.height();
            iterations = iterations != null ? iterations : defaults.iterations();
            repulsion = repulsion != null ? repulsion : defaults.repulsion();
            springStrength = springStrength != null ? springStrength : defaults.springStrength();
            step = step != null ? step : defaults.step();
            margin = margin != null ? margin : defaults.margin();
            radiusFactor = radiusFactor != null ? radiusFactor : defaults.radiusFactor();
        }
    }
}

package com.symmetryvaults.core.level;

import java.util.Objects;

/**
 * Parameters of one level generation run.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * LevelRequest request = LevelRequest.auto("complete_3", 12);
 * LevelRequest named = new LevelRequest("cycle_4", "D4", 3, 1, null, null, true);
 * }</pre>
 *
 * @param graphName graph name, e.g. {@code cycle_5} or {@code petersen}
 * @param groupName named group such as {@code Z5}; null to use the graph's automorphism group
 * @param levelNumber level number within the act
 * @param act act number
 * @param title title, or null for a generated one
 * @param subtitle subtitle, or null for a generated one
 * @param includeSubgroups whether subgroup layers are computed
 */
public record LevelRequest(
    String graphName,
    String groupName,
    int levelNumber,
    int act,
    String title,
    String subtitle,
    boolean includeSubgroups
) {
    /**
     * Compact constructor with validation.
     */
    public LevelRequest {
        Objects.requireNonNull(graphName, "graphName must not be null");
        if (levelNumber < 1) {
            throw new IllegalArgumentException("levelNumber must be >= 1");
        }
        if (act < 1) {
            throw new IllegalArgumentException("act must be >= 1");
        }
    }

    /**
     * Request for a level on {@code Aut(graph)} with generated titles.
     *
     * @param graphName graph name
     * @param levelNumber level number in act 1
     * @return the request
     */
    public static LevelRequest auto(String graphName, int levelNumber) {
        return new LevelRequest(graphName, null, levelNumber, 1, null, null, true);
    }

    public boolean autoGroup() {
        return groupName == null;
    }

    public String levelId() {
        return String.format("act%d_level%02d", act, levelNumber);
    }
}

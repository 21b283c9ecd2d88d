package com.symmetryvaults.core.layout;

import java.util.List;
import java.util.Objects;

/**
 * Complete room-map layout for a group.
 *
 * @param width panel width
 * @param height panel height
 * @param nodeSize node radius in pixels
 * @param positions one position per element, in canonical order
 */
public record RoomLayout(
    double width,
    double height,
    double nodeSize,
    List<NodePosition> positions
) {
    /**
     * Compact constructor with validation.
     */
    public RoomLayout {
        Objects.requireNonNull(positions, "positions must not be null");
        positions = List.copyOf(positions);
    }
}

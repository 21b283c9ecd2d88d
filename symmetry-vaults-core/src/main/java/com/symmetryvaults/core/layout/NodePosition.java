package com.symmetryvaults.core.layout;

/**
 * Position of one group element on the room map.
 *
 * @param index element index in canonical order
 * @param id element id
 * @param layer BFS distance from the identity
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record NodePosition(
    int index,
    String id,
    int layer,
    double x,
    double y
) {
}

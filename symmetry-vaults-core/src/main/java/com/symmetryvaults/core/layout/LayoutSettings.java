package com.symmetryvaults.core.layout;

/**
 * Parameters of the room-map layout.
 *
 * @param width panel width
 * @param height panel height
 * @param iterations number of force relaxation rounds
 * @param repulsion inverse-square repulsion strength
 * @param springStrength pull toward each node's layer radius
 * @param step fraction of the net force applied per round
 * @param margin minimum distance from the panel border
 * @param radiusFactor outermost ring radius relative to {@code min(width, height)}
 */
public record LayoutSettings(
    double width,
    double height,
    int iterations,
    double repulsion,
    double springStrength,
    double step,
    double margin,
    double radiusFactor
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutSettings {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        if (2 * margin >= Math.min(width, height)) {
            throw new IllegalArgumentException("margin " + margin + " leaves no room in a "
                + width + "x" + height + " panel");
        }
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(400.0, 400.0, 200, 800.0, 0.1, 0.3, 30.0, 0.38);
    }
}

package com.symmetryvaults.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Writes generated level files to a destination.
 *
 * <p>Renderers are discovered via {@link ServiceLoader}; register implementations in
 * {@code META-INF/services/com.symmetryvaults.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Unique lowercase identifier, e.g. {@code filesystem} or {@code console}.
     *
     * @return renderer id
     */
    String getId();

    /**
     * Writes every file of the output. A failure leaves no partially written file behind.
     *
     * @param output files to write
     * @param context destination and settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);

    /**
     * Finds a registered renderer by id.
     *
     * @param id renderer id
     * @return the renderer
     * @throws IllegalArgumentException if no renderer has that id
     */
    static OutputRenderer byId(String id) {
        List<String> known = new ArrayList<>();
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
            known.add(renderer.getId());
        }
        throw new IllegalArgumentException("Unknown renderer '" + id + "', known: " + known);
    }
}

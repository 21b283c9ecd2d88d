package com.symmetryvaults.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Level files produced by one generation run.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}

package com.symmetryvaults.core.renderer;

import java.util.Objects;

/**
 * A level file ready to be written.
 *
 * @param relativePath path relative to the output directory, e.g. {@code act1_level03.json}
 * @param content file content
 * @param levelId id of the level the file holds
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String levelId
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}

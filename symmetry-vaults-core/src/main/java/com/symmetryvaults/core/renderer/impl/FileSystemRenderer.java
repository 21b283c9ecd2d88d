package com.symmetryvaults.core.renderer.impl;

import com.symmetryvaults.core.renderer.GeneratedFile;
import com.symmetryvaults.core.renderer.GeneratedOutput;
import com.symmetryvaults.core.renderer.OutputRenderer;
import com.symmetryvaults.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes level files below the output directory.
 *
 * <p>Each file is written to a temporary sibling and moved into place, so a
 * failed generation never leaves a truncated level file. Existing files are
 * replaced.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext(Path.of("levels"), Map.of());
 * new FileSystemRenderer().render(GeneratedOutput.of(
 *     new GeneratedFile("act1_level01.json", json, "act1_level01")), context);
 * // Creates: levels/act1_level01.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.debug("Writing {} level file(s) to {}", output.files().size(), outputDir);
        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath());
        Path temp = null;
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, ".level-", ".tmp");
            Files.writeString(temp, file.content(), StandardCharsets.UTF_8);
            move(temp, target);
            logger.info("Wrote level {} to {}", file.levelId(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new IllegalStateException("Failed to write level file: " + target, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}

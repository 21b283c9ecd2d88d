package com.symmetryvaults.core.renderer.impl;

import com.symmetryvaults.core.renderer.GeneratedFile;
import com.symmetryvaults.core.renderer.GeneratedOutput;
import com.symmetryvaults.core.renderer.OutputRenderer;
import com.symmetryvaults.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void byId_discoversBothRenderers() {
        assertThat(OutputRenderer.byId("filesystem")).isInstanceOf(FileSystemRenderer.class);
        assertThat(OutputRenderer.byId("console")).isInstanceOf(ConsoleRenderer.class);
        assertThatThrownBy(() -> OutputRenderer.byId("pdf"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pdf");
    }

    @Test
    void render_writesLevelFile() throws IOException {
        GeneratedFile file = new GeneratedFile("level_01.json", "{\"meta\": {}}\n", "act1_level01");

        renderer.render(GeneratedOutput.of(file), new RenderContext(tempDir, Map.of()));

        assertThat(Files.readString(tempDir.resolve("level_01.json"))).isEqualTo("{\"meta\": {}}\n");
    }

    @Test
    void render_withNestedPath_createsDirectories() throws IOException {
        GeneratedFile file = new GeneratedFile("act2/level_05.json", "{}", "act2_level05");

        renderer.render(GeneratedOutput.of(file), new RenderContext(tempDir, Map.of()));

        assertThat(tempDir.resolve("act2/level_05.json")).exists();
    }

    @Test
    void render_existingFile_isReplacedWithoutLeftovers() throws IOException {
        Files.writeString(tempDir.resolve("level.json"), "old");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("level.json", "new", "act1_level01")));

        renderer.render(output, new RenderContext(tempDir, Map.of()));

        assertThat(Files.readString(tempDir.resolve("level.json"))).isEqualTo("new");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("level.json");
        }
    }

    @Test
    void render_parentIsRegularFile_throwsIllegalState() throws IOException {
        Files.writeString(tempDir.resolve("blocker"), "not a directory");
        GeneratedFile file = new GeneratedFile("blocker/level.json", "{}", "act1_level01");

        assertThatThrownBy(() -> renderer.render(GeneratedOutput.of(file), new RenderContext(tempDir, Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write level file");
    }

    @Test
    void generatedFile_blankPath_throws() {
        assertThatThrownBy(() -> new GeneratedFile(" ", "{}", "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

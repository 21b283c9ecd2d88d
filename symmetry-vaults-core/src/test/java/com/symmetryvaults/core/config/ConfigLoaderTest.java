package com.symmetryvaults.core.config;

import com.symmetryvaults.core.layout.LayoutSettings;
import com.symmetryvaults.core.symmetry.SearchLimits;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_returnsDefaults() {
        EngineConfig config = ConfigLoader.load(tempDir.resolve("absent.yaml"));

        assertThat(config).isEqualTo(EngineConfig.defaults());
        assertThat(config.searchLimits()).isEqualTo(SearchLimits.defaults());
    }

    @Test
    void load_partialFile_fillsRemainingDefaults() throws IOException {
        Path file = tempDir.resolve("symmetry-vaults.yaml");
        Files.writeString(file, """
            search:
              maxVertices: 10
            subgroups:
              targetCount: 6
            layout:
              iterations: 50
            """);

        EngineConfig config = ConfigLoader.load(file);

        assertThat(config.search().maxVertices()).isEqualTo(10);
        assertThat(config.search().maxGroupOrder()).isEqualTo(SearchLimits.DEFAULT_MAX_GROUP_ORDER);
        assertThat(config.subgroups().targetCount()).isEqualTo(6);
        assertThat(config.subgroups().filterStrategy()).isEqualTo("pedagogical_top10");
        assertThat(config.layoutSettings().iterations()).isEqualTo(50);
        assertThat(config.layoutSettings().width()).isEqualTo(LayoutSettings.defaults().width());
        assertThat(config.output().cayleyTableMaxOrder()).isEqualTo(24);
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
            search:
              maxGroupOrder: 24
              experimental: true
            theme: dark
            """);

        assertThat(ConfigLoader.load(file).search().maxGroupOrder()).isEqualTo(24);
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "search: [unclosed");

        assertThat(ConfigLoader.load(file)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThat(ConfigLoader.load(file)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void loadOrDefaults_explicitPath_isUsed() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "output:\n  cayleyTableMaxOrder: 8\n");

        assertThat(ConfigLoader.loadOrDefaults(file).output().cayleyTableMaxOrder()).isEqualTo(8);
    }
}

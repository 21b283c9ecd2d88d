package com.symmetryvaults.cli;

import com.symmetryvaults.core.level.LevelCodec;
import com.symmetryvaults.core.model.LevelDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void generate_toFile_writesValidDocument() throws IOException {
        Path file = tempDir.resolve("levels/act1_level03.json");

        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "complete_3", "--auto", "--level-id", "3", "-o", file.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ Generated act1_level03", "of order 6");
        LevelDocument document = LevelCodec.read(file);
        assertThat(document.meta().groupName()).isEqualTo("Aut(complete_3)");
        assertThat(document.layers().layer4().crackedCount()).isEqualTo(3);
    }

    @Test
    void generate_withoutOutput_printsJson() throws IOException {
        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "cycle_4", "--group", "Z4", "--level-id", "7", "--act", "2", "--no-subgroups");

        assertThat(result.exitCode()).isZero();
        LevelDocument document = LevelCodec.parse(result.out());
        assertThat(document.meta().id()).isEqualTo("act2_level07");
        assertThat(document.meta().groupName()).isEqualTo("Z4");
        assertThat(document.layers()).isNull();
    }

    @Test
    void generate_customTitle_isStored() throws IOException {
        CliTestSupport.Result result = CliTestSupport.run("generate", "--graph", "cycle_3", "--auto",
            "--level-id", "1", "--title", "First Door", "--subtitle", "Turn and flip");

        assertThat(LevelCodec.parse(result.out()).meta().title()).isEqualTo("First Door");
    }

    @Test
    void generate_graphTooLarge_failsWithoutWriting() {
        Path file = tempDir.resolve("big.json");

        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "cycle_20", "--auto", "--level-id", "1", "-o", file.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗", "20 vertices");
        assertThat(file).doesNotExist();
    }

    @Test
    void generate_groupNotActingOnGraph_fails() {
        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "path_4", "--group", "Z4", "--level-id", "1");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("not a symmetry of path_4");
    }

    @Test
    void generate_unknownGroup_fails() {
        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "cycle_4", "--group", "Q8", "--level-id", "1");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Unknown group");
    }

    @Test
    void generate_groupAndAutoTogether_isUsageError() {
        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "cycle_4", "--group", "Z4", "--auto", "--level-id", "1");

        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.err()).contains("mutually exclusive");
    }

    @Test
    void generate_configLimitsApply() throws IOException {
        Path config = tempDir.resolve("limits.yaml");
        Files.writeString(config, "search:\n  maxVertices: 4\n");

        CliTestSupport.Result result = CliTestSupport.run(
            "generate", "--graph", "cycle_5", "--auto", "--level-id", "1", "-c", config.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("ceiling of 4");
    }
}

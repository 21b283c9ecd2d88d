package com.symmetryvaults.core.level;

import com.symmetryvaults.core.config.EngineConfig;
import com.symmetryvaults.core.model.LevelDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LevelCodec}.
 */
class LevelCodecTest {

    @TempDir
    Path tempDir;

    @Test
    void write_usesSnakeCaseFieldNames() {
        String json = LevelCodec.write(generate("complete_3"));

        assertThat(json).contains("\"group_name\"", "\"cayley_table\"", "\"layer_3\"",
            "\"conjugation_witness\"", "\"coset_representatives\"", "\"room_layout\"");
        assertThat(json).endsWith("\n");
    }

    @Test
    void write_normalEntryKeepsExplicitNullWitness() {
        String json = LevelCodec.write(generate("complete_3"));

        assertThat(json).contains("\"conjugation_witness\" : null");
    }

    @Test
    void read_writtenFile_restoresDocument() throws IOException {
        LevelDocument original = generate("directed_cycle_4");
        Path file = tempDir.resolve("level.json");
        Files.writeString(file, LevelCodec.write(original));

        LevelDocument restored = LevelCodec.read(file);

        assertThat(restored).isEqualTo(original);
    }

    @Test
    void parse_ignoresUnknownFields() throws IOException {
        LevelDocument document = LevelCodec.parse("{\"meta\": {\"id\": \"x\", \"extra\": 1}, \"future\": true}");

        assertThat(document.levelId()).isEqualTo("x");
        assertThat(document.graph()).isNull();
    }

    @Test
    void parse_malformedJson_throwsIOException() {
        assertThatThrownBy(() -> LevelCodec.parse("{\"meta\": "))
            .isInstanceOf(IOException.class);
    }

    @Test
    void parse_jsonNull_throwsIOException() {
        assertThatThrownBy(() -> LevelCodec.parse("null"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void levelId_withoutMeta_isPlaceholder() throws IOException {
        assertThat(LevelCodec.parse("{}").levelId()).isEqualTo("<unknown>");
    }

    private static LevelDocument generate(String graph) {
        return new LevelGenerator(EngineConfig.defaults()).generate(LevelRequest.auto(graph, 1));
    }
}

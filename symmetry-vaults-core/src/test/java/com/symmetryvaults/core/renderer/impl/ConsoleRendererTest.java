package com.symmetryvaults.core.renderer.impl;

import com.symmetryvaults.core.renderer.GeneratedFile;
import com.symmetryvaults.core.renderer.GeneratedOutput;
import com.symmetryvaults.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private final StringWriter buffer = new StringWriter();
    private final ConsoleRenderer renderer = new ConsoleRenderer(new PrintWriter(buffer));

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_printsContentUnchanged() {
        renderer.render(GeneratedOutput.of(new GeneratedFile("level.json", "{}\n", "act1_level01")),
            new RenderContext(Path.of("."), Map.of()));

        assertThat(buffer.toString()).isEqualTo("{}\n");
    }

    @Test
    void render_withHeaders_prefixesEachFile() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.json", "{}\n", "act1_level01"),
            new GeneratedFile("b.json", "[]\n", "act1_level02")));

        renderer.render(output, new RenderContext(Path.of("."), Map.of("console.headers", "true")));

        assertThat(buffer.toString().lines()).containsExactly("// a.json", "{}", "// b.json", "[]");
    }
}

package com.symmetryvaults.core.renderer.impl;

import com.symmetryvaults.core.renderer.GeneratedFile;
import com.symmetryvaults.core.renderer.GeneratedOutput;
import com.symmetryvaults.core.renderer.OutputRenderer;
import com.symmetryvaults.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Prints level files to standard output instead of writing them.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.headers} - print a {@code // <path>} line before each file ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean headers = Boolean.parseBoolean(context.getSettingOrDefault("console.headers", "false"));
        logger.debug("Printing {} level file(s)", output.files().size());
        for (GeneratedFile file : output.files()) {
            if (headers) {
                out.println("// " + file.relativePath());
            }
            out.print(file.content());
        }
        out.flush();
    }
}

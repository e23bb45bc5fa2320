package com.furiflow.core.renderer.impl;

import com.furiflow.core.renderer.GeneratedFile;
import com.furiflow.core.renderer.GeneratedOutput;
import com.furiflow.core.renderer.OutputRenderer;
import com.furiflow.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated files to a stream, each preceded by a header line.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors in headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - print a header per file ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));

        logger.debug("Printing {} files (colors: {}, headers: {})", output.files().size(), useColors, showHeaders);

        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                String header = "// ===== " + file.relativePath() + " =====";
                out.println(useColors ? ANSI_BOLD_CYAN + header + ANSI_RESET : header);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}

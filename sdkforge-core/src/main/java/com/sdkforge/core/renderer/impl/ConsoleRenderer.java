package com.sdkforge.core.renderer.impl;

import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import com.sdkforge.core.renderer.OutputRenderer;
import com.sdkforge.core.renderer.RenderContext;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer that prints generated files, with optional ANSI colours.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - enable ANSI colours (default: "true")</li>
 *   <li>{@code console.showHeaders} - print a header per file (default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String ID = "console";

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean colors = context.getBooleanSetting("console.colors", true);
        boolean headers = context.getBooleanSetting("console.showHeaders", true);
        log.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), colors, headers);

        out.println(paint("Generated " + output.files().size() + " file(s)", ANSI_BOLD + ANSI_GREEN, colors));

        List<GeneratedFile> files = output.files();
        for (int i = 0; i < files.size(); i++) {
            GeneratedFile file = files.get(i);
            out.println(paint(SEPARATOR, ANSI_YELLOW, colors));
            if (headers) {
                out.println(paint("File " + (i + 1) + "/" + files.size() + ": " + file.relativePath(),
                    ANSI_BOLD + ANSI_CYAN, colors));
                if (file.contentType() != null && !file.contentType().isEmpty()) {
                    out.println(paint("Type: " + file.contentType(), ANSI_YELLOW, colors));
                }
                out.println();
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.println(paint(SEPARATOR, ANSI_YELLOW, colors));
        out.flush();
    }

    private static String paint(String text, String color, boolean colors) {
        return colors ? color + text + ANSI_RESET : text;
    }
}

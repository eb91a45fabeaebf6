package com.sdkforge.core.renderer.impl;

import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import com.sdkforge.core.renderer.OutputRenderer;
import com.sdkforge.core.renderer.RenderContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer that writes generated files below the output directory.
 *
 * <p>Creates missing directories and overwrites existing files. Paths are kept relative
 * to the output directory; a file resolving outside of it is rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = generator.generate(plan);
 * new FileSystemRenderer().render(output, new RenderContext("./sdk", Map.of()));
 * // Creates: ./sdk/lib/client.ts, ./sdk/lib/errors.ts, ...
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String ID = "filesystem";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Rendering {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
        log.info("Rendered {} files", output.files().size());
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("File escapes output directory: " + file.relativePath());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}

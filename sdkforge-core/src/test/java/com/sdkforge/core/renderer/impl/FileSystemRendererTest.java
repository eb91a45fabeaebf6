package com.sdkforge.core.renderer.impl;

import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import com.sdkforge.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

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
    void render_withNestedPaths_createsDirectoryStructure() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("lib/client.ts", "export class Client {}\n", GeneratedFile.TYPESCRIPT),
            GeneratedFile.markdown("docs/QUICKSTART.md", "# Quickstart\n")
        ));
        RenderContext context = new RenderContext(tempDir.toString(), Map.of());

        // When
        renderer.render(output, context);

        // Then
        assertThat(Files.readString(tempDir.resolve("lib/client.ts"))).isEqualTo("export class Client {}\n");
        assertThat(Files.readString(tempDir.resolve("docs/QUICKSTART.md"))).isEqualTo("# Quickstart\n");
    }

    @Test
    void render_withMissingOutputDirectory_createsIt() {
        // Given
        Path outputDir = tempDir.resolve("generated/sdk");
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.markdown("README.md", "# SDK\n")));

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(outputDir.resolve("README.md")).exists();
    }

    @Test
    void render_withExistingFile_overwritesIt() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("README.md"), "stale");
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.markdown("README.md", "fresh")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("README.md"))).isEqualTo("fresh");
    }

    @Test
    void render_withUnicodeContent_writesUtf8() throws IOException {
        // Given
        String content = "// Grüße ✓\n";
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("lib/types.ts", content, GeneratedFile.TYPESCRIPT)));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("lib/types.ts"))).isEqualTo(content);
    }

    @Test
    void render_whenOutputDirectoryIsAFile_throwsException() throws IOException {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.markdown("README.md", "# SDK")));

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void render_withEmptyOutput_createsOnlyDirectory() {
        // Given
        Path outputDir = tempDir.resolve("empty");

        // When
        renderer.render(GeneratedOutput.empty(), new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(outputDir).isDirectory().isEmptyDirectory();
    }
}

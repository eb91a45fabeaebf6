package com.sdkforge.core.renderer.impl;

import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import com.sdkforge.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withHeaders_printsPathTypeAndContent() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("lib/client.ts", "export class Client {}", GeneratedFile.TYPESCRIPT)));
        RenderContext context = new RenderContext("./sdk", Map.of("console.colors", "false"));

        // When
        renderer.render(output, context);

        // Then
        String consoleOutput = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(consoleOutput).contains("Generated 1 file(s)");
        assertThat(consoleOutput).contains("File 1/1: lib/client.ts");
        assertThat(consoleOutput).contains("Type: text/typescript");
        assertThat(consoleOutput).contains("export class Client {}\n");
        assertThat(consoleOutput).doesNotContain("\u001B[");
    }

    @Test
    void render_withoutHeaders_omitsFileHeader() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.markdown("README.md", "# SDK\n")));
        RenderContext context = new RenderContext("./sdk",
            Map.of("console.colors", "false", "console.showHeaders", "false"));

        // When
        renderer.render(output, context);

        // Then
        String consoleOutput = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(consoleOutput).contains("# SDK\n");
        assertThat(consoleOutput).doesNotContain("File 1/1");
    }

    @Test
    void render_withColors_usesAnsiCodes() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.markdown("README.md", "# SDK\n")));

        // When
        renderer.render(output, new RenderContext("./sdk", Map.of()));

        // Then
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("\u001B[0m");
    }
}

package com.sdkforge.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sdkforge.core.renderer.impl.ConsoleRenderer;
import com.sdkforge.core.renderer.impl.FileSystemRenderer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void generate_withPlan_writesSourcesAndDocs() throws Exception {
        // When
        int exitCode = execute("-p", fixture("wallet-plan.json"), "-o", tempDir.toString(),
            "-c", tempDir.resolve("missing.yaml").toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("lib/client.ts")).exists();
        assertThat(tempDir.resolve("lib/errors.ts")).exists();
        assertThat(tempDir.resolve("lib/config.ts")).exists();
        assertThat(tempDir.resolve("lib/types.ts")).exists();
        assertThat(tempDir.resolve("examples/basic.ts")).exists();
        assertThat(tempDir.resolve("package.json")).exists();
        assertThat(tempDir.resolve("README.md")).exists();
        assertThat(tempDir.resolve("docs/QUICKSTART.md")).exists();
        assertThat(tempDir.resolve("docs/AUTHENTICATION.md")).exists();
        assertThat(tempDir.resolve("docs/EXAMPLES.md")).exists();
        assertThat(tempDir.resolve("docs/ERROR_HANDLING.md")).exists();
        assertThat(tempDir.resolve("docs/API_REFERENCE.md")).exists();
        assertThat(Files.readString(tempDir.resolve("lib/client.ts"))).contains("export class WalletClient {");
    }

    @Test
    void generate_withExamples_documentsThem() throws Exception {
        // When
        int exitCode = execute("-p", fixture("wallet-plan.json"), "-e", fixture("examples.json"),
            "-o", tempDir.toString(), "-c", tempDir.resolve("missing.yaml").toString());

        // Then
        assertThat(exitCode).isZero();
        String examples = Files.readString(tempDir.resolve("docs/EXAMPLES.md"));
        assertThat(examples).contains("## Beginner Examples").contains("### Send a payment");
    }

    @Test
    void generate_withConfig_appliesOverrides() throws Exception {
        // When
        int exitCode = execute("-p", fixture("wallet-plan.json"), "-o", tempDir.toString(),
            "-c", fixture("sdkforge.yaml"));

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("examples/basic.ts")).doesNotExist();
        assertThat(Files.readString(tempDir.resolve("package.json")))
            .contains("\"2.1.0\"")
            .contains("\"@acme/wallet-sdk\"")
            .contains("\"Apache-2.0\"");
        assertThat(Files.readString(tempDir.resolve("lib/client.ts"))).contains("\n    constructor(");
        assertThat(Files.readString(tempDir.resolve("README.md")))
            .contains("[Repository](https://github.com/acme/wallet-sdk)");
    }

    @Test
    void generate_noDocs_writesSourcesOnly() throws Exception {
        // When
        int exitCode = execute("-p", fixture("wallet-plan.json"), "-o", tempDir.toString(), "--no-docs",
            "-c", tempDir.resolve("missing.yaml").toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("lib/client.ts")).exists();
        assertThat(tempDir.resolve("README.md")).doesNotExist();
        assertThat(tempDir.resolve("docs")).doesNotExist();
    }

    @Test
    void generate_incompletePlan_failsWithoutWriting() throws Exception {
        // Given
        Path outputDir = tempDir.resolve("out");

        // When
        int exitCode = execute("-p", fixture("incomplete-plan.json"), "-o", outputDir.toString(),
            "-c", tempDir.resolve("missing.yaml").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void generate_missingPlan_fails() {
        int exitCode = execute("-p", tempDir.resolve("nope.json").toString(), "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_unknownRenderer_fails() throws Exception {
        int exitCode = execute("-p", fixture("wallet-plan.json"), "-o", tempDir.toString(),
            "--renderer", "s3", "-c", tempDir.resolve("missing.yaml").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("lib")).doesNotExist();
    }

    @Test
    void generate_consoleRendererWithoutColor_printsPlainText() throws Exception {
        // Given
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));

        // When
        int exitCode;
        try {
            exitCode = execute("-p", fixture("wallet-plan.json"), "--renderer", "console", "--no-color",
                "--no-docs", "-c", tempDir.resolve("missing.yaml").toString());
        } finally {
            System.setOut(originalOut);
        }

        // Then
        String output = captured.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output).contains("lib/client.ts").doesNotContain("\u001B[");
    }

    @Test
    void generate_withoutPlanOption_isUsageError() {
        assertThat(execute("-o", tempDir.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void findRenderer_discoversBuiltInRenderers() {
        assertThat(GenerateCommand.findRenderer("filesystem")).isInstanceOf(FileSystemRenderer.class);
        assertThat(GenerateCommand.findRenderer("console")).isInstanceOf(ConsoleRenderer.class);
        assertThatThrownBy(() -> GenerateCommand.findRenderer("s3"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown renderer 's3'")
            .hasMessageContaining("filesystem");
    }

    private static int execute(String... args) {
        return new CommandLine(new GenerateCommand()).execute(args);
    }

    private static String fixture(String name) throws URISyntaxException, IOException {
        Path path = Paths.get(GenerateCommandTest.class.getResource("/fixtures/" + name).toURI());
        if (!Files.isRegularFile(path)) {
            throw new IOException("Missing test fixture: " + name);
        }
        return path.toString();
    }
}

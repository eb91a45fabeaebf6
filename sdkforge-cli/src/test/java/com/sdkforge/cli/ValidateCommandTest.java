package com.sdkforge.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.sdkforge.SdkForgeCLI;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void validate_completePlan_succeeds() throws Exception {
        int exitCode = new CommandLine(new ValidateCommand()).execute("-p", fixture("wallet-plan.json"));

        assertThat(exitCode).isZero();
    }

    @Test
    void validate_incompletePlan_fails() throws Exception {
        int exitCode = new CommandLine(new ValidateCommand()).execute("-p", fixture("incomplete-plan.json"));

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void validate_missingPlan_fails() {
        int exitCode = new CommandLine(new ValidateCommand())
            .execute("-p", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void validate_throughRootCommand_writesNothing() throws Exception {
        int exitCode = new CommandLine(new SdkForgeCLI())
            .execute("-q", "validate", "-p", fixture("wallet-plan.json"));

        assertThat(exitCode).isZero();
        assertThat(tempDir).isEmptyDirectory();
    }

    private static String fixture(String name) throws Exception {
        return Paths.get(ValidateCommandTest.class.getResource("/fixtures/" + name).toURI()).toString();
    }
}

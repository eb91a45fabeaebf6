package com.sdkforge;

import ch.qos.logback.classic.Level;
import com.sdkforge.cli.GenerateCommand;
import com.sdkforge.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SdkForge.
 *
 * <p>SdkForge turns a JSON design plan into TypeScript SDK sources and Markdown
 * documentation.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate SDK sources and documentation</li>
 *   <li>{@code validate} - Check that a design plan is complete</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * sdkforge generate -p plan.json -o ./sdk
 * sdkforge -v generate -p plan.json -c sdkforge.yaml --renderer console
 * sdkforge validate -p plan.json
 * }</pre>
 */
@Command(
    name = "sdkforge",
    mixinStandardHelpOptions = true,
    version = "SdkForge 1.0.0-SNAPSHOT",
    description = "SDK source and documentation generator",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class
    }
)
public class SdkForgeCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("SdkForge - SDK source and documentation generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sdkforge --help' to see available commands");
        System.out.println("Use 'sdkforge <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options. Subcommands call this before
     * doing any work.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SdkForgeCLI()).execute(args);
        System.exit(exitCode);
    }
}

package com.sdkforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sdkforge.core.emitter.EmitterOptions;
import com.sdkforge.core.emitter.IndentStyle;
import com.sdkforge.core.model.Audience;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.ProductInfo;
import java.util.HashMap;
import java.util.Map;

/**
 * Root configuration for SdkForge runs.
 *
 * <p>Loaded from {@code sdkforge.yaml}. Every section is optional; absent sections and
 * absent values fall back to defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "wallet-sdk"
 *   version: "2.1.0"
 *
 * emitter:
 *   indentation: spaces
 *   indentSize: 4
 *   lineWidth: 120
 *
 * documentation:
 *   repositoryUrl: "https://github.com/acme/wallet-sdk"
 *   audience: beginner
 *
 * package:
 *   scope: "@acme"
 *   license: "Apache-2.0"
 *
 * output:
 *   directory: "./generated"
 *   generateExamples: true
 *   generateDocs: true
 *   colors: false
 * }</pre>
 *
 * @param project project metadata overriding the plan's product info
 * @param emitter source formatting settings
 * @param documentation documentation settings
 * @param packaging {@code package.json} settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("emitter") EmitterSettings emitter,
    @JsonProperty("documentation") DocumentationSettings documentation,
    @JsonProperty("package") PackageSettings packaging,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./sdk";

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo(null, null, null);
        }
        if (emitter == null) {
            emitter = new EmitterSettings(null, null, null, null, null);
        }
        if (documentation == null) {
            documentation = new DocumentationSettings(null, null, null);
        }
        if (packaging == null) {
            packaging = new PackageSettings(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null, null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Returns the plan with this configuration's project metadata and audience applied.
     *
     * @param plan design plan
     * @return plan with overrides, or the same plan when nothing is overridden
     */
    public DesignPlan applyTo(DesignPlan plan) {
        boolean productOverridden = project.name() != null || project.version() != null
            || project.description() != null;
        if (!productOverridden && documentation.audience() == null) {
            return plan;
        }
        ProductInfo current = plan.product() != null ? plan.product() : new ProductInfo(null, null, null);
        ProductInfo product = new ProductInfo(
            project.name() != null ? project.name() : current.name(),
            project.version() != null ? project.version() : current.version(),
            project.description() != null ? project.description() : current.description()
        );
        return new DesignPlan(product, plan.client(), plan.methods(), plan.types(), plan.errors(), plan.auth(),
            plan.targetLanguageId(), documentation.audience() != null ? documentation.audience() : plan.audience());
    }

    /**
     * Project metadata. Null values keep the plan's own product info.
     *
     * @param name package name
     * @param version package version
     * @param description package description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Source formatting settings.
     *
     * @param indentation "spaces" or "tabs"
     * @param indentSize spaces per indent level
     * @param lineWidth soft line width
     * @param trailingNewline whether files end with a newline
     * @param statementTerminators whether statements end with ';'
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmitterSettings(
        @JsonProperty("indentation") IndentStyle indentation,
        @JsonProperty("indentSize") Integer indentSize,
        @JsonProperty("lineWidth") Integer lineWidth,
        @JsonProperty("trailingNewline") Boolean trailingNewline,
        @JsonProperty("statementTerminators") Boolean statementTerminators
    ) {
        /**
         * Converts the settings to emitter options, using defaults for absent values.
         *
         * @return emitter options
         * @throws IllegalArgumentException if a size is not positive
         */
        public EmitterOptions toEmitterOptions() {
            return new EmitterOptions(
                indentation != null ? indentation : IndentStyle.SPACES,
                indentSize != null ? indentSize : EmitterOptions.DEFAULT_INDENT_SIZE,
                lineWidth != null ? lineWidth : EmitterOptions.DEFAULT_LINE_WIDTH,
                trailingNewline == null || trailingNewline,
                statementTerminators == null || statementTerminators
            );
        }
    }

    /**
     * Documentation settings.
     *
     * @param repositoryUrl source repository link
     * @param docsBaseUrl hosted documentation link
     * @param audience audience override
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentationSettings(
        @JsonProperty("repositoryUrl") String repositoryUrl,
        @JsonProperty("docsBaseUrl") String docsBaseUrl,
        @JsonProperty("audience") Audience audience
    ) {}

    /**
     * Settings for the generated {@code package.json}.
     *
     * @param scope npm scope prefixed to the package name (e.g. "@acme")
     * @param license license identifier
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PackageSettings(
        @JsonProperty("scope") String scope,
        @JsonProperty("license") String license
    ) {
        /**
         * Returns the generator settings for the values that are set.
         *
         * @return settings keyed {@code package.scope} and {@code package.license}
         */
        public Map<String, Object> toGeneratorSettings() {
            Map<String, Object> settings = new HashMap<>();
            if (scope != null) {
                settings.put("package.scope", scope);
            }
            if (license != null && !license.isBlank()) {
                settings.put("package.license", license);
            }
            return settings;
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory path
     * @param generateExamples whether to emit {@code examples/basic.ts}
     * @param generateDocs whether to render documentation
     * @param colors whether the console renderer uses ANSI colours
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("generateExamples") Boolean generateExamples,
        @JsonProperty("generateDocs") Boolean generateDocs,
        @JsonProperty("colors") Boolean colors
    ) {
        public String directoryOrDefault() {
            return directory != null && !directory.isBlank() ? directory : DEFAULT_OUTPUT_DIRECTORY;
        }

        public boolean examplesEnabled() {
            return generateExamples == null || generateExamples;
        }

        public boolean docsEnabled() {
            return generateDocs == null || generateDocs;
        }

        public Map<String, String> toRendererSettings() {
            return colors != null ? Map.of("console.colors", colors.toString()) : Map.of();
        }
    }
}

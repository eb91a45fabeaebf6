package com.sdkforge.cli;

import com.sdkforge.SdkForgeCLI;
import com.sdkforge.core.config.ConfigLoader;
import com.sdkforge.core.config.DesignPlanLoader;
import com.sdkforge.core.config.ProjectConfig;
import com.sdkforge.core.docs.DocumentationConfig;
import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.DocumentationGenerator;
import com.sdkforge.core.error.CodeGenerationException;
import com.sdkforge.core.generator.GeneratorConfig;
import com.sdkforge.core.generator.SdkCodeGenerator;
import com.sdkforge.core.model.CodeExample;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.renderer.GeneratedOutput;
import com.sdkforge.core.renderer.OutputRenderer;
import com.sdkforge.core.renderer.RenderContext;
import com.sdkforge.core.renderer.impl.FileSystemRenderer;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Command to generate SDK sources and documentation from a design plan.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load {@code sdkforge.yaml} (defaults when absent)</li>
 *   <li>Load the design plan and optional code examples</li>
 *   <li>Generate TypeScript sources</li>
 *   <li>Generate documentation unless disabled</li>
 *   <li>Render the files with the selected renderer</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sdkforge generate -p plan.json
 * sdkforge generate -p plan.json -e examples.json -o ./out
 * sdkforge generate -p plan.json --renderer console --no-docs
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate SDK sources and documentation from a design plan",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @ParentCommand
    private SdkForgeCLI parent;

    @Option(names = {"-p", "--plan"}, description = "Design plan JSON file", required = true)
    private Path planPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: sdkforge.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-e", "--examples"}, description = "Code examples JSON file")
    private Path examplesPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--renderer"}, description = "Output renderer: filesystem or console (default: filesystem)")
    private String rendererId = FileSystemRenderer.ID;

    @Option(names = {"--no-docs"}, description = "Skip documentation generation")
    private boolean noDocs;

    @Option(names = {"--no-color"}, description = "Disable ANSI colours in console output")
    private boolean noColor;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            DesignPlan plan = config.applyTo(DesignPlanLoader.load(planPath));
            List<CodeExample> examples = DesignPlanLoader.loadExamples(examplesPath);
            OutputRenderer renderer = findRenderer(rendererId);

            GeneratorConfig generatorConfig = new GeneratorConfig(
                config.emitter().toEmitterOptions(),
                config.output().examplesEnabled(),
                config.packaging().toGeneratorSettings()
            );
            GeneratedOutput output = new SdkCodeGenerator(generatorConfig).generate(plan);
            System.out.println("✓ Generated " + output.files().size() + " source files");

            if (!noDocs && config.output().docsEnabled()) {
                DocumentationConfig docsConfig = DocumentationConfig.fromPlan(plan)
                    .withLinks(config.documentation().repositoryUrl(), config.documentation().docsBaseUrl());
                GeneratedOutput docs = new DocumentationGenerator()
                    .generateAll(DocumentationContext.from(docsConfig, plan, examples))
                    .toOutput();
                System.out.println("✓ Generated " + docs.files().size() + " documentation files");
                output = output.merge(docs);
            } else {
                log.info("Documentation generation disabled");
            }

            String directory = outputDir != null ? outputDir.toString() : config.output().directoryOrDefault();
            renderer.render(output, new RenderContext(directory, rendererSettings(config)));
            System.out.println("✓ Rendered " + output.files().size() + " files with " + renderer.getId()
                + " renderer" + (FileSystemRenderer.ID.equals(renderer.getId()) ? " to: " + directory : ""));
            return 0;
        } catch (CodeGenerationException | IllegalStateException | IllegalArgumentException e) {
            log.error("Generation failed: {}", e.getMessage());
            log.debug("Generation failure details", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private Map<String, String> rendererSettings(ProjectConfig config) {
        Map<String, String> settings = new HashMap<>(config.output().toRendererSettings());
        if (noColor) {
            settings.put("console.colors", "false");
        }
        return settings;
    }

    static OutputRenderer findRenderer(String id) {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        log.debug("Discovered {} output renderers", renderers.size());

        return renderers.stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown renderer '" + id + "'. Available: "
                + renderers.stream().map(OutputRenderer::getId).collect(Collectors.joining(", "))));
    }
}

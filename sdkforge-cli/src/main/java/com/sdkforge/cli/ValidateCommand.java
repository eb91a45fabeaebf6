package com.sdkforge.cli;

import com.sdkforge.SdkForgeCLI;
import com.sdkforge.core.config.DesignPlanLoader;
import com.sdkforge.core.error.CodeGenerationException;
import com.sdkforge.core.generator.GeneratorConfig;
import com.sdkforge.core.generator.SdkCodeGenerator;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.renderer.GeneratedOutput;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Command to check a design plan without writing anything.
 *
 * <p>Runs every builder and the emitter over the plan in memory and reports the first
 * construction or rendering error.
 */
@Command(
    name = "validate",
    description = "Check that a design plan is complete enough to generate an SDK",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private SdkForgeCLI parent;

    @Option(names = {"-p", "--plan"}, description = "Design plan JSON file", required = true)
    private Path planPath;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        try {
            DesignPlan plan = DesignPlanLoader.load(planPath);
            GeneratedOutput output = new SdkCodeGenerator(GeneratorConfig.defaults()).generate(plan);
            System.out.println("✓ Plan is valid: " + plan.methods().size() + " method(s), "
                + output.files().size() + " file(s) would be generated");
            return 0;
        } catch (CodeGenerationException | IllegalStateException e) {
            log.error("Validation failed: {}", e.getMessage());
            System.err.println("✗ Invalid plan: " + e.getMessage());
            return 1;
        }
    }
}

package com.sdkforge.core.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sdkforge.core.ast.SdkAst.Binding;
import com.sdkforge.core.ast.SdkAst.CallExpression;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.Declaration;
import com.sdkforge.core.ast.SdkAst.ExpressionStatement;
import com.sdkforge.core.ast.SdkAst.AwaitExpression;
import com.sdkforge.core.ast.SdkAst.FunctionDeclaration;
import com.sdkforge.core.ast.SdkAst.Import;
import com.sdkforge.core.ast.SdkAst.ImportName;
import com.sdkforge.core.ast.SdkAst.Literal;
import com.sdkforge.core.ast.SdkAst.NewExpression;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Program;
import com.sdkforge.core.ast.SdkAst.Statement;
import com.sdkforge.core.ast.SdkAst.VariableDeclaration;
import com.sdkforge.core.builder.ClientClassBuilder;
import com.sdkforge.core.builder.ConfigurationBuilder;
import com.sdkforge.core.builder.ErrorTypeBuilder;
import com.sdkforge.core.builder.TypeDefinitionBuilder;
import com.sdkforge.core.emitter.CodeEmitter;
import com.sdkforge.core.emitter.TypeScriptEmitter;
import com.sdkforge.core.error.CodeGenerationException;
import com.sdkforge.core.error.PlanConstructionException;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.ParameterDescriptor;
import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the source files of an SDK from a design plan.
 *
 * <p>Every file is one {@link Program} assembled from the declaration builders and rendered
 * by the configured {@link CodeEmitter}:
 * <ul>
 *   <li>{@code lib/client.ts} - imports and the client class</li>
 *   <li>{@code lib/errors.ts} - the error hierarchy</li>
 *   <li>{@code lib/config.ts} - configuration interfaces and defaults factory</li>
 *   <li>{@code lib/types.ts} - runtime support types and plan types</li>
 *   <li>{@code examples/basic.ts} - usage example, when enabled</li>
 *   <li>{@code package.json} - package manifest</li>
 * </ul>
 *
 * <p>Generation is all-or-nothing: a construction or malformed-node error aborts the run
 * and no partial output is returned.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * SdkCodeGenerator generator = new SdkCodeGenerator(GeneratorConfig.defaults());
 * GeneratedOutput output = generator.generate(plan);
 * }</pre>
 */
public class SdkCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SdkCodeGenerator.class);

    public static final String CLIENT_FILE = "lib/client";
    public static final String ERRORS_FILE = "lib/errors";
    public static final String CONFIG_FILE = "lib/config";
    public static final String TYPES_FILE = "lib/types";
    public static final String EXAMPLE_FILE = "examples/basic";
    public static final String PACKAGE_FILE = "package.json";

    private static final String HTTP_MODULE = "./http";
    private static final String DEFAULT_SCOPE = "";
    private static final String DEFAULT_LICENSE = "MIT";

    private final CodeEmitter emitter;
    private final GeneratorConfig config;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SdkCodeGenerator(GeneratorConfig config) {
        this(new TypeScriptEmitter(config.emitterOptions()), config);
    }

    public SdkCodeGenerator(CodeEmitter emitter, GeneratorConfig config) {
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Generates all SDK source files for {@code plan}.
     *
     * @param plan design plan
     * @return generated files in a fixed order
     * @throws PlanConstructionException if the plan or one of its fragments is incomplete
     * @throws com.sdkforge.core.error.MalformedNodeException if a built node cannot be rendered
     */
    public GeneratedOutput generate(DesignPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        validatePlan(plan);

        if (!emitter.id().equalsIgnoreCase(plan.targetLanguageId())) {
            log.warn("Plan targets '{}' but the configured emitter produces '{}'; generating {} sources",
                plan.targetLanguageId(), emitter.id(), emitter.id());
        }

        List<GeneratedFile> files = new ArrayList<>();
        files.add(emit(CLIENT_FILE, clientProgram(plan)));
        files.add(emit(ERRORS_FILE, new Program(ErrorTypeBuilder.build(plan))));
        files.add(emit(CONFIG_FILE, configProgram(plan)));
        files.add(emit(TYPES_FILE, typesProgram(plan)));
        if (config.generateExamples()) {
            files.add(emit(EXAMPLE_FILE, exampleProgram(plan)));
        }
        files.add(new GeneratedFile(PACKAGE_FILE, packageJson(plan), "application/json"));

        log.info("Generated {} source files for {}", files.size(), plan.product().name());
        return new GeneratedOutput(files);
    }

    /**
     * Checks the plan-level fields every file depends on.
     *
     * @param plan design plan
     * @throws PlanConstructionException if the product name, client class name or methods are missing
     */
    public static void validatePlan(DesignPlan plan) {
        String productName = plan.product() != null ? plan.product().name() : null;
        if (productName == null || productName.isBlank()) {
            throw new PlanConstructionException("plan", "<root>", "product.name");
        }
        if (plan.client() == null || plan.client().className() == null || plan.client().className().isBlank()) {
            throw new PlanConstructionException("plan", productName, "client.className");
        }
        if (plan.methods().isEmpty()) {
            throw new PlanConstructionException("plan", productName, "methods");
        }
    }

    private GeneratedFile emit(String basePath, Program program) {
        String path = basePath + "." + emitter.fileExtension();
        String content = emitter.emitProgram(program);
        log.info("Emitted {} ({} declarations, {} chars)", path, program.declarations().size(), content.length());
        return new GeneratedFile(path, content, GeneratedFile.TYPESCRIPT);
    }

    private Program clientProgram(DesignPlan plan) {
        ClassDeclaration client = ClientClassBuilder.build(plan);
        return new Program(List.of(
            importing("./errors", ErrorTypeBuilder.BASE_ERROR, ErrorTypeBuilder.CONFIG_ERROR,
                ErrorTypeBuilder.NETWORK_ERROR, ErrorTypeBuilder.API_ERROR),
            importing("./config", "ClientConfig"),
            importing("./types", "APIResponse", "AuthHandler", "BearerAuthHandler"),
            importing(HTTP_MODULE, "HttpClient", "createHttpClient"),
            client
        ));
    }

    private Program configProgram(DesignPlan plan) {
        List<Declaration> declarations = new ArrayList<>();
        declarations.add(importing("./types", "Logger"));
        declarations.addAll(ConfigurationBuilder.build(plan));
        return new Program(declarations);
    }

    private Program typesProgram(DesignPlan plan) {
        List<Declaration> declarations = new ArrayList<>(TypeDefinitionBuilder.buildSupportTypes());
        plan.types().forEach(type -> declarations.add(TypeDefinitionBuilder.build(type)));
        return new Program(declarations);
    }

    private Program exampleProgram(DesignPlan plan) {
        String className = plan.client().className();
        MethodDescriptor first = plan.methods().get(0);
        List<Operand> arguments = first.parameters().stream()
            .filter(p -> !p.optional())
            .map(ParameterDescriptor::exampleValue)
            .map(Operand::raw)
            .toList();

        CallExpression call = new CallExpression(Operand.raw("client." + first.name()), arguments);
        List<Statement> body = List.of(
            new VariableDeclaration(Binding.CONST, "config", "ClientConfig",
                CallExpression.of("createDefaultConfig", "\"your-api-key\"")),
            new VariableDeclaration(Binding.CONST, "client", className, NewExpression.of(className, "config")),
            new VariableDeclaration(Binding.CONST, "result", null,
                first.async() ? new AwaitExpression(call) : call),
            new ExpressionStatement(new CallExpression(Operand.raw("console.log"),
                List.of(Operand.of(Literal.string("Result:")), Operand.raw("result"))))
        );

        FunctionDeclaration main = new FunctionDeclaration("main", true, true, List.of(), "Promise<void>",
            body, "Example usage of " + className);
        return new Program(List.of(
            importing("../" + CLIENT_FILE, className),
            importing("../" + CONFIG_FILE, "ClientConfig", "createDefaultConfig"),
            main
        ));
    }

    private String packageJson(DesignPlan plan) {
        String scope = config.getSettingOrDefault("package.scope", DEFAULT_SCOPE);
        ObjectNode pkg = mapper.createObjectNode();
        pkg.put("name", scope.isEmpty() ? plan.product().name() : scope + "/" + plan.product().name());
        pkg.put("version", plan.product().version());
        pkg.put("description", plan.product().description());
        pkg.put("main", "dist/" + CLIENT_FILE + ".js");
        pkg.put("types", "dist/" + CLIENT_FILE + ".d.ts");
        pkg.put("license", config.getSettingOrDefault("package.license", DEFAULT_LICENSE));
        ObjectNode scripts = pkg.putObject("scripts");
        scripts.put("build", "tsc");
        scripts.put("test", "jest");
        ObjectNode devDependencies = pkg.putObject("devDependencies");
        devDependencies.put("typescript", "^5.0.0");
        devDependencies.put("jest", "^29.0.0");
        try {
            return mapper.writeValueAsString(pkg) + "\n";
        } catch (JsonProcessingException e) {
            throw new CodeGenerationException("Failed to serialize " + PACKAGE_FILE, e);
        }
    }

    private static Import importing(String source, String... names) {
        return new Import(source, Stream.of(names).map(ImportName::of).toList());
    }
}

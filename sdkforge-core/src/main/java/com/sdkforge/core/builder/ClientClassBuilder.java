package com.sdkforge.core.builder;

import static com.sdkforge.core.builder.AstShortcuts.assign;
import static com.sdkforge.core.builder.AstShortcuts.param;
import static com.sdkforge.core.builder.AstShortcuts.privateField;
import static com.sdkforge.core.builder.AstShortcuts.requireField;
import static com.sdkforge.core.builder.AstShortcuts.returns;
import static com.sdkforge.core.builder.AstShortcuts.throwNew;

import com.sdkforge.core.ast.DocComment;
import com.sdkforge.core.ast.SdkAst.BinaryExpression;
import com.sdkforge.core.ast.SdkAst.Binding;
import com.sdkforge.core.ast.SdkAst.CallExpression;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.ConditionalExpression;
import com.sdkforge.core.ast.SdkAst.Constructor;
import com.sdkforge.core.ast.SdkAst.Literal;
import com.sdkforge.core.ast.SdkAst.IfStatement;
import com.sdkforge.core.ast.SdkAst.MemberExpression;
import com.sdkforge.core.ast.SdkAst.MethodDeclaration;
import com.sdkforge.core.ast.SdkAst.NewExpression;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Parameter;
import com.sdkforge.core.ast.SdkAst.PropertyDeclaration;
import com.sdkforge.core.ast.SdkAst.Statement;
import com.sdkforge.core.ast.SdkAst.UnaryExpression;
import com.sdkforge.core.ast.SdkAst.VariableDeclaration;
import com.sdkforge.core.error.PlanConstructionException;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.MethodDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the SDK entry-point client class.
 *
 * <p>The class holds three private properties ({@code config}, {@code httpClient},
 * {@code authHandler}), a constructor taking a {@code ClientConfig}, one public method per
 * plan method in plan order, then the private helpers {@code validateConfig},
 * {@code initializeAuth} and {@code handleError}. A plan method may not reuse a helper name
 * or {@code constructor}.
 */
public final class ClientClassBuilder {

    private static final Logger log = LoggerFactory.getLogger(ClientClassBuilder.class);

    static final String CONFIG_TYPE = "ClientConfig";
    static final String HTTP_CLIENT_TYPE = "HttpClient";
    static final String AUTH_HANDLER_TYPE = "AuthHandler | null";

    static final Set<String> RESERVED_METHOD_NAMES =
        Set.of("constructor", "validateConfig", "initializeAuth", "handleError");

    private ClientClassBuilder() {
        // Utility class
    }

    /**
     * Builds the client class for {@code plan}.
     *
     * @param plan design plan
     * @return exported client class declaration
     * @throws PlanConstructionException if the client class name or any
     *         method field is missing, or a method reuses a reserved name
     */
    public static ClassDeclaration build(DesignPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        String productName = plan.product() != null && plan.product().name() != null
            ? plan.product().name()
            : "<product>";
        String className = requireField(
            plan.client() != null ? plan.client().className() : null,
            "client", productName, "className");

        List<MethodDeclaration> methods = new ArrayList<>();
        List<MethodDescriptor> descriptors = plan.methods();
        for (int i = 0; i < descriptors.size(); i++) {
            MethodDeclaration method = MethodBuilder.build(descriptors.get(i), className, i);
            if (RESERVED_METHOD_NAMES.contains(method.name())) {
                throw new PlanConstructionException(MethodBuilder.ENTITY, className + "." + method.name(), "name",
                    "is reserved for the generated client");
            }
            methods.add(method);
        }
        methods.add(validateConfig(plan.auth().required()));
        methods.add(initializeAuth());
        methods.add(handleError());

        List<PropertyDeclaration> properties = List.of(
            privateField("config", CONFIG_TYPE),
            privateField("httpClient", HTTP_CLIENT_TYPE),
            privateField("authHandler", AUTH_HANDLER_TYPE)
        );

        log.debug("Built client class {} with {} API methods", className, descriptors.size());
        return new ClassDeclaration(
            className,
            null,
            List.of(),
            properties,
            constructor(),
            methods,
            true,
            "Main SDK client for " + productName + ".\n\n"
                + "Initialize with configuration and use methods to interact with the API."
        );
    }

    private static Constructor constructor() {
        List<Statement> body = List.of(
            new VariableDeclaration(Binding.CONST, "validated", CONFIG_TYPE,
                CallExpression.of("this.validateConfig", "config")),
            assign("this.config", "validated"),
            assign("this.httpClient", CallExpression.of("createHttpClient", "validated")),
            assign("this.authHandler", CallExpression.of("this.initializeAuth"))
        );
        return new Constructor(List.of(param("config", CONFIG_TYPE)), body);
    }

    private static MethodDeclaration validateConfig(boolean authRequired) {
        List<Statement> body = new ArrayList<>();
        if (authRequired) {
            body.add(new IfStatement(
                new UnaryExpression("!", Operand.of(MemberExpression.of("config", "apiKey"))),
                List.of(throwNew("ConfigError", "\"Missing required apiKey configuration\"")),
                List.of()
            ));
        }
        body.add(new IfStatement(
            new BinaryExpression(
                Operand.of(new BinaryExpression(Operand.raw("config.timeout"), "!==", Operand.raw("undefined"))),
                "&&",
                Operand.of(new BinaryExpression(Operand.raw("config.timeout"), "<=", Operand.raw("0")))),
            List.of(throwNew("ConfigError", "\"timeout must be a positive number of milliseconds\"")),
            List.of()
        ));
        body.add(returns("config"));
        return privateMethod("validateConfig", List.of(param("config", CONFIG_TYPE)), CONFIG_TYPE, body,
            "Validate configuration and fail fast on missing required values");
    }

    private static MethodDeclaration initializeAuth() {
        List<Statement> body = List.of(
            new IfStatement(
                new UnaryExpression("!", Operand.of(MemberExpression.of("this.config", "apiKey"))),
                List.of(returns(new Literal("null"))),
                List.of()
            ),
            returns(NewExpression.of("BearerAuthHandler", "this.config.apiKey"))
        );
        return privateMethod("initializeAuth", List.of(), AUTH_HANDLER_TYPE, body,
            "Create the auth handler for the configured credentials");
    }

    private static MethodDeclaration handleError() {
        List<Statement> body = List.of(
            new IfStatement(
                new BinaryExpression(Operand.raw("error"), "instanceof", Operand.raw("SDKError")),
                List.of(returns("error")),
                List.of()
            ),
            new VariableDeclaration(Binding.CONST, "message", "string", new ConditionalExpression(
                new BinaryExpression(Operand.raw("error"), "instanceof", Operand.raw("Error")),
                MemberExpression.of("error", "message"),
                CallExpression.of("String", "error")
            )),
            returns(NewExpression.of("NetworkError", "message"))
        );
        return privateMethod("handleError", List.of(param("error", "unknown")), "SDKError", body,
            "Wrap unexpected failures in an SDK error");
    }

    private static MethodDeclaration privateMethod(String name, List<Parameter> parameters,
                                                   String returnType, List<Statement> body, String description) {
        return new MethodDeclaration(name, parameters, returnType, body, false, true, DocComment.of(description));
    }
}

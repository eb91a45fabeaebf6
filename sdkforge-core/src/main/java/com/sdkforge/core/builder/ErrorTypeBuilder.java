package com.sdkforge.core.builder;

import static com.sdkforge.core.builder.AstShortcuts.assign;
import static com.sdkforge.core.builder.AstShortcuts.callStatement;
import static com.sdkforge.core.builder.AstShortcuts.optionalParam;
import static com.sdkforge.core.builder.AstShortcuts.param;
import static com.sdkforge.core.builder.AstShortcuts.readonlyField;
import static com.sdkforge.core.builder.AstShortcuts.requireField;
import static com.sdkforge.core.builder.AstShortcuts.returns;

import com.sdkforge.core.ast.DocComment;
import com.sdkforge.core.ast.SdkAst.BinaryExpression;
import com.sdkforge.core.ast.SdkAst.CallExpression;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.Constructor;
import com.sdkforge.core.ast.SdkAst.Declaration;
import com.sdkforge.core.ast.SdkAst.ExpressionStatement;
import com.sdkforge.core.ast.SdkAst.Literal;
import com.sdkforge.core.ast.SdkAst.MethodDeclaration;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Parameter;
import com.sdkforge.core.error.PlanConstructionException;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.ErrorDescriptor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the SDK error hierarchy.
 *
 * <p>Output order: the base {@code SDKError}, the category markers {@code ConfigError},
 * {@code NetworkError} and {@code APIError}, then one class per plan error descriptor.
 * Descriptor classes are named after their code ({@code validation_failed} becomes
 * {@code ValidationFailedError}) and pass that code and status to the base class. A code
 * whose class name is already taken, by a built-in class or by an earlier descriptor, is
 * rejected.
 */
public final class ErrorTypeBuilder {

    public static final String BASE_ERROR = "SDKError";
    public static final String CONFIG_ERROR = "ConfigError";
    public static final String NETWORK_ERROR = "NetworkError";
    public static final String API_ERROR = "APIError";

    private static final String ENTITY = "error";

    // Built-in class names plus the global Error they extend
    private static final Set<String> BUILT_IN_NAMES =
        Set.of("Error", BASE_ERROR, CONFIG_ERROR, NETWORK_ERROR, API_ERROR);

    private ErrorTypeBuilder() {
        // Utility class
    }

    /**
     * Builds all error declarations for {@code plan}.
     *
     * @param plan design plan
     * @return error class declarations in emission order
     * @throws PlanConstructionException if a descriptor has no usable code or two classes
     *         would share a name
     */
    public static List<Declaration> build(DesignPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        List<Declaration> declarations = new ArrayList<>();
        declarations.add(baseError());
        declarations.add(configError());
        declarations.add(networkError());
        declarations.add(apiError());

        Map<String, String> declaredBy = new HashMap<>();
        BUILT_IN_NAMES.forEach(name -> declaredBy.put(name, "built-in"));
        List<ErrorDescriptor> errors = plan.errors();
        for (int i = 0; i < errors.size(); i++) {
            ClassDeclaration error = buildDescriptorError(errors.get(i), i);
            String previous = declaredBy.putIfAbsent(error.name(), errors.get(i).code());
            if (previous != null) {
                throw new PlanConstructionException(ENTITY, errors.get(i).code(), "code",
                    "derives class name " + error.name() + ", already declared by " + previous);
            }
            declarations.add(error);
        }
        return declarations;
    }

    /**
     * Builds the class for one error descriptor.
     *
     * @param error error descriptor
     * @param position zero-based position in the plan, used when the code is missing
     * @return error class declaration
     * @throws PlanConstructionException if the code is missing or has no identifier characters
     */
    public static ClassDeclaration buildDescriptorError(ErrorDescriptor error, int position) {
        Objects.requireNonNull(error, "error must not be null");
        String code = requireField(error.code(), ENTITY, "#" + position, "code");
        String className = error.className();
        if (className.isEmpty()) {
            throw new PlanConstructionException(ENTITY, "#" + position, "code",
                "has no letters or digits to derive a class name from");
        }
        String message = error.description() != null && !error.description().isBlank()
            ? error.description()
            : code;
        String status = error.statusCode() > 0 ? String.valueOf(error.statusCode()) : "undefined";

        Constructor constructor = new Constructor(
            List.of(optionalParam("message", "string")),
            List.of(new ExpressionStatement(new CallExpression(Operand.raw("super"), List.of(
                Operand.of(new BinaryExpression(Operand.raw("message"), "??", Operand.of(Literal.string(message)))),
                Operand.of(Literal.string(code)),
                Operand.raw(status)
            ))))
        );

        return new ClassDeclaration(
            className,
            BASE_ERROR,
            List.of(),
            List.of(),
            constructor,
            List.of(),
            true,
            documentation(error, message)
        );
    }

    private static String documentation(ErrorDescriptor error, String message) {
        StringBuilder doc = new StringBuilder(message);
        if (error.cause() != null && !error.cause().isBlank()) {
            doc.append("\n\nCause: ").append(error.cause());
        }
        if (error.remedy() != null && !error.remedy().isBlank()) {
            doc.append("\nRemedy: ").append(error.remedy());
        }
        return doc.toString();
    }

    private static ClassDeclaration baseError() {
        Constructor constructor = new Constructor(
            List.of(param("message", "string"), param("code", "string"), optionalParam("statusCode", "number")),
            List.of(
                callStatement("super", "message"),
                assign("this.name", "new.target.name"),
                assign("this.code", "code"),
                assign("this.statusCode", "statusCode"),
                assign("this.context", "{}")
            )
        );
        MethodDeclaration withContext = new MethodDeclaration(
            "withContext",
            List.of(param("context", "Record<string, unknown>")),
            "this",
            List.of(callStatement("Object.assign", "this.context", "context"), returns("this")),
            false,
            false,
            DocComment.of("Attach diagnostic context and return this error")
        );
        return new ClassDeclaration(
            BASE_ERROR,
            "Error",
            List.of(),
            List.of(
                readonlyField("code", "string"),
                readonlyField("statusCode", "number | undefined"),
                readonlyField("context", "Record<string, unknown>")
            ),
            constructor,
            List.of(withContext),
            true,
            "Base error for all SDK errors"
        );
    }

    private static ClassDeclaration configError() {
        return marker(CONFIG_ERROR, "Error thrown when configuration is invalid",
            List.of(param("message", "string")), "message", "\"CONFIG_ERROR\"", "400");
    }

    private static ClassDeclaration networkError() {
        return marker(NETWORK_ERROR, "Error thrown when a network request fails",
            List.of(param("message", "string"), optionalParam("statusCode", "number")),
            "message", "\"NETWORK_ERROR\"", "statusCode");
    }

    private static ClassDeclaration apiError() {
        Constructor constructor = new Constructor(
            List.of(param("message", "string"), param("code", "string"), param("statusCode", "number"),
                optionalParam("requestId", "string")),
            List.of(
                callStatement("super", "message", "code", "statusCode"),
                assign("this.requestId", "requestId")
            )
        );
        return new ClassDeclaration(API_ERROR, BASE_ERROR, List.of(),
            List.of(readonlyField("requestId", "string | undefined")),
            constructor, List.of(), true, "Error returned by the API");
    }

    private static ClassDeclaration marker(String name, String documentation,
                                           List<Parameter> parameters,
                                           String... superArguments) {
        Constructor constructor = new Constructor(parameters, List.of(callStatement("super", superArguments)));
        return new ClassDeclaration(name, BASE_ERROR, List.of(), List.of(), constructor, List.of(), true, documentation);
    }
}

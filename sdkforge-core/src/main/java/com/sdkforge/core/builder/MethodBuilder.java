package com.sdkforge.core.builder;

import static com.sdkforge.core.builder.AstShortcuts.requireField;
import static com.sdkforge.core.builder.AstShortcuts.throwNew;

import com.sdkforge.core.ast.DocComment;
import com.sdkforge.core.ast.SdkAst.AwaitExpression;
import com.sdkforge.core.ast.SdkAst.BinaryExpression;
import com.sdkforge.core.ast.SdkAst.Binding;
import com.sdkforge.core.ast.SdkAst.CallExpression;
import com.sdkforge.core.ast.SdkAst.CatchClause;
import com.sdkforge.core.ast.SdkAst.Expression;
import com.sdkforge.core.ast.SdkAst.IfStatement;
import com.sdkforge.core.ast.SdkAst.Literal;
import com.sdkforge.core.ast.SdkAst.MemberExpression;
import com.sdkforge.core.ast.SdkAst.MethodDeclaration;
import com.sdkforge.core.ast.SdkAst.ObjectExpression;
import com.sdkforge.core.ast.SdkAst.ObjectProperty;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Parameter;
import com.sdkforge.core.ast.SdkAst.ReturnStatement;
import com.sdkforge.core.ast.SdkAst.Statement;
import com.sdkforge.core.ast.SdkAst.ThrowStatement;
import com.sdkforge.core.ast.SdkAst.TryCatchStatement;
import com.sdkforge.core.ast.SdkAst.VariableDeclaration;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.ParameterDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds one client method from a method descriptor.
 *
 * <p>The emitted signature and the parameter documentation are both taken from the same
 * descriptor entries, so parameter names, types, optionality and order always match what the
 * documentation shows.
 *
 * <p><b>Generated body:</b>
 * <pre>{@code
 * const url: string = this.config.baseUrl + "/balance";
 * if (this.authHandler === null) {            // only when the method requires auth
 *   throw new ConfigError("...");
 * }
 * try {
 *   const response: APIResponse<number> = await this.httpClient.get(url, { address: address });
 *   return response.data;
 * } catch (error) {
 *   throw this.handleError(error);
 * }
 * }</pre>
 */
public final class MethodBuilder {

    static final String ENTITY = "method";
    private static final String DEFAULT_HTTP_METHOD = "get";
    private static final String PROMISE_PREFIX = "Promise<";

    private MethodBuilder() {
        // Utility class
    }

    /**
     * Builds a method declaration for {@code method}.
     *
     * @param method method descriptor
     * @param clientName owning client class name, used in error identifiers
     * @return method declaration
     * @throws com.sdkforge.core.error.PlanConstructionException if the name, return type or
     *         a parameter name/type is missing
     */
    public static MethodDeclaration build(MethodDescriptor method, String clientName) {
        return build(method, clientName, -1);
    }

    /**
     * Builds a method declaration for the method at {@code position} of the plan.
     *
     * @param method method descriptor
     * @param clientName owning client class name
     * @param position zero-based position in the plan, or -1 when unknown
     * @return method declaration
     */
    public static MethodDeclaration build(MethodDescriptor method, String clientName, int position) {
        Objects.requireNonNull(method, "method must not be null");
        String owner = clientName != null ? clientName : "<client>";
        String positionId = owner + (position >= 0 ? "#" + position : "#?");

        String name = requireField(method.name(), ENTITY, positionId, "name");
        String methodId = owner + "." + name;
        String returnType = requireField(method.returnType(), ENTITY, methodId, "returnType");

        List<Parameter> parameters = new ArrayList<>();
        List<DocComment.ParamDoc> paramDocs = new ArrayList<>();
        List<ParameterDescriptor> descriptors = method.parameters();
        for (int i = 0; i < descriptors.size(); i++) {
            ParameterDescriptor descriptor = descriptors.get(i);
            String parameterId = methodId + "(#" + i + ")";
            String parameterName = requireField(descriptor.name(), "parameter", parameterId, "name");
            String parameterType = requireField(descriptor.type(), "parameter", parameterId, "type");
            parameters.add(new Parameter(parameterName, parameterType, descriptor.optional()));
            paramDocs.add(new DocComment.ParamDoc(parameterName, parameterType, descriptor.description()));
        }

        String description = method.description() != null && !method.description().isBlank()
            ? method.description()
            : "Call " + name;
        DocComment documentation = new DocComment(
            description,
            paramDocs,
            new DocComment.ReturnDoc(returnType, "Result from " + name),
            List.of("SDKError"),
            false,
            null
        );

        return new MethodDeclaration(
            name,
            parameters,
            method.async() ? promiseOf(returnType) : returnType,
            body(method, parameters, returnType),
            method.async(),
            false,
            documentation
        );
    }

    private static List<Statement> body(MethodDescriptor method, List<Parameter> parameters, String returnType) {
        List<Statement> body = new ArrayList<>();

        String endpoint = method.endpoint() != null && !method.endpoint().isBlank() ? method.endpoint() : "/";
        body.add(new VariableDeclaration(
            Binding.CONST,
            "url",
            "string",
            new BinaryExpression(
                Operand.of(MemberExpression.of("this.config", "baseUrl")),
                "+",
                Operand.of(Literal.string(endpoint))
            )
        ));

        if (method.requiresAuth()) {
            body.add(new IfStatement(
                new BinaryExpression(Operand.raw("this.authHandler"), "===", Operand.raw("null")),
                List.of(throwNew("ConfigError", "\"Authentication is required but not configured\"")),
                List.of()
            ));
        }

        List<Operand> arguments = new ArrayList<>();
        arguments.add(Operand.raw("url"));
        if (!parameters.isEmpty()) {
            List<ObjectProperty> payload = parameters.stream()
                .map(p -> ObjectProperty.raw(p.name(), p.name()))
                .toList();
            arguments.add(Operand.of(new ObjectExpression(payload)));
        }
        String verb = method.httpMethod() != null && !method.httpMethod().isBlank()
            ? method.httpMethod().toLowerCase(Locale.ROOT)
            : DEFAULT_HTTP_METHOD;
        Expression call = new CallExpression(Operand.raw("this.httpClient." + verb), arguments);
        if (method.async()) {
            call = new AwaitExpression(call);
        }

        List<Statement> tryBlock = List.of(
            new VariableDeclaration(Binding.CONST, "response", "APIResponse<" + unwrapPromise(returnType) + ">", call),
            new ReturnStatement(MemberExpression.of("response", "data"))
        );
        CatchClause handler = new CatchClause("error", List.of(
            new ThrowStatement(CallExpression.of("this.handleError", "error"))
        ));
        body.add(new TryCatchStatement(tryBlock, handler, null));
        return body;
    }

    static String promiseOf(String type) {
        return type.startsWith(PROMISE_PREFIX) ? type : PROMISE_PREFIX + type + ">";
    }

    private static String unwrapPromise(String type) {
        return type.startsWith(PROMISE_PREFIX) && type.endsWith(">")
            ? type.substring(PROMISE_PREFIX.length(), type.length() - 1)
            : type;
    }
}

package com.sdkforge.core.builder;

import com.sdkforge.core.ast.SdkAst.Declaration;
import com.sdkforge.core.ast.SdkAst.FunctionDeclaration;
import com.sdkforge.core.ast.SdkAst.InterfaceDeclaration;
import com.sdkforge.core.ast.SdkAst.Literal;
import com.sdkforge.core.ast.SdkAst.ObjectExpression;
import com.sdkforge.core.ast.SdkAst.ObjectProperty;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Parameter;
import com.sdkforge.core.ast.SdkAst.PropertyDeclaration;
import com.sdkforge.core.ast.SdkAst.ReturnStatement;
import com.sdkforge.core.model.AuthMethod;
import com.sdkforge.core.model.ClientSettings;
import com.sdkforge.core.model.DesignPlan;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the client configuration surface: the {@code ClientConfig} and {@code RetryPolicy}
 * interfaces and the exported {@code createDefaultConfig} factory that fills in defaults.
 */
public final class ConfigurationBuilder {

    public static final String DEFAULT_BASE_URL = "https://api.example.com";
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_BACKOFF_MULTIPLIER = 2;
    public static final int DEFAULT_INITIAL_DELAY_MS = 100;

    private ConfigurationBuilder() {
        // Utility class
    }

    /**
     * Builds the configuration declarations for {@code plan}.
     *
     * <p>{@code apiKey} is a required config property only when the plan requires
     * authentication.
     *
     * @param plan design plan
     * @return {@code ClientConfig}, {@code RetryPolicy} and {@code createDefaultConfig}, in order
     */
    public static List<Declaration> build(DesignPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        boolean authRequired = plan.auth().required();
        return List.of(
            clientConfig(authRequired),
            retryPolicy(),
            defaultConfigFactory(plan, authRequired)
        );
    }

    private static InterfaceDeclaration clientConfig(boolean authRequired) {
        String authTypes = Arrays.stream(AuthMethod.values())
            .map(method -> "\"" + method.id() + "\"")
            .collect(Collectors.joining(" | "));
        List<PropertyDeclaration> properties = List.of(
            PropertyDeclaration.field("apiKey", "string", !authRequired),
            PropertyDeclaration.field("baseUrl", "string", true),
            PropertyDeclaration.field("timeout", "number", true),
            PropertyDeclaration.field("authType", authTypes, true),
            PropertyDeclaration.field("retryPolicy", "RetryPolicy", true),
            PropertyDeclaration.field("logger", "Logger | null", true)
        );
        return new InterfaceDeclaration("ClientConfig", List.of(), properties, true, "Configuration for SDK client");
    }

    private static InterfaceDeclaration retryPolicy() {
        List<PropertyDeclaration> properties = List.of(
            PropertyDeclaration.field("maxRetries", "number", false),
            PropertyDeclaration.field("backoffMultiplier", "number", false),
            PropertyDeclaration.field("initialDelayMs", "number", false)
        );
        return new InterfaceDeclaration("RetryPolicy", List.of(), properties, true,
            "Configuration for automatic retries");
    }

    private static FunctionDeclaration defaultConfigFactory(DesignPlan plan, boolean authRequired) {
        ClientSettings client = plan.client();
        String baseUrl = client != null && client.baseUrl() != null && !client.baseUrl().isBlank()
            ? client.baseUrl()
            : DEFAULT_BASE_URL;
        long timeout = client != null && client.timeoutMs() > 0 ? client.timeoutMs() : DEFAULT_TIMEOUT_MS;

        ObjectExpression retry = new ObjectExpression(List.of(
            ObjectProperty.raw("maxRetries", String.valueOf(DEFAULT_MAX_RETRIES)),
            ObjectProperty.raw("backoffMultiplier", String.valueOf(DEFAULT_BACKOFF_MULTIPLIER)),
            ObjectProperty.raw("initialDelayMs", String.valueOf(DEFAULT_INITIAL_DELAY_MS))
        ));
        ObjectExpression config = new ObjectExpression(List.of(
            ObjectProperty.raw("apiKey", "apiKey"),
            new ObjectProperty("baseUrl", Operand.of(Literal.string(baseUrl))),
            ObjectProperty.raw("timeout", String.valueOf(timeout)),
            new ObjectProperty("authType", Operand.of(Literal.string(plan.auth().method().id()))),
            new ObjectProperty("retryPolicy", Operand.of(retry)),
            ObjectProperty.raw("logger", "null")
        ));

        return new FunctionDeclaration(
            "createDefaultConfig",
            false,
            true,
            List.of(new Parameter("apiKey", "string", !authRequired)),
            "ClientConfig",
            List.of(new ReturnStatement(config)),
            "Create a configuration object with sensible defaults"
        );
    }
}

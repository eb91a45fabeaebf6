package com.sdkforge.core.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sdkforge.core.TestPlans;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.Declaration;
import com.sdkforge.core.ast.SdkAst.Program;
import com.sdkforge.core.emitter.TypeScriptEmitter;
import com.sdkforge.core.error.PlanConstructionException;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.ErrorDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ErrorTypeBuilder}.
 */
class ErrorTypeBuilderTest {

    private final TypeScriptEmitter emitter = new TypeScriptEmitter();

    @Test
    void build_walletPlan_baseAndMarkersThenDescriptorClasses() {
        List<Declaration> declarations = ErrorTypeBuilder.build(TestPlans.walletPlan());

        assertThat(declarations)
            .allMatch(ClassDeclaration.class::isInstance)
            .extracting(declaration -> ((ClassDeclaration) declaration).name())
            .containsExactly("SDKError", "ConfigError", "NetworkError", "APIError",
                "ValidationFailedError", "AuthExpiredError");
    }

    @Test
    void emit_descriptorError_passesCodeAndStatusToBase() {
        ClassDeclaration error = ErrorTypeBuilder.buildDescriptorError(TestPlans.errors().get(0), 0);

        String source = emitter.emitProgram(new Program(List.of(error)));

        assertThat(source)
            .contains(" * Request parameters are invalid")
            .contains(" * Cause: A parameter is missing or malformed")
            .contains(" * Remedy: Check the parameter values")
            .contains("export class ValidationFailedError extends SDKError {")
            .contains("  constructor(message?: string) {")
            .contains("    super(message ?? \"Request parameters are invalid\", \"validation_failed\", 400);");
    }

    @Test
    void emit_descriptorWithoutStatus_passesUndefined() {
        ErrorDescriptor error = new ErrorDescriptor("RATE_LIMITED", "rate", null, null, null, null, 0);

        String source = emitter.emitProgram(new Program(List.of(ErrorTypeBuilder.buildDescriptorError(error, 2))));

        assertThat(source)
            .contains("export class RateLimitedError extends SDKError {")
            .contains("super(message ?? \"RATE_LIMITED\", \"RATE_LIMITED\", undefined);");
    }

    @Test
    void emit_baseError_hasContextSupport() {
        String source = emitter.emitProgram(new Program(ErrorTypeBuilder.build(TestPlans.minimalPlan())));

        assertThat(source)
            .contains("export class SDKError extends Error {")
            .contains("  readonly code: string;")
            .contains("  withContext(context: Record<string, unknown>): this {")
            .contains("    Object.assign(this.context, context);")
            .contains("export class NetworkError extends SDKError {")
            .contains("    super(message, \"NETWORK_ERROR\", statusCode);");
    }

    @Test
    void buildDescriptorError_missingCode_isRejected() {
        ErrorDescriptor error = new ErrorDescriptor(null, "validation", "Bad input", null, null, null, 400);

        assertThatThrownBy(() -> ErrorTypeBuilder.buildDescriptorError(error, 4))
            .isInstanceOfSatisfying(PlanConstructionException.class, e -> {
                assertThat(e.getEntityType()).isEqualTo("error");
                assertThat(e.getEntityId()).isEqualTo("#4");
                assertThat(e.getMissingField()).isEqualTo("code");
            });
    }

    @Test
    void build_codeMatchingBuiltInClass_isRejected() {
        DesignPlan plan = TestPlans.withErrors(TestPlans.walletPlan(), List.of(
            new ErrorDescriptor("network_error", "network", "Connection dropped", null, null, null, 503)));

        assertThatThrownBy(() -> ErrorTypeBuilder.build(plan))
            .isInstanceOfSatisfying(PlanConstructionException.class, e -> {
                assertThat(e.getEntityType()).isEqualTo("error");
                assertThat(e.getEntityId()).isEqualTo("network_error");
                assertThat(e.getMissingField()).isEqualTo("code");
            })
            .hasMessageContaining("NetworkError");
    }

    @Test
    void build_codeNamedError_isRejected() {
        DesignPlan plan = TestPlans.withErrors(TestPlans.minimalPlan(), List.of(
            new ErrorDescriptor("error", null, null, null, null, null, 0)));

        assertThatThrownBy(() -> ErrorTypeBuilder.build(plan))
            .isInstanceOf(PlanConstructionException.class)
            .hasMessageContaining("class name Error");
    }

    @Test
    void build_distinctCodesWithSameClassName_isRejected() {
        DesignPlan plan = TestPlans.withErrors(TestPlans.walletPlan(), List.of(
            new ErrorDescriptor("auth_expired", null, "Expired", null, null, null, 401),
            new ErrorDescriptor("auth-expired", null, "Expired again", null, null, null, 401)));

        assertThatThrownBy(() -> ErrorTypeBuilder.build(plan))
            .isInstanceOfSatisfying(PlanConstructionException.class, e ->
                assertThat(e.getEntityId()).isEqualTo("auth-expired"))
            .hasMessageContaining("AuthExpiredError")
            .hasMessageContaining("auth_expired");
    }

    @Test
    void buildDescriptorError_codeWithoutIdentifierCharacters_isRejected() {
        ErrorDescriptor error = new ErrorDescriptor("???", "validation", "Bad input", null, null, null, 400);

        assertThatThrownBy(() -> ErrorTypeBuilder.buildDescriptorError(error, 1))
            .isInstanceOfSatisfying(PlanConstructionException.class, e -> {
                assertThat(e.getEntityType()).isEqualTo("error");
                assertThat(e.getEntityId()).isEqualTo("#1");
                assertThat(e.getMissingField()).isEqualTo("code");
            });
    }
}

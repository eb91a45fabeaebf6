package com.sdkforge.core.docs.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.sdkforge.core.TestPlans;
import com.sdkforge.core.docs.DocumentationConfig;
import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.ErrorDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ErrorHandlingBuilder}.
 */
class ErrorHandlingBuilderTest {

    private final ErrorHandlingBuilder builder = new ErrorHandlingBuilder();

    @Test
    void build_groupsErrorsByCategory() {
        String guide = builder.build(context(TestPlans.walletPlan()));

        int authHeading = guide.indexOf("### Authentication & Authorization");
        int authExpired = guide.indexOf("#### auth_expired");
        int validationHeading = guide.indexOf("### Validation Errors");
        int validationFailed = guide.indexOf("#### validation_failed");

        assertThat(authHeading).isPositive();
        assertThat(authExpired).isGreaterThan(authHeading).isLessThan(validationHeading);
        assertThat(validationFailed).isGreaterThan(validationHeading);
        assertThat(guide).doesNotContain("## Common Error Types");
    }

    @Test
    void build_errorEntry_showsClassStatusAndRemedy() {
        String guide = builder.build(context(TestPlans.walletPlan()));

        assertThat(guide)
            .contains("**Error class:** `ValidationFailedError`")
            .contains("**HTTP status:** 400")
            .contains("**Description:** Request parameters are invalid")
            .contains("**Cause:** A parameter is missing or malformed")
            .contains("**Solution:** Check the parameter values");
    }

    @Test
    void build_missingFields_renderDash() {
        DesignPlan plan = TestPlans.withErrors(TestPlans.walletPlan(), List.of(
            new ErrorDescriptor("rate_exceeded", null, null, null, null, null, 0)));

        String guide = builder.build(context(plan));

        assertThat(guide)
            .contains("### Rate Limiting\n\n#### rate_exceeded")
            .contains("**Cause:** -")
            .doesNotContain("**HTTP status:**");
    }

    @Test
    void build_codeWithoutIdentifier_fallsBackToBaseClass() {
        DesignPlan plan = TestPlans.withErrors(TestPlans.walletPlan(), List.of(
            new ErrorDescriptor("???", "validation", "Unknown failure", null, null, null, 400)));

        String guide = builder.build(context(plan));

        assertThat(guide)
            .contains("**Error class:** `SDKError`")
            .contains("if (error instanceof SDKError) {")
            .doesNotContain("instanceof )");
    }

    @Test
    void build_errorExample_isFenced() {
        DesignPlan plan = TestPlans.withErrors(TestPlans.walletPlan(), List.of(
            new ErrorDescriptor("server_down", "server", "Service unavailable", null, "Retry later",
                "throw new ServerDownError();", 503)));

        String guide = builder.build(context(plan));

        assertThat(guide)
            .contains("### Server Errors")
            .contains("**Example:**\n\n```typescript\nthrow new ServerDownError();\n```");
    }

    @Test
    void build_errorDetection_branchesOnEveryErrorClass() {
        String guide = builder.build(context(TestPlans.walletPlan()));

        assertThat(guide)
            .contains("const result = await withRetry(() => client.getBalance());")
            .contains("  if (error instanceof ValidationFailedError) {\n    // Check the parameter values")
            .contains("  } else if (error instanceof AuthExpiredError) {");
    }

    @Test
    void build_noErrors_listsGenericTaxonomy() {
        String guide = builder.build(context(TestPlans.minimalPlan()));

        assertThat(guide)
            .startsWith("# Error Handling")
            .contains("## Common Error Types")
            .contains("### Network Errors")
            .contains("if (error instanceof SDKError) {")
            .contains("## Recovery Strategies")
            .contains("## Best Practices")
            .doesNotContain("## Error Types");
    }

    private static DocumentationContext context(DesignPlan plan) {
        return DocumentationContext.from(DocumentationConfig.fromPlan(plan), plan, null);
    }
}

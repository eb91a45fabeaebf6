package com.sdkforge.core.docs.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.sdkforge.core.TestPlans;
import com.sdkforge.core.docs.DocumentationConfig;
import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.ParameterDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ApiReferenceBuilder}.
 */
class ApiReferenceBuilderTest {

    private final ApiReferenceBuilder builder = new ApiReferenceBuilder();

    @Test
    void build_documentsEveryMethod() {
        String reference = builder.build(context(TestPlans.walletPlan()));

        assertThat(reference)
            .startsWith("# API Reference\n\nMethods of `WalletClient`.\n\n---\n\n## getBalance()")
            .contains("Get the balance of a wallet")
            .contains("| Name | Type | Required | Description |\n|------|------|------|------|\n")
            .contains("| `address` | `string` | Yes | Wallet address |")
            .contains("### Returns\n\n`number`")
            .contains("### Endpoint\n\n`GET /balance`")
            .contains("\n\n---\n\n## sendTransaction()")
            .contains("`Promise<Transaction>`")
            .contains("`POST /transactions`");
    }

    @Test
    void build_authRequirement_isNotedPerMethod() {
        String reference = builder.build(context(TestPlans.walletPlan()));

        String getBalance = reference.substring(0, reference.indexOf("## sendTransaction()"));
        assertThat(getBalance).doesNotContain("Requires authentication.");
        assertThat(reference).endsWith("Requires authentication.");
    }

    @Test
    void build_parameterTable_escapesPipesAndMarksOptional() {
        DesignPlan plan = TestPlans.withMethods(TestPlans.minimalPlan(), List.of(
            MethodDescriptor.of("lookup", null, List.of(
                new ParameterDescriptor("key", "string | number", true, null)), "string")));

        String reference = builder.build(context(plan));

        assertThat(reference)
            .contains("| `key` | `string \\| number` | No | - |")
            .doesNotContain("### Endpoint");
    }

    @Test
    void build_noMethods_showsPlaceholder() {
        DesignPlan plan = TestPlans.withMethods(TestPlans.minimalPlan(), List.of());

        assertThat(builder.build(context(plan))).isEqualTo("# API Reference\n\n" + ApiReferenceBuilder.NO_METHODS);
    }

    private static DocumentationContext context(DesignPlan plan) {
        return DocumentationContext.from(DocumentationConfig.fromPlan(plan), plan, null);
    }
}

package com.sdkforge.core.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sdkforge.core.TestPlans;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.MethodDeclaration;
import com.sdkforge.core.ast.SdkAst.Program;
import com.sdkforge.core.emitter.TypeScriptEmitter;
import com.sdkforge.core.error.PlanConstructionException;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.ParameterDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MethodBuilder}.
 */
class MethodBuilderTest {

    private final TypeScriptEmitter emitter = new TypeScriptEmitter();

    @Test
    void build_getBalance_rendersSignatureDocAndCallThrough() {
        MethodDeclaration method = MethodBuilder.build(TestPlans.getBalance(), "WalletClient");

        assertThat(emit(method)).contains(String.join("\n",
            "  /**",
            "   * Get the balance of a wallet",
            "   *",
            "   * @param {string} address Wallet address",
            "   * @returns {number} Result from getBalance",
            "   *",
            "   * @throws {SDKError}",
            "   */",
            "  getBalance(address: string): number {",
            "    const url: string = this.config.baseUrl + \"/balance\";",
            "    try {",
            "      const response: APIResponse<number> = this.httpClient.get(url, { address: address });",
            "      return response.data;",
            "    } catch (error) {",
            "      throw this.handleError(error);",
            "    }",
            "  }"
        ));
    }

    @Test
    void build_asyncMethodWithAuth_awaitsAndGuardsCredentials() {
        MethodDeclaration method = MethodBuilder.build(TestPlans.sendTransaction(), "WalletClient");

        assertThat(method.async()).isTrue();
        assertThat(method.returnType()).isEqualTo("Promise<Transaction>");
        assertThat(emit(method))
            .contains("  async sendTransaction(to: string, amount: number): Promise<Transaction> {")
            .contains("    if (this.authHandler === null) {")
            .contains("      throw new ConfigError(\"Authentication is required but not configured\");")
            .contains("      const response: APIResponse<Transaction> = "
                + "await this.httpClient.post(url, { to: to, amount: amount });");
    }

    @Test
    void build_asyncMethodAlreadyReturningPromise_isNotWrappedTwice() {
        MethodDescriptor descriptor = new MethodDescriptor("list", null, List.of(), "Promise<string[]>",
            true, null, null, false);

        MethodDeclaration method = MethodBuilder.build(descriptor, "C");

        assertThat(method.returnType()).isEqualTo("Promise<string[]>");
        assertThat(emit(method))
            .contains("   * Call list")
            .contains("const response: APIResponse<string[]> = await this.httpClient.get(url);")
            .contains("const url: string = this.config.baseUrl + \"/\";");
    }

    @Test
    void build_missingReturnType_namesMethodAndField() {
        MethodDescriptor descriptor = MethodDescriptor.of("getBalance", null, List.of(), null);

        assertThatThrownBy(() -> MethodBuilder.build(descriptor, "WalletClient"))
            .isInstanceOfSatisfying(PlanConstructionException.class, e -> {
                assertThat(e.getEntityType()).isEqualTo("method");
                assertThat(e.getEntityId()).isEqualTo("WalletClient.getBalance");
                assertThat(e.getMissingField()).isEqualTo("returnType");
            });
    }

    @Test
    void build_missingName_usesPosition() {
        MethodDescriptor descriptor = MethodDescriptor.of(null, null, List.of(), "number");

        assertThatThrownBy(() -> MethodBuilder.build(descriptor, "WalletClient", 3))
            .isInstanceOfSatisfying(PlanConstructionException.class, e -> {
                assertThat(e.getEntityId()).isEqualTo("WalletClient#3");
                assertThat(e.getMissingField()).isEqualTo("name");
            });
    }

    @Test
    void build_parameterWithoutType_isRejected() {
        MethodDescriptor descriptor = MethodDescriptor.of("getBalance", null,
            List.of(new ParameterDescriptor("address", null, false, null)), "number");

        assertThatThrownBy(() -> MethodBuilder.build(descriptor, "WalletClient"))
            .isInstanceOf(PlanConstructionException.class)
            .hasMessage("Cannot build parameter 'WalletClient.getBalance(#0)': missing required field 'type'");
    }

    private String emit(MethodDeclaration method) {
        ClassDeclaration holder = new ClassDeclaration("Holder", null, List.of(), List.of(), null,
            List.of(method), false, null);
        return emitter.emitProgram(new Program(List.of(holder)));
    }
}

package com.sdkforge.core.builder;

import static org.assertj.core.api.Assertions.assertThat;

import com.sdkforge.core.TestPlans;
import com.sdkforge.core.ast.SdkAst.Program;
import com.sdkforge.core.emitter.TypeScriptEmitter;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConfigurationBuilder}.
 */
class ConfigurationBuilderTest {

    private final TypeScriptEmitter emitter = new TypeScriptEmitter();

    @Test
    void build_authRequired_makesApiKeyMandatory() {
        String source = emitter.emitProgram(new Program(ConfigurationBuilder.build(TestPlans.walletPlan())));

        assertThat(source)
            .contains("export interface ClientConfig {")
            .contains("  apiKey: string;")
            .contains("  authType?: \"none\" | \"api-key\" | \"oauth\" | \"wallet\";")
            .contains("export interface RetryPolicy {")
            .contains("export function createDefaultConfig(apiKey: string): ClientConfig {");
    }

    @Test
    void build_usesPlanBaseUrlAndTimeout() {
        String source = emitter.emitProgram(new Program(ConfigurationBuilder.build(TestPlans.walletPlan())));

        assertThat(source).contains("  return { apiKey: apiKey, baseUrl: \"https://api.wallet.test\", timeout: 10000, "
            + "authType: \"api-key\", retryPolicy: { maxRetries: 3, backoffMultiplier: 2, initialDelayMs: 100 }, "
            + "logger: null };");
    }

    @Test
    void build_noAuthAndNoClientSettings_fallsBackToDefaults() {
        String source = emitter.emitProgram(new Program(ConfigurationBuilder.build(TestPlans.minimalPlan())));

        assertThat(source)
            .contains("  apiKey?: string;")
            .contains("export function createDefaultConfig(apiKey?: string): ClientConfig {")
            .contains("baseUrl: \"" + ConfigurationBuilder.DEFAULT_BASE_URL + "\"")
            .contains("timeout: " + ConfigurationBuilder.DEFAULT_TIMEOUT_MS + ",")
            .contains("authType: \"none\"");
    }
}

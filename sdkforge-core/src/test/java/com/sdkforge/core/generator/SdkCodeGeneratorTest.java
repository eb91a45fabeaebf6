package com.sdkforge.core.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sdkforge.core.TestPlans;
import com.sdkforge.core.emitter.EmitterOptions;
import com.sdkforge.core.error.PlanConstructionException;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SdkCodeGenerator}.
 */
class SdkCodeGeneratorTest {

    private final SdkCodeGenerator generator = new SdkCodeGenerator(GeneratorConfig.defaults());

    @Test
    void generate_walletPlan_producesFilesInFixedOrder() {
        GeneratedOutput output = generator.generate(TestPlans.walletPlan());

        assertThat(output.files()).extracting(GeneratedFile::relativePath).containsExactly(
            "lib/client.ts", "lib/errors.ts", "lib/config.ts", "lib/types.ts", "examples/basic.ts", "package.json");
    }

    @Test
    void generate_isDeterministic() {
        DesignPlan plan = TestPlans.walletPlan();

        assertThat(generator.generate(plan)).isEqualTo(generator.generate(plan));
    }

    @Test
    void generate_clientFile_importsSupportModulesBeforeClass() {
        String client = content(generator.generate(TestPlans.walletPlan()), "lib/client.ts");

        assertThat(client).startsWith(
            "import { SDKError, ConfigError, NetworkError, APIError } from \"./errors\";\n");
        assertThat(client)
            .contains("import { ClientConfig } from \"./config\";")
            .contains("import { HttpClient, createHttpClient } from \"./http\";")
            .contains("export class WalletClient {")
            .contains("  getBalance(address: string): number {");
    }

    @Test
    void generate_typesFile_containsPlanTypes() {
        String types = content(generator.generate(TestPlans.walletPlan()), "lib/types.ts");

        assertThat(types)
            .contains("export interface APIResponse<T> {")
            .contains("export interface Transaction {")
            .contains("  memo?: string;");
    }

    @Test
    void generate_example_callsFirstMethodWithPlaceholderArguments() {
        String example = content(generator.generate(TestPlans.walletPlan()), "examples/basic.ts");

        assertThat(example)
            .contains("import { WalletClient } from \"../lib/client\";")
            .contains("export async function main(): Promise<void> {")
            .contains("  const config: ClientConfig = createDefaultConfig(\"your-api-key\");")
            .contains("  const client: WalletClient = new WalletClient(config);")
            .contains("  const result = client.getBalance(\"address\");")
            .contains("  console.log(\"Result:\", result);");
    }

    @Test
    void generate_examplesDisabled_skipsExampleFile() {
        SdkCodeGenerator noExamples = new SdkCodeGenerator(
            new GeneratorConfig(EmitterOptions.defaults(), false, Map.of()));

        GeneratedOutput output = noExamples.generate(TestPlans.walletPlan());

        assertThat(output.find("examples/basic.ts")).isEmpty();
        assertThat(output.files()).hasSize(5);
    }

    @Test
    void generate_packageJson_usesProductInfoAndSettings() throws Exception {
        SdkCodeGenerator scoped = new SdkCodeGenerator(new GeneratorConfig(EmitterOptions.defaults(), true,
            Map.of("package.scope", "@acme", "package.license", "Apache-2.0")));

        JsonNode pkg = new ObjectMapper().readTree(content(scoped.generate(TestPlans.walletPlan()), "package.json"));

        assertThat(pkg.get("name").asText()).isEqualTo("@acme/wallet-sdk");
        assertThat(pkg.get("version").asText()).isEqualTo("2.0.0");
        assertThat(pkg.get("license").asText()).isEqualTo("Apache-2.0");
        assertThat(pkg.get("main").asText()).isEqualTo("dist/lib/client.js");
    }

    @Test
    void generate_packageJson_withoutScope_usesProductName() throws Exception {
        JsonNode pkg = new ObjectMapper().readTree(content(generator.generate(TestPlans.minimalPlan()), "package.json"));

        assertThat(pkg.get("name").asText()).isEqualTo("ping-sdk");
        assertThat(pkg.get("version").asText()).isEqualTo("1.0.0");
        assertThat(pkg.get("license").asText()).isEqualTo("MIT");
    }

    @Test
    void generate_planWithoutMethods_isRejected() {
        DesignPlan empty = TestPlans.withMethods(TestPlans.walletPlan(), List.of());

        assertThatThrownBy(() -> generator.generate(empty))
            .isInstanceOfSatisfying(PlanConstructionException.class,
                e -> assertThat(e.getMissingField()).isEqualTo("methods"));
    }

    @Test
    void generate_incompleteMethod_abortsWholeRun() {
        DesignPlan broken = TestPlans.withMethods(TestPlans.walletPlan(),
            List.of(TestPlans.getBalance(), MethodDescriptor.of("send", null, List.of(), null)));

        assertThatThrownBy(() -> generator.generate(broken))
            .isInstanceOf(PlanConstructionException.class)
            .hasMessageContaining("WalletClient.send")
            .hasMessageContaining("returnType");
    }

    @Test
    void generate_otherTargetLanguage_stillEmitsTypeScript() {
        DesignPlan python = TestPlans.withLanguage(TestPlans.walletPlan(), "python");

        assertThat(generator.generate(python).find("lib/client.ts")).isPresent();
    }

    private static String content(GeneratedOutput output, String path) {
        return output.find(path).map(GeneratedFile::content).orElseThrow();
    }
}

package com.sdkforge.core.docs;

import static org.assertj.core.api.Assertions.assertThat;

import com.sdkforge.core.TestPlans;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DocumentationGenerator} and {@link GeneratedDocumentation}.
 */
class DocumentationGeneratorTest {

    @Test
    void generateAll_walletPlan_producesAllSixDocuments() {
        DesignPlan plan = TestPlans.walletPlan();
        DocumentationContext context = DocumentationContext.from(DocumentationConfig.fromPlan(plan), plan, null);

        GeneratedOutput output = new DocumentationGenerator().generateAll(context).toOutput();

        assertThat(output.paths()).containsExactly(
            GeneratedDocumentation.README_PATH,
            GeneratedDocumentation.QUICKSTART_PATH,
            GeneratedDocumentation.AUTHENTICATION_PATH,
            GeneratedDocumentation.EXAMPLES_PATH,
            GeneratedDocumentation.ERROR_HANDLING_PATH,
            GeneratedDocumentation.API_REFERENCE_PATH
        );
        assertThat(output.files()).allSatisfy(file -> assertThat(file.content()).endsWith("\n"));
    }

    @Test
    void generateAll_usesInjectedBuilders() {
        DesignPlan plan = TestPlans.minimalPlan();
        DocumentationContext context = DocumentationContext.from(DocumentationConfig.fromPlan(plan), plan, null);
        DocumentationGenerator generator = new DocumentationGenerator(
            new FixedSection("readme", "# Readme"),
            new FixedSection("quickstart", ""),
            new FixedSection("authentication", "   "),
            new FixedSection("examples", "# Examples\n"),
            new FixedSection("error-handling", ""),
            new FixedSection("api-reference", "# API"));

        GeneratedDocumentation docs = generator.generateAll(context);
        GeneratedOutput output = docs.toOutput();

        assertThat(docs.readme()).isEqualTo("# Readme");
        assertThat(output.paths()).containsExactly("README.md", "docs/EXAMPLES.md", "docs/API_REFERENCE.md");
        assertThat(output.find("README.md")).map(GeneratedFile::content).contains("# Readme\n");
        assertThat(output.find("docs/EXAMPLES.md")).map(GeneratedFile::content).contains("# Examples\n");
    }

    @Test
    void generatedDocumentation_nullDocuments_becomeEmpty() {
        GeneratedDocumentation docs = new GeneratedDocumentation(null, null, null, null, null, null);

        assertThat(docs.readme()).isEmpty();
        assertThat(docs.toOutput().files()).isEmpty();
    }

    private static final class FixedSection implements SectionBuilder {

        private final String id;
        private final String text;

        FixedSection(String id, String text) {
            this.id = id;
            this.text = text;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String build(DocumentationContext context) {
            return text;
        }
    }
}

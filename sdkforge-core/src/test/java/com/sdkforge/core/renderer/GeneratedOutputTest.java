package com.sdkforge.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratedOutput} and {@link GeneratedFile}.
 */
class GeneratedOutputTest {

    @Test
    void constructor_copiesFileList() {
        // Given
        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.markdown("README.md", "# SDK"));

        // When
        GeneratedOutput output = new GeneratedOutput(files);
        files.clear();

        // Then
        assertThat(output.files()).hasSize(1);
    }

    @Test
    void constructor_withNullFiles_throwsException() {
        assertThatThrownBy(() -> new GeneratedOutput(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("files must not be null");
    }

    @Test
    void merge_samePath_replacesInPlace() {
        // Given
        GeneratedOutput source = new GeneratedOutput(List.of(
            new GeneratedFile("lib/client.ts", "client", GeneratedFile.TYPESCRIPT),
            GeneratedFile.markdown("README.md", "old readme")
        ));
        GeneratedOutput docs = new GeneratedOutput(List.of(
            GeneratedFile.markdown("README.md", "new readme"),
            GeneratedFile.markdown("docs/QUICKSTART.md", "quickstart")
        ));

        // When
        GeneratedOutput merged = source.merge(docs);

        // Then
        assertThat(merged.paths()).containsExactly("lib/client.ts", "README.md", "docs/QUICKSTART.md");
        assertThat(merged.find("README.md")).map(GeneratedFile::content).contains("new readme");
    }

    @Test
    void empty_hasNoFiles() {
        assertThat(GeneratedOutput.empty().files()).isEmpty();
        assertThat(GeneratedOutput.empty().find("README.md")).isEmpty();
    }

    @Test
    void generatedFile_withAbsolutePath_throwsException() {
        assertThatThrownBy(() -> GeneratedFile.markdown("/etc/passwd", "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generatedFile_withParentTraversal_throwsException() {
        assertThatThrownBy(() -> GeneratedFile.markdown("../outside.md", "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("../outside.md");
    }

    @Test
    void generatedFile_withNullContent_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("lib/client.ts", null, GeneratedFile.TYPESCRIPT))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content must not be null");
    }
}

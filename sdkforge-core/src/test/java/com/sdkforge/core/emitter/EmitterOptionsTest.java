package com.sdkforge.core.emitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EmitterOptions}.
 */
class EmitterOptionsTest {

    @Test
    void defaults_useTwoSpacesAndTerminators() {
        EmitterOptions options = EmitterOptions.defaults();

        assertThat(options.indentStyle()).isEqualTo(IndentStyle.SPACES);
        assertThat(options.indentUnit()).isEqualTo("  ");
        assertThat(options.lineWidth()).isEqualTo(EmitterOptions.DEFAULT_LINE_WIDTH);
        assertThat(options.trailingNewline()).isTrue();
        assertThat(options.statementTerminators()).isTrue();
    }

    @Test
    void nullIndentStyle_defaultsToSpaces() {
        EmitterOptions options = new EmitterOptions(null, 4, 80, true, true);

        assertThat(options.indentUnit()).isEqualTo("    ");
    }

    @Test
    void tabs_indentUnitIsTab() {
        assertThat(new EmitterOptions(IndentStyle.TABS, 4, 80, true, true).indentUnit()).isEqualTo("\t");
    }

    @Test
    void nonPositiveSizes_areRejected() {
        assertThatThrownBy(() -> new EmitterOptions(IndentStyle.SPACES, 0, 80, true, true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EmitterOptions(IndentStyle.SPACES, 2, -1, true, true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

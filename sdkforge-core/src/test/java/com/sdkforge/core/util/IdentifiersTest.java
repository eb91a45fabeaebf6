package com.sdkforge.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Identifiers}.
 */
class IdentifiersTest {

    @Test
    void pascalCase_snakeCase_joinsCapitalizedParts() {
        assertThat(Identifiers.pascalCase("validation_failed")).isEqualTo("ValidationFailed");
    }

    @Test
    void pascalCase_kebabCase_joinsCapitalizedParts() {
        assertThat(Identifiers.pascalCase("wallet-sdk")).isEqualTo("WalletSdk");
    }

    @Test
    void pascalCase_upperCaseParts_areLowercasedAfterFirstLetter() {
        assertThat(Identifiers.pascalCase("RATE_LIMITED")).isEqualTo("RateLimited");
    }

    @Test
    void pascalCase_camelCase_keepsInnerCapitals() {
        assertThat(Identifiers.pascalCase("getBalance")).isEqualTo("GetBalance");
    }

    @Test
    void pascalCase_leadingDigit_isPrefixed() {
        assertThat(Identifiers.pascalCase("404_not_found")).isEqualTo("_404NotFound");
    }

    @Test
    void pascalCase_null_returnsEmpty() {
        assertThat(Identifiers.pascalCase(null)).isEmpty();
    }

    @Test
    void pascalCase_turkishDefaultLocale_keepsAsciiLetters() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(Identifiers.pascalCase("INVALID_ID")).isEqualTo("InvalidId");
        } finally {
            Locale.setDefault(original);
        }
    }
}

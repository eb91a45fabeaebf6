package com.sdkforge.core.docs.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.sdkforge.core.model.ErrorDescriptor;
import org.junit.jupiter.api.Test;

class ErrorCategoryTest {

    @Test
    void classify_prefersCategoryOverCode() {
        assertThat(ErrorCategory.classify(error("timeout", "Network"))).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void classify_withoutCategory_usesCode() {
        assertThat(ErrorCategory.classify(error("permission_denied", null))).isEqualTo(ErrorCategory.AUTHENTICATION);
        assertThat(ErrorCategory.classify(error("connection_reset", " "))).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void classify_firstMatchingCategoryWins() {
        assertThat(ErrorCategory.classify(error("auth_rate_limited", null))).isEqualTo(ErrorCategory.AUTHENTICATION);
    }

    @Test
    void classify_unmatched_isOther() {
        assertThat(ErrorCategory.classify(error("insufficient_funds", null))).isEqualTo(ErrorCategory.OTHER);
        assertThat(ErrorCategory.classify(error(null, null))).isEqualTo(ErrorCategory.OTHER);
    }

    @Test
    void title_isHumanReadable() {
        assertThat(ErrorCategory.RATE_LIMIT.title()).isEqualTo("Rate Limiting");
    }

    private static ErrorDescriptor error(String code, String category) {
        return new ErrorDescriptor(code, category, null, null, null, null, 0);
    }
}

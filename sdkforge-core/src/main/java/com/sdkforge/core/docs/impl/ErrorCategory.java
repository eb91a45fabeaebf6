package com.sdkforge.core.docs.impl;

import com.sdkforge.core.model.ErrorDescriptor;
import java.util.List;
import java.util.Locale;

/**
 * Error taxonomy used by the error handling guide, in display order.
 *
 * <p>Classification matches the lower-cased category (or the code, when no category is set)
 * against each category's keywords in declaration order; the first match wins.
 */
public enum ErrorCategory {
    AUTHENTICATION("Authentication & Authorization", List.of("auth", "permission")),
    VALIDATION("Validation Errors", List.of("validation")),
    NETWORK("Network Errors", List.of("network", "connection")),
    RATE_LIMIT("Rate Limiting", List.of("rate")),
    SERVER("Server Errors", List.of("server")),
    OTHER("Other Errors", List.of());

    private final String title;
    private final List<String> keywords;

    ErrorCategory(String title, List<String> keywords) {
        this.title = title;
        this.keywords = keywords;
    }

    public String title() {
        return title;
    }

    public static ErrorCategory classify(ErrorDescriptor error) {
        String key = error.categoryOrCode();
        if (key == null) {
            return OTHER;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        for (ErrorCategory category : values()) {
            for (String keyword : category.keywords) {
                if (normalized.contains(keyword)) {
                    return category;
                }
            }
        }
        return OTHER;
    }
}

package com.sdkforge.core.util;

import java.util.Locale;

/**
 * Utility class for deriving target-language identifiers from plan names.
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    /**
     * Converts a code or free-form name to PascalCase.
     *
     * <p>Examples: {@code validation_failed} becomes {@code ValidationFailed},
     * {@code AUTH_EXPIRED} becomes {@code AuthExpired}, {@code payments-sdk} becomes
     * {@code PaymentsSdk}. A result starting with a digit is prefixed with {@code _}.
     *
     * @param value value to convert
     * @return PascalCase identifier, empty for a null or blank value
     */
    public static String pascalCase(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder result = new StringBuilder();
        for (String part : value.split("[^A-Za-z0-9]+")) {
            if (part.isEmpty()) {
                continue;
            }
            boolean allUpper = part.equals(part.toUpperCase(Locale.ROOT));
            String rest = allUpper ? part.substring(1).toLowerCase(Locale.ROOT) : part.substring(1);
            result.append(Character.toUpperCase(part.charAt(0))).append(rest);
        }
        if (result.length() > 0 && Character.isDigit(result.charAt(0))) {
            result.insert(0, '_');
        }
        return result.toString();
    }
}

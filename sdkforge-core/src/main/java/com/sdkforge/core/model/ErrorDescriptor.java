package com.sdkforge.core.model;

import com.sdkforge.core.util.Identifiers;

/**
 * An error the SDK can raise.
 *
 * @param code error code, unique within a plan (e.g. "validation_failed")
 * @param category error type or category name used for grouping (e.g. "validation")
 * @param description what the error means
 * @param cause why it happens
 * @param remedy how to recover
 * @param example optional code example
 * @param statusCode HTTP status associated with the error, 0 when none
 */
public record ErrorDescriptor(
    String code,
    String category,
    String description,
    String cause,
    String remedy,
    String example,
    int statusCode
) {
    /**
     * Returns the category, falling back to the code when no category is set.
     *
     * @return text used to infer the documentation category
     */
    public String categoryOrCode() {
        return category != null && !category.isBlank() ? category : code;
    }

    /**
     * Returns the name of the generated error class for this code
     * ({@code validation_failed} becomes {@code ValidationFailedError}).
     *
     * @return error class name, empty when the code is missing
     */
    public String className() {
        String name = Identifiers.pascalCase(code);
        if (name.isEmpty()) {
            return name;
        }
        return name.endsWith("Error") ? name : name + "Error";
    }
}

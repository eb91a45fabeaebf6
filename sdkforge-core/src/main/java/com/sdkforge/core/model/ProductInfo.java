package com.sdkforge.core.model;

/**
 * Product metadata carried by a design plan.
 *
 * @param name product or package name (e.g. "payments-sdk")
 * @param version product version
 * @param description one-line product description
 */
public record ProductInfo(
    String name,
    String version,
    String description
) {
    /**
     * Compact constructor defaulting the version.
     */
    public ProductInfo {
        if (version == null || version.isBlank()) {
            version = "1.0.0";
        }
        if (description == null) {
            description = "";
        }
    }
}

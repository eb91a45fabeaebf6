package com.sdkforge.core.model;

/**
 * Settings for the generated entry-point client.
 *
 * @param className name of the client class (e.g. "PaymentsClient")
 * @param baseUrl base URL used by the default configuration, may be null
 * @param timeoutMs request timeout in milliseconds, 0 for the generator default
 */
public record ClientSettings(
    String className,
    String baseUrl,
    long timeoutMs
) {
}

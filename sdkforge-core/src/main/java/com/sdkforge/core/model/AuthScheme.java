package com.sdkforge.core.model;

/**
 * Authentication facts of a design plan.
 *
 * @param required whether calls need credentials
 * @param method mechanism used when required
 */
public record AuthScheme(
    boolean required,
    AuthMethod method
) {
    /**
     * Compact constructor defaulting the mechanism.
     */
    public AuthScheme {
        if (method == null) {
            method = required ? AuthMethod.API_KEY : AuthMethod.NONE;
        }
    }

    /**
     * Scheme for APIs that need no credentials.
     *
     * @return no-auth scheme
     */
    public static AuthScheme none() {
        return new AuthScheme(false, AuthMethod.NONE);
    }
}

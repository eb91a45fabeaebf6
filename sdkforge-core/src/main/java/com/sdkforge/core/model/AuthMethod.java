package com.sdkforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Authentication mechanisms the documentation knows how to describe.
 */
public enum AuthMethod {
    /** No credentials */
    NONE("none"),

    /** Static API key */
    API_KEY("api-key"),

    /** Delegated authorization (OAuth 2.0) */
    OAUTH("oauth"),

    /** Web3 wallet signature */
    WALLET("wallet");

    private final String id;

    AuthMethod(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a mechanism from its identifier or constant name.
     *
     * @param value identifier such as "api-key" or "API_KEY"
     * @return matching mechanism, {@link #NONE} for null
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static AuthMethod fromId(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (AuthMethod method : values()) {
            if (method.id.equals(normalized)) {
                return method;
            }
        }
        if ("oauth2".equals(normalized) || "bearer".equals(normalized)) {
            return OAUTH;
        }
        throw new IllegalArgumentException("Unknown authentication method: " + value);
    }
}

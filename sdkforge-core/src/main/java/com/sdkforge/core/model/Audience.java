package com.sdkforge.core.model;

/**
 * Audience level of the generated documentation.
 */
public enum Audience {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}

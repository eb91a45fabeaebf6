package com.sdkforge.core.model;

/**
 * Shapes a {@link TypeDescriptor} can take.
 */
public enum TypeKind {
    /** Structural type with named fields */
    INTERFACE,

    /** Closed set of named values */
    ENUM
}

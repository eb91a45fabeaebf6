package com.sdkforge.core.model;

/**
 * A member of an enum type.
 *
 * @param name member name
 * @param value member value, rendered as a string literal
 */
public record EnumValueDescriptor(
    String name,
    String value
) {
}

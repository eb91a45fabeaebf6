package com.sdkforge.core.model;

/**
 * A field of an interface type.
 *
 * @param name field name
 * @param type field type
 * @param optional whether the field may be absent
 * @param description optional description
 */
public record FieldDescriptor(
    String name,
    String type,
    boolean optional,
    String description
) {
}

package com.sdkforge.core.model;

import java.util.List;

/**
 * A named type definition.
 *
 * @param name type name
 * @param kind shape of the type, interface when absent
 * @param description optional description
 * @param fields ordered fields (interfaces)
 * @param enumValues ordered members (enums)
 * @param exported whether the declaration is exported
 */
public record TypeDescriptor(
    String name,
    TypeKind kind,
    String description,
    List<FieldDescriptor> fields,
    List<EnumValueDescriptor> enumValues,
    boolean exported
) {
    /**
     * Compact constructor normalizing collections and kind.
     */
    public TypeDescriptor {
        if (kind == null) {
            kind = TypeKind.INTERFACE;
        }
        fields = fields != null ? List.copyOf(fields) : List.of();
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }

    /**
     * Creates an exported interface type.
     *
     * @param name type name
     * @param fields fields
     * @return type descriptor
     */
    public static TypeDescriptor ofInterface(String name, List<FieldDescriptor> fields) {
        return new TypeDescriptor(name, TypeKind.INTERFACE, null, fields, List.of(), true);
    }
}

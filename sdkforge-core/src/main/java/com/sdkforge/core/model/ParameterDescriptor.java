package com.sdkforge.core.model;

/**
 * A method parameter.
 *
 * @param name parameter name
 * @param type parameter type as written in the target language
 * @param optional whether callers may omit it
 * @param description optional description
 */
public record ParameterDescriptor(
    String name,
    String type,
    boolean optional,
    String description
) {
    /**
     * Creates a required parameter without description.
     *
     * @param name parameter name
     * @param type parameter type
     * @return parameter descriptor
     */
    public static ParameterDescriptor required(String name, String type) {
        return new ParameterDescriptor(name, type, false, null);
    }

    /**
     * Returns a placeholder argument for this parameter, used by generated examples and
     * documentation snippets.
     *
     * @return literal source text (e.g. {@code "address"} for a string, {@code 0} for a number)
     */
    public String exampleValue() {
        String normalized = type == null ? "" : type.trim();
        if (normalized.endsWith("[]") || normalized.startsWith("Array<")) {
            return "[]";
        }
        return switch (normalized) {
            case "string" -> "\"" + name + "\"";
            case "number", "bigint" -> "0";
            case "boolean" -> "true";
            default -> "{}";
        };
    }
}

package com.sdkforge.core.model;

import java.util.List;

/**
 * A single client method.
 *
 * @param name method name, unique within a plan
 * @param description free-text description
 * @param parameters ordered parameters
 * @param returnType declared return type (e.g. "number")
 * @param async whether the method returns a promise
 * @param httpMethod HTTP verb used by the call-through, may be null
 * @param endpoint endpoint path appended to the base URL, may be null
 * @param requiresAuth whether the method needs an authentication handler
 */
public record MethodDescriptor(
    String name,
    String description,
    List<ParameterDescriptor> parameters,
    String returnType,
    boolean async,
    String httpMethod,
    String endpoint,
    boolean requiresAuth
) {
    /**
     * Compact constructor normalizing the parameter list.
     */
    public MethodDescriptor {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    /**
     * Convenience factory for a synchronous method without transport details.
     *
     * @param name method name
     * @param description description
     * @param parameters parameters
     * @param returnType return type
     * @return method descriptor
     */
    public static MethodDescriptor of(String name, String description,
                                      List<ParameterDescriptor> parameters, String returnType) {
        return new MethodDescriptor(name, description, parameters, returnType, false, null, null, false);
    }
}

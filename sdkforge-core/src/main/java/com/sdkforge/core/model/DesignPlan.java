package com.sdkforge.core.model;

import java.util.List;

/**
 * Language-neutral description of an SDK surface.
 *
 * <p>The design plan is the single input of both generation branches: the declaration
 * builders project it into AST nodes and the documentation builders read it to produce
 * prose. Keeping both branches on one plan prevents method signatures in the docs from
 * drifting away from the emitted code.
 *
 * <p>The record is deliberately lenient. A plan read from JSON may be incomplete, and
 * rejecting incomplete fragments is the job of the builders, which report the offending
 * entity by name.
 *
 * @param product product metadata
 * @param client client class settings
 * @param methods methods exposed by the client, in declaration order
 * @param types named type definitions
 * @param errors error descriptors
 * @param auth authentication scheme
 * @param targetLanguageId target output language identifier (e.g. "typescript")
 * @param audience documentation audience level
 */
public record DesignPlan(
    ProductInfo product,
    ClientSettings client,
    List<MethodDescriptor> methods,
    List<TypeDescriptor> types,
    List<ErrorDescriptor> errors,
    AuthScheme auth,
    String targetLanguageId,
    Audience audience
) {
    /** Language used when the plan does not name one. */
    public static final String DEFAULT_LANGUAGE = "typescript";

    /**
     * Compact constructor normalizing absent collections and defaults.
     */
    public DesignPlan {
        methods = methods != null ? List.copyOf(methods) : List.of();
        types = types != null ? List.copyOf(types) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        if (auth == null) {
            auth = AuthScheme.none();
        }
        if (targetLanguageId == null || targetLanguageId.isBlank()) {
            targetLanguageId = DEFAULT_LANGUAGE;
        }
        if (audience == null) {
            audience = Audience.INTERMEDIATE;
        }
    }

    /**
     * Finds the first method with the given name.
     *
     * @param name method name
     * @return matching method or null
     */
    public MethodDescriptor findMethod(String name) {
        return methods.stream()
            .filter(m -> name.equals(m.name()))
            .findFirst()
            .orElse(null);
    }
}

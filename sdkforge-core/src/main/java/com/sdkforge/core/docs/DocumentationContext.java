package com.sdkforge.core.docs;

import com.sdkforge.core.model.CodeExample;
import com.sdkforge.core.model.DesignPlan;
import com.sdkforge.core.model.ErrorDescriptor;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.TypeDescriptor;
import com.sdkforge.core.util.Identifiers;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of a design plan prepared for the documentation section builders.
 *
 * <p>Methods, types and errors are keyed by method name, type name and error code in plan
 * order. When two entries share a key the later one wins and a warning is logged. Built
 * once per generation run; all collections are unmodifiable.
 *
 * @param config documentation settings
 * @param plan design plan
 * @param methods methods by name
 * @param types types by name
 * @param errors errors by code
 * @param examples code examples, in supplied order
 * @param prerequisites extra prerequisites listed in the quickstart
 * @param setupSteps extra setup steps listed in the quickstart, in order
 */
public record DocumentationContext(
    DocumentationConfig config,
    DesignPlan plan,
    Map<String, MethodDescriptor> methods,
    Map<String, TypeDescriptor> types,
    Map<String, ErrorDescriptor> errors,
    List<CodeExample> examples,
    List<String> prerequisites,
    List<String> setupSteps
) {
    private static final Logger log = LoggerFactory.getLogger(DocumentationContext.class);

    /**
     * Compact constructor with validation.
     */
    public DocumentationContext {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        methods = methods != null ? Collections.unmodifiableMap(new LinkedHashMap<>(methods)) : Map.of();
        types = types != null ? Collections.unmodifiableMap(new LinkedHashMap<>(types)) : Map.of();
        errors = errors != null ? Collections.unmodifiableMap(new LinkedHashMap<>(errors)) : Map.of();
        examples = examples != null ? List.copyOf(examples) : List.of();
        prerequisites = prerequisites != null ? List.copyOf(prerequisites) : List.of();
        setupSteps = setupSteps != null ? List.copyOf(setupSteps) : List.of();
    }

    /**
     * Builds a context from the plan.
     *
     * @param config documentation settings
     * @param plan design plan
     * @param examples code examples, may be null
     * @return context
     */
    public static DocumentationContext from(DocumentationConfig config, DesignPlan plan, List<CodeExample> examples) {
        return from(config, plan, examples, List.of(), List.of());
    }

    /**
     * Builds a context from the plan with extra quickstart prerequisites and setup steps.
     *
     * @param config documentation settings
     * @param plan design plan
     * @param examples code examples, may be null
     * @param prerequisites extra prerequisites, may be null
     * @param setupSteps extra setup steps, may be null
     * @return context
     */
    public static DocumentationContext from(DocumentationConfig config, DesignPlan plan, List<CodeExample> examples,
                                            List<String> prerequisites, List<String> setupSteps) {
        Objects.requireNonNull(plan, "plan must not be null");
        return new DocumentationContext(
            config,
            plan,
            index("method", plan.methods(), MethodDescriptor::name),
            index("type", plan.types(), TypeDescriptor::name),
            index("error", plan.errors(), ErrorDescriptor::code),
            examples,
            prerequisites,
            setupSteps
        );
    }

    // Last write wins; collisions are reported, never rejected
    private static <T> Map<String, T> index(String entity, List<T> entries, Function<T, String> key) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T entry : entries) {
            String name = key.apply(entry);
            if (name == null || name.isBlank()) {
                log.warn("Skipping {} without a name in documentation context", entity);
                continue;
            }
            if (indexed.put(name, entry) != null) {
                log.warn("Duplicate {} '{}' in design plan; the last definition is documented", entity, name);
            }
        }
        return indexed;
    }

    /**
     * Returns the first plan method in insertion order.
     *
     * @return first method, if any
     */
    public Optional<MethodDescriptor> firstMethod() {
        return methods.values().stream().findFirst();
    }

    /**
     * Returns the client class name used in code snippets: the plan's client class name,
     * or the SDK name in PascalCase when the plan has none.
     *
     * @return client class name
     */
    public String clientClassName() {
        if (plan.client() != null && plan.client().className() != null && !plan.client().className().isBlank()) {
            return plan.client().className();
        }
        return Identifiers.pascalCase(config.sdkName());
    }
}

package com.sdkforge.core.error;

/**
 * Base class of the fatal errors raised while turning a design plan into source text.
 *
 * <p>Subclasses identify the culprit: {@link PlanConstructionException} names the plan
 * entity, {@link MalformedNodeException} names the AST node kind.
 */
public class CodeGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodeGenerationException(String message) {
        super(message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

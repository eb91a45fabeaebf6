package com.sdkforge.core.ast;

import java.util.List;

/**
 * Structured documentation comment attached to a declaration.
 *
 * <p>Every section is optional. Renderers omit absent sections entirely rather than writing
 * placeholder tag lines.
 *
 * @param description free text, may span several lines, may be null
 * @param params documented parameters in signature order
 * @param returns documented return value, may be null
 * @param throwsList documented error types
 * @param deprecated whether the declaration is deprecated
 * @param example example snippet, may span several lines, may be null
 */
public record DocComment(
    String description,
    List<ParamDoc> params,
    ReturnDoc returns,
    List<String> throwsList,
    boolean deprecated,
    String example
) {
    public DocComment {
        params = params != null ? List.copyOf(params) : List.of();
        throwsList = throwsList != null ? List.copyOf(throwsList) : List.of();
    }

    /**
     * Creates a comment holding only a description.
     *
     * @param description description text
     * @return doc comment
     */
    public static DocComment of(String description) {
        return new DocComment(description, List.of(), null, List.of(), false, null);
    }

    /**
     * Documented parameter.
     *
     * @param name parameter name
     * @param type type, may be null
     * @param description description, may be null
     */
    public record ParamDoc(String name, String type, String description) {
    }

    /**
     * Documented return value.
     *
     * @param type type, may be null
     * @param description description, may be null
     */
    public record ReturnDoc(String type, String description) {

        public boolean isEmpty() {
            return isBlank(type) && isBlank(description);
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.sdkforge.core.error;

/**
 * Thrown by an emitter when a node of a recognized kind lacks a field required to render it.
 */
public final class MalformedNodeException extends CodeGenerationException {

    private static final long serialVersionUID = 1L;

    private final String nodeKind;
    private final String field;

    /**
     * Creates a malformed-node error.
     *
     * @param nodeKind kind name of the offending node (e.g. "CallExpression")
     * @param field name of the missing field (e.g. "callee")
     */
    public MalformedNodeException(String nodeKind, String field) {
        super(nodeKind + " is missing required field '" + field + "'");
        this.nodeKind = nodeKind;
        this.field = field;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public String getField() {
        return field;
    }
}

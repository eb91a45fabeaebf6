package com.sdkforge.core.ast;

/**
 * Discriminator of every AST node.
 *
 * <p>Each constant maps to exactly one record type in {@link SdkAst}, so two nodes with
 * the same kind always carry the same fields.
 */
public enum NodeKind {
    // Declarations
    PROGRAM("Program"),
    IMPORT("ImportStatement"),
    CLASS_DECLARATION("ClassDeclaration"),
    INTERFACE_DECLARATION("InterfaceDeclaration"),
    ENUM_DECLARATION("EnumDeclaration"),
    FUNCTION_DECLARATION("FunctionDeclaration"),

    // Class members
    PROPERTY_DECLARATION("PropertyDeclaration"),
    CONSTRUCTOR("Constructor"),
    METHOD_DECLARATION("MethodDeclaration"),
    PARAMETER("Parameter"),

    // Statements
    VARIABLE_DECLARATION("VariableDeclaration"),
    RETURN_STATEMENT("ReturnStatement"),
    THROW_STATEMENT("ThrowStatement"),
    IF_STATEMENT("IfStatement"),
    TRY_CATCH_STATEMENT("TryCatchStatement"),
    EXPRESSION_STATEMENT("ExpressionStatement"),

    // Expressions
    LITERAL("Literal"),
    IDENTIFIER("Identifier"),
    MEMBER_EXPRESSION("MemberExpression"),
    CALL_EXPRESSION("CallExpression"),
    NEW_EXPRESSION("NewExpression"),
    AWAIT_EXPRESSION("AwaitExpression"),
    UNARY_EXPRESSION("UnaryExpression"),
    OBJECT_EXPRESSION("ObjectExpression"),
    ARRAY_EXPRESSION("ArrayExpression"),
    BINARY_EXPRESSION("BinaryExpression"),
    CONDITIONAL_EXPRESSION("ConditionalExpression"),

    /** A kind produced upstream that no emitter recognizes */
    UNSUPPORTED("Unsupported");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the kind name used in diagnostics and degraded output.
     *
     * @return display name (e.g. "CallExpression")
     */
    public String displayName() {
        return displayName;
    }
}

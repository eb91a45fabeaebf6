package com.sdkforge.core.builder;

import com.sdkforge.core.ast.SdkAst.BinaryExpression;
import com.sdkforge.core.ast.SdkAst.CallExpression;
import com.sdkforge.core.ast.SdkAst.Expression;
import com.sdkforge.core.ast.SdkAst.ExpressionStatement;
import com.sdkforge.core.ast.SdkAst.Identifier;
import com.sdkforge.core.ast.SdkAst.NewExpression;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Parameter;
import com.sdkforge.core.ast.SdkAst.PropertyDeclaration;
import com.sdkforge.core.ast.SdkAst.ReturnStatement;
import com.sdkforge.core.ast.SdkAst.Statement;
import com.sdkforge.core.ast.SdkAst.ThrowStatement;
import com.sdkforge.core.error.PlanConstructionException;

/**
 * Node factories shared by the declaration builders.
 */
final class AstShortcuts {

    private AstShortcuts() {
        // Utility class
    }

    static Statement assign(String target, String value) {
        return new ExpressionStatement(BinaryExpression.assign(target, value));
    }

    static Statement assign(String target, Expression value) {
        return new ExpressionStatement(new BinaryExpression(Operand.raw(target), "=", Operand.of(value)));
    }

    static Statement callStatement(String callee, String... arguments) {
        return new ExpressionStatement(CallExpression.of(callee, arguments));
    }

    static Statement returns(String identifier) {
        return new ReturnStatement(new Identifier(identifier));
    }

    static Statement returns(Expression value) {
        return new ReturnStatement(value);
    }

    static Statement throwNew(String errorType, String... arguments) {
        return new ThrowStatement(NewExpression.of(errorType, arguments));
    }

    static Parameter param(String name, String type) {
        return new Parameter(name, type, false);
    }

    static Parameter optionalParam(String name, String type) {
        return new Parameter(name, type, true);
    }

    static PropertyDeclaration privateField(String name, String type) {
        return new PropertyDeclaration(name, type, null, false, true, false);
    }

    static PropertyDeclaration readonlyField(String name, String type) {
        return new PropertyDeclaration(name, type, null, true, false, false);
    }

    /**
     * Returns {@code value} or fails with a construction error when it is null or blank.
     */
    static String requireField(String value, String entityType, String entityId, String field) {
        if (value == null || value.isBlank()) {
            throw new PlanConstructionException(entityType, entityId, field);
        }
        return value;
    }
}

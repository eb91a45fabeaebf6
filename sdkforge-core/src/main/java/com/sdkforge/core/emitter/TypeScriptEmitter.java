package com.sdkforge.core.emitter;

import com.sdkforge.core.ast.DocComment;
import com.sdkforge.core.ast.NodeKind;
import com.sdkforge.core.ast.SdkAst.ArrayExpression;
import com.sdkforge.core.ast.SdkAst.AwaitExpression;
import com.sdkforge.core.ast.SdkAst.BinaryExpression;
import com.sdkforge.core.ast.SdkAst.Binding;
import com.sdkforge.core.ast.SdkAst.CallExpression;
import com.sdkforge.core.ast.SdkAst.ClassDeclaration;
import com.sdkforge.core.ast.SdkAst.ConditionalExpression;
import com.sdkforge.core.ast.SdkAst.Constructor;
import com.sdkforge.core.ast.SdkAst.EnumDeclaration;
import com.sdkforge.core.ast.SdkAst.EnumMember;
import com.sdkforge.core.ast.SdkAst.Expression;
import com.sdkforge.core.ast.SdkAst.ExpressionStatement;
import com.sdkforge.core.ast.SdkAst.ExpressionVisitor;
import com.sdkforge.core.ast.SdkAst.FunctionDeclaration;
import com.sdkforge.core.ast.SdkAst.Identifier;
import com.sdkforge.core.ast.SdkAst.IfStatement;
import com.sdkforge.core.ast.SdkAst.Import;
import com.sdkforge.core.ast.SdkAst.ImportName;
import com.sdkforge.core.ast.SdkAst.InterfaceDeclaration;
import com.sdkforge.core.ast.SdkAst.Literal;
import com.sdkforge.core.ast.SdkAst.MemberExpression;
import com.sdkforge.core.ast.SdkAst.MethodDeclaration;
import com.sdkforge.core.ast.SdkAst.NewExpression;
import com.sdkforge.core.ast.SdkAst.ObjectExpression;
import com.sdkforge.core.ast.SdkAst.ObjectProperty;
import com.sdkforge.core.ast.SdkAst.Operand;
import com.sdkforge.core.ast.SdkAst.Parameter;
import com.sdkforge.core.ast.SdkAst.Program;
import com.sdkforge.core.ast.SdkAst.PropertyDeclaration;
import com.sdkforge.core.ast.SdkAst.ReturnStatement;
import com.sdkforge.core.ast.SdkAst.Statement;
import com.sdkforge.core.ast.SdkAst.StatementVisitor;
import com.sdkforge.core.ast.SdkAst.ThrowStatement;
import com.sdkforge.core.ast.SdkAst.TryCatchStatement;
import com.sdkforge.core.ast.SdkAst.UnaryExpression;
import com.sdkforge.core.ast.SdkAst.UnsupportedNode;
import com.sdkforge.core.ast.SdkAst.VariableDeclaration;
import com.sdkforge.core.error.MalformedNodeException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emitter for TypeScript sources.
 *
 * <p>Produces curly-brace, class-based TypeScript. Output for a given program and options
 * is byte-identical across runs.
 *
 * <p><b>Class layout:</b>
 * <pre>{@code
 * <doc block>
 * export class Name extends Base implements A, B {
 *   <property lines>
 *
 *   constructor(...) { ... }
 *
 *   <method block>
 *
 * }
 * }</pre>
 *
 * @see LineBuilder
 * @see EmitterOptions
 */
public class TypeScriptEmitter implements CodeEmitter {

    private static final Logger log = LoggerFactory.getLogger(TypeScriptEmitter.class);

    public static final String ID = "typescript";
    private static final String EXTENSION = "ts";
    private static final String FALLBACK_PROPERTY_TYPE = "any";

    private final EmitterOptions options;
    private final String terminator;
    private final ExpressionRenderer expressions = new ExpressionRenderer();

    public TypeScriptEmitter() {
        this(EmitterOptions.defaults());
    }

    public TypeScriptEmitter(EmitterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.terminator = options.statementTerminators() ? ";" : "";
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String fileExtension() {
        return EXTENSION;
    }

    @Override
    public EmitterOptions options() {
        return options;
    }

    @Override
    public String emitProgram(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        log.debug("Emitting program with {} declarations", program.declarations().size());

        LineBuilder builder = new LineBuilder(options);
        StatementWriter writer = new StatementWriter(builder);
        program.declarations().forEach(declaration -> {
            declaration.accept(writer);
            builder.blank();
        });

        long overlong = builder.overlongLineCount();
        if (overlong > 0) {
            log.debug("{} line(s) exceed the target width of {}", overlong, options.lineWidth());
        }
        return builder.toString();
    }

    @Override
    public String emitStatements(List<? extends Statement> statements) {
        Objects.requireNonNull(statements, "statements must not be null");
        LineBuilder builder = new LineBuilder(options);
        StatementWriter writer = new StatementWriter(builder);
        statements.forEach(statement -> statement.accept(writer));
        return builder.toString();
    }

    @Override
    public String emitExpression(Expression expression) {
        return render(expression, "expression", "Expression");
    }

    // ---------------------------------------------------------------------------------
    // Helpers shared by statements and expressions
    // ---------------------------------------------------------------------------------

    private String render(Expression expression, String field, String ownerKind) {
        if (expression == null) {
            throw new MalformedNodeException(ownerKind, field);
        }
        return expression.accept(expressions);
    }

    private String render(Operand operand, String field, String ownerKind) {
        if (operand == null) {
            throw new MalformedNodeException(ownerKind, field);
        }
        if (operand instanceof Operand.Raw raw) {
            return require(raw.text(), field, ownerKind);
        }
        Operand.Nested nested = (Operand.Nested) operand;
        return render(nested.expression(), field, ownerKind);
    }

    private String renderAll(List<Operand> operands, String field, String ownerKind) {
        return operands.stream()
            .map(operand -> render(operand, field, ownerKind))
            .collect(Collectors.joining(", "));
    }

    private static String require(String value, String field, String ownerKind) {
        if (value == null || value.isEmpty()) {
            throw new MalformedNodeException(ownerKind, field);
        }
        return value;
    }

    private String parameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(this::parameter)
            .collect(Collectors.joining(", "));
    }

    private String parameter(Parameter parameter) {
        String kind = parameter.kindName();
        String name = require(parameter.name(), "name", kind);
        String type = require(parameter.type(), "type", kind);
        return name + (parameter.optional() ? "?" : "") + ": " + type;
    }

    private static String returnAnnotation(String returnType) {
        return returnType == null || returnType.isBlank() ? "" : ": " + returnType;
    }

    /**
     * Writes statements and declarations as lines.
     */
    private final class StatementWriter implements StatementVisitor {

        private final LineBuilder builder;

        StatementWriter(LineBuilder builder) {
            this.builder = builder;
        }

        private void body(List<? extends Statement> statements) {
            builder.block(() -> statements.forEach(statement -> statement.accept(this)));
        }

        @Override
        public void visitImport(Import node) {
            String source = require(node.source(), "source", node.kindName());
            String names = node.names().stream()
                .map(this::importName)
                .collect(Collectors.joining(", "));
            builder.line("import { " + names + " } from \"" + source + "\"" + terminator);
        }

        private String importName(ImportName name) {
            String imported = require(name.name(), "names.name", NodeKind.IMPORT.displayName());
            return name.alias() == null || name.alias().isEmpty() ? imported : imported + " as " + name.alias();
        }

        @Override
        public void visitClass(ClassDeclaration node) {
            String name = require(node.name(), "name", node.kindName());
            if (node.documentation() != null && !node.documentation().isBlank()) {
                builder.docBlock(DocComment.of(node.documentation()));
            }

            StringBuilder header = new StringBuilder();
            if (node.exported()) {
                header.append("export ");
            }
            header.append("class ").append(name);
            if (node.superclass() != null && !node.superclass().isEmpty()) {
                header.append(" extends ").append(node.superclass());
            }
            if (!node.capabilities().isEmpty()) {
                header.append(" implements ").append(String.join(", ", node.capabilities()));
            }
            header.append(" {");
            builder.line(header.toString());

            builder.block(() -> {
                if (!node.properties().isEmpty()) {
                    node.properties().forEach(this::property);
                    builder.blank();
                }
                if (node.constructor() != null) {
                    constructor(node.constructor());
                    builder.blank();
                }
                node.methods().forEach(method -> {
                    method(method);
                    builder.blank();
                });
            });
            builder.line("}");
        }

        private void property(PropertyDeclaration property) {
            String name = require(property.name(), "name", property.kindName());
            StringBuilder line = new StringBuilder();
            if (property.isPrivate()) {
                line.append("private ");
            }
            if (property.readonly()) {
                line.append("readonly ");
            }
            line.append(name);
            if (property.optional()) {
                line.append('?');
            }
            if (property.valueType() != null && !property.valueType().isEmpty()) {
                line.append(": ").append(property.valueType());
            }
            if (property.initializer() != null) {
                line.append(" = ").append(render(property.initializer(), "initializer", property.kindName()));
            }
            builder.line(line.append(terminator).toString());
        }

        private void constructor(Constructor constructor) {
            builder.line("constructor(" + parameters(constructor.parameters()) + ") {");
            body(constructor.body());
            builder.line("}");
        }

        private void method(MethodDeclaration method) {
            String name = require(method.name(), "name", method.kindName());
            if (method.documentation() != null) {
                builder.docBlock(method.documentation());
            }
            String modifiers = (method.isPrivate() ? "private " : "") + (method.async() ? "async " : "");
            builder.line(modifiers + name + "(" + parameters(method.parameters()) + ")"
                + returnAnnotation(method.returnType()) + " {");
            body(method.body());
            builder.line("}");
        }

        @Override
        public void visitInterface(InterfaceDeclaration node) {
            String name = require(node.name(), "name", node.kindName());
            if (node.documentation() != null && !node.documentation().isBlank()) {
                builder.docBlock(DocComment.of(node.documentation()));
            }
            String header = (node.exported() ? "export " : "") + "interface " + name
                + (node.extendsList().isEmpty() ? "" : " extends " + String.join(", ", node.extendsList()))
                + " {";
            builder.line(header);
            builder.block(() -> node.properties().forEach(property -> {
                String propertyName = require(property.name(), "name", property.kindName());
                String type = property.valueType() == null || property.valueType().isEmpty()
                    ? FALLBACK_PROPERTY_TYPE
                    : property.valueType();
                builder.line((property.readonly() ? "readonly " : "") + propertyName
                    + (property.optional() ? "?" : "") + ": " + type + terminator);
            }));
            builder.line("}");
        }

        @Override
        public void visitEnum(EnumDeclaration node) {
            String name = require(node.name(), "name", node.kindName());
            if (node.documentation() != null && !node.documentation().isBlank()) {
                builder.docBlock(DocComment.of(node.documentation()));
            }
            builder.line((node.exported() ? "export " : "") + "enum " + name + " {");
            builder.block(() -> {
                List<EnumMember> members = node.members();
                for (int i = 0; i < members.size(); i++) {
                    EnumMember member = members.get(i);
                    String memberName = require(member.name(), "members.name", node.kindName());
                    String value = member.value() != null ? member.value() : memberName;
                    String comma = i < members.size() - 1 ? "," : "";
                    builder.line(memberName + " = " + quote(value) + comma);
                }
            });
            builder.line("}");
        }

        @Override
        public void visitFunction(FunctionDeclaration node) {
            String name = require(node.name(), "name", node.kindName());
            if (node.documentation() != null && !node.documentation().isBlank()) {
                builder.docBlock(DocComment.of(node.documentation()));
            }
            String modifiers = (node.exported() ? "export " : "") + (node.async() ? "async " : "");
            builder.line(modifiers + "function " + name + "(" + parameters(node.parameters()) + ")"
                + returnAnnotation(node.returnType()) + " {");
            body(node.body());
            builder.line("}");
        }

        @Override
        public void visitVariable(VariableDeclaration node) {
            String name = require(node.name(), "name", node.kindName());
            Binding binding = node.binding() != null ? node.binding() : Binding.CONST;
            StringBuilder line = new StringBuilder(binding.keyword()).append(' ').append(name);
            if (node.valueType() != null && !node.valueType().isEmpty()) {
                line.append(": ").append(node.valueType());
            }
            if (node.initializer() != null) {
                line.append(" = ").append(render(node.initializer(), "initializer", node.kindName()));
            }
            builder.line(line.append(terminator).toString());
        }

        @Override
        public void visitReturn(ReturnStatement node) {
            String value = node.argument() == null ? "" : " " + render(node.argument(), "argument", node.kindName());
            builder.line("return" + value + terminator);
        }

        @Override
        public void visitThrow(ThrowStatement node) {
            builder.line("throw " + render(node.argument(), "argument", node.kindName()) + terminator);
        }

        @Override
        public void visitIf(IfStatement node) {
            builder.line("if (" + render(node.condition(), "condition", node.kindName()) + ") {");
            body(node.consequent());
            if (!node.alternate().isEmpty()) {
                builder.line("} else {");
                body(node.alternate());
            }
            builder.line("}");
        }

        @Override
        public void visitTryCatch(TryCatchStatement node) {
            builder.line("try {");
            body(node.tryBlock());
            if (node.catchClause() != null) {
                String param = node.catchClause().param();
                builder.line(param == null || param.isEmpty() ? "} catch {" : "} catch (" + param + ") {");
                body(node.catchClause().body());
            }
            if (node.finallyBlock() != null) {
                builder.line("} finally {");
                body(node.finallyBlock());
            }
            builder.line("}");
        }

        @Override
        public void visitExpressionStatement(ExpressionStatement node) {
            builder.line(render(node.expression(), "expression", node.kindName()) + terminator);
        }

        @Override
        public void visitUnsupported(UnsupportedNode node) {
            log.debug("Unsupported statement kind '{}' rendered as comment", node.kindName());
            builder.line("// Unsupported statement type: " + node.kindName());
        }
    }

    /**
     * Renders expressions to inline strings. Holds no state.
     */
    private final class ExpressionRenderer implements ExpressionVisitor<String> {

        @Override
        public String visitLiteral(Literal node) {
            if (node.raw() == null) {
                throw new MalformedNodeException(node.kindName(), "raw");
            }
            return node.raw();
        }

        @Override
        public String visitIdentifier(Identifier node) {
            return require(node.name(), "name", node.kindName());
        }

        @Override
        public String visitMember(MemberExpression node) {
            String object = render(node.object(), "object", node.kindName());
            String property = require(node.property(), "property", node.kindName());
            return node.computed() ? object + "[" + property + "]" : object + "." + property;
        }

        @Override
        public String visitCall(CallExpression node) {
            String callee = render(node.callee(), "callee", node.kindName());
            return callee + "(" + renderAll(node.arguments(), "arguments", node.kindName()) + ")";
        }

        @Override
        public String visitNew(NewExpression node) {
            String callee = require(node.callee(), "callee", node.kindName());
            return "new " + callee + "(" + renderAll(node.arguments(), "arguments", node.kindName()) + ")";
        }

        @Override
        public String visitAwait(AwaitExpression node) {
            return "await " + render(node.argument(), "argument", node.kindName());
        }

        @Override
        public String visitUnary(UnaryExpression node) {
            String operator = require(node.operator(), "operator", node.kindName());
            String argument = render(node.argument(), "argument", node.kindName());
            // Keyword operators (typeof, void, delete) need a space
            return Character.isLetter(operator.charAt(operator.length() - 1))
                ? operator + " " + argument
                : operator + argument;
        }

        @Override
        public String visitObject(ObjectExpression node) {
            if (node.properties().isEmpty()) {
                return "{}";
            }
            String properties = node.properties().stream()
                .map(property -> objectProperty(property, node.kindName()))
                .collect(Collectors.joining(", "));
            return "{ " + properties + " }";
        }

        private String objectProperty(ObjectProperty property, String kind) {
            String key = require(property.key(), "properties.key", kind);
            return key + ": " + render(property.value(), "properties.value", kind);
        }

        @Override
        public String visitArray(ArrayExpression node) {
            return "[" + renderAll(node.elements(), "elements", node.kindName()) + "]";
        }

        @Override
        public String visitBinary(BinaryExpression node) {
            String left = render(node.left(), "left", node.kindName());
            String operator = require(node.operator(), "operator", node.kindName());
            String right = render(node.right(), "right", node.kindName());
            return left + " " + operator + " " + right;
        }

        @Override
        public String visitConditional(ConditionalExpression node) {
            String kind = node.kindName();
            return render(node.condition(), "condition", kind)
                + " ? " + render(node.consequent(), "consequent", kind)
                + " : " + render(node.alternate(), "alternate", kind);
        }

        @Override
        public String visitUnsupported(UnsupportedNode node) {
            log.debug("Unsupported expression kind '{}' rendered as comment", node.kindName());
            return "/* unknown expression type: " + node.kindName() + " */";
        }
    }

    private static String quote(String value) {
        StringBuilder quoted = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }
}

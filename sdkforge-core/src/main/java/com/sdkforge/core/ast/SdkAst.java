package com.sdkforge.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Language-neutral AST used to describe generated SDK source files.
 *
 * <p>Nodes are immutable records grouped into three families:
 * <ul>
 *   <li><b>Declarations</b> - top-level program entries (imports, classes, interfaces,
 *       enums, functions)</li>
 *   <li><b>Statements</b> - entries of a body (variables, return, throw, if, try/catch,
 *       expression statements); every declaration may also appear in a body</li>
 *   <li><b>Expressions</b> - inline values rendered to a single string</li>
 * </ul>
 *
 * <p>Builders create nodes, emitters only read them. Records copy their lists into
 * immutable lists but accept {@code null} for required scalar fields: whether a node is
 * complete enough to render is decided by the emitter, which reports the node kind and
 * the missing field.
 *
 * <p>Dispatch goes through {@link StatementVisitor} and {@link ExpressionVisitor}, so a new
 * node kind cannot be added without every emitter handling it.
 *
 * @see NodeKind
 */
public final class SdkAst {

    private SdkAst() {
        // Holder class - no instantiation
    }

    // ---------------------------------------------------------------------------------
    // Families
    // ---------------------------------------------------------------------------------

    /**
     * Common supertype of all nodes.
     */
    public sealed interface Node
        permits Program, Statement, Expression, PropertyDeclaration, Constructor,
                MethodDeclaration, Parameter {

        /**
         * Returns the discriminator of this node.
         *
         * @return node kind
         */
        NodeKind kind();

        /**
         * Returns the kind name used in diagnostics.
         *
         * @return kind name
         */
        default String kindName() {
            return kind().displayName();
        }
    }

    /**
     * Entry of a statement list.
     */
    public sealed interface Statement extends Node
        permits Declaration, VariableDeclaration, ReturnStatement, ThrowStatement,
                IfStatement, TryCatchStatement, ExpressionStatement {

        /**
         * Dispatches this statement to the matching visitor method.
         *
         * @param visitor visitor to call
         */
        void accept(StatementVisitor visitor);
    }

    /**
     * Top-level program entry.
     */
    public sealed interface Declaration extends Statement
        permits Import, ClassDeclaration, InterfaceDeclaration, EnumDeclaration,
                FunctionDeclaration, UnsupportedNode {
    }

    /**
     * Inline value.
     */
    public sealed interface Expression extends Node
        permits Literal, Identifier, MemberExpression, CallExpression, NewExpression,
                AwaitExpression, UnaryExpression, ObjectExpression, ArrayExpression,
                BinaryExpression, ConditionalExpression, UnsupportedNode {

        /**
         * Dispatches this expression to the matching visitor method.
         *
         * @param visitor visitor to call
         * @param <R> rendered result type
         * @return visitor result
         */
        <R> R accept(ExpressionVisitor<R> visitor);
    }

    /**
     * Visitor over every statement kind.
     */
    public interface StatementVisitor {
        void visitImport(Import node);
        void visitClass(ClassDeclaration node);
        void visitInterface(InterfaceDeclaration node);
        void visitEnum(EnumDeclaration node);
        void visitFunction(FunctionDeclaration node);
        void visitVariable(VariableDeclaration node);
        void visitReturn(ReturnStatement node);
        void visitThrow(ThrowStatement node);
        void visitIf(IfStatement node);
        void visitTryCatch(TryCatchStatement node);
        void visitExpressionStatement(ExpressionStatement node);
        void visitUnsupported(UnsupportedNode node);
    }

    /**
     * Visitor over every expression kind.
     *
     * @param <R> result type
     */
    public interface ExpressionVisitor<R> {
        R visitLiteral(Literal node);
        R visitIdentifier(Identifier node);
        R visitMember(MemberExpression node);
        R visitCall(CallExpression node);
        R visitNew(NewExpression node);
        R visitAwait(AwaitExpression node);
        R visitUnary(UnaryExpression node);
        R visitObject(ObjectExpression node);
        R visitArray(ArrayExpression node);
        R visitBinary(BinaryExpression node);
        R visitConditional(ConditionalExpression node);
        R visitUnsupported(UnsupportedNode node);
    }

    /**
     * Argument, element or operand that is either pre-rendered text or a nested expression.
     */
    public sealed interface Operand permits Operand.Raw, Operand.Nested {

        /**
         * Text used verbatim.
         *
         * @param text raw source text
         */
        record Raw(String text) implements Operand {
        }

        /**
         * Expression rendered recursively.
         *
         * @param expression nested expression
         */
        record Nested(Expression expression) implements Operand {
        }

        static Operand raw(String text) {
            return new Raw(text);
        }

        static Operand of(Expression expression) {
            return new Nested(expression);
        }

        static List<Operand> raw(String... texts) {
            return Arrays.stream(texts).map(Operand::raw).toList();
        }
    }

    // ---------------------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------------------

    /**
     * A source file: ordered top-level declarations, emitted in list order.
     *
     * @param declarations top-level declarations
     */
    public record Program(List<Declaration> declarations) implements Node {
        public Program {
            declarations = copy(declarations);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PROGRAM;
        }
    }

    /**
     * Named import from a module.
     *
     * @param source module path
     * @param names imported names
     */
    public record Import(String source, List<ImportName> names) implements Declaration {
        public Import {
            names = copy(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitImport(this);
        }
    }

    /**
     * Imported name with optional alias.
     *
     * @param name exported name
     * @param alias local alias, may be null
     */
    public record ImportName(String name, String alias) {
        public static ImportName of(String name) {
            return new ImportName(name, null);
        }
    }

    /**
     * Class declaration.
     *
     * @param name class name
     * @param superclass extended class, may be null
     * @param capabilities implemented interfaces
     * @param properties properties in declared order
     * @param constructor constructor, may be null
     * @param methods methods in declared order
     * @param exported whether the class is exported
     * @param documentation doc comment text, may be null
     */
    public record ClassDeclaration(
        String name,
        String superclass,
        List<String> capabilities,
        List<PropertyDeclaration> properties,
        Constructor constructor,
        List<MethodDeclaration> methods,
        boolean exported,
        String documentation
    ) implements Declaration {
        public ClassDeclaration {
            capabilities = copy(capabilities);
            properties = copy(properties);
            methods = copy(methods);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CLASS_DECLARATION;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitClass(this);
        }

        /**
         * Returns a copy with extra methods appended after the existing ones.
         *
         * @param extra methods to append
         * @return new class declaration
         */
        public ClassDeclaration withMethodsAppended(List<MethodDeclaration> extra) {
            List<MethodDeclaration> all = new ArrayList<>(methods);
            all.addAll(extra);
            return new ClassDeclaration(name, superclass, capabilities, properties,
                constructor, all, exported, documentation);
        }
    }

    /**
     * Interface declaration.
     *
     * @param name interface name
     * @param extendsList extended interfaces
     * @param properties properties in declared order
     * @param exported whether the interface is exported
     * @param documentation doc comment text, may be null
     */
    public record InterfaceDeclaration(
        String name,
        List<String> extendsList,
        List<PropertyDeclaration> properties,
        boolean exported,
        String documentation
    ) implements Declaration {
        public InterfaceDeclaration {
            extendsList = copy(extendsList);
            properties = copy(properties);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INTERFACE_DECLARATION;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitInterface(this);
        }
    }

    /**
     * Enum declaration.
     *
     * @param name enum name
     * @param members members in declared order
     * @param exported whether the enum is exported
     * @param documentation doc comment text, may be null
     */
    public record EnumDeclaration(
        String name,
        List<EnumMember> members,
        boolean exported,
        String documentation
    ) implements Declaration {
        public EnumDeclaration {
            members = copy(members);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ENUM_DECLARATION;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitEnum(this);
        }
    }

    /**
     * Enum member.
     *
     * @param name member name
     * @param value member value, rendered as a quoted string
     */
    public record EnumMember(String name, String value) {
    }

    /**
     * Free function declaration.
     *
     * @param name function name
     * @param async whether the function is async
     * @param exported whether the function is exported
     * @param parameters parameters
     * @param returnType return type annotation, may be null
     * @param body statements
     * @param documentation doc comment text, may be null
     */
    public record FunctionDeclaration(
        String name,
        boolean async,
        boolean exported,
        List<Parameter> parameters,
        String returnType,
        List<Statement> body,
        String documentation
    ) implements Declaration {
        public FunctionDeclaration {
            parameters = copy(parameters);
            body = copy(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_DECLARATION;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitFunction(this);
        }
    }

    // ---------------------------------------------------------------------------------
    // Class members
    // ---------------------------------------------------------------------------------

    /**
     * Class or interface property.
     *
     * @param name property name
     * @param valueType type annotation
     * @param initializer initial value, may be null
     * @param readonly whether the property is readonly
     * @param isPrivate whether the property is private
     * @param optional whether the property may be absent
     */
    public record PropertyDeclaration(
        String name,
        String valueType,
        Expression initializer,
        boolean readonly,
        boolean isPrivate,
        boolean optional
    ) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.PROPERTY_DECLARATION;
        }

        public static PropertyDeclaration field(String name, String valueType, boolean optional) {
            return new PropertyDeclaration(name, valueType, null, false, false, optional);
        }
    }

    /**
     * Class constructor.
     *
     * @param parameters parameters
     * @param body statements
     */
    public record Constructor(List<Parameter> parameters, List<Statement> body) implements Node {
        public Constructor {
            parameters = copy(parameters);
            body = copy(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONSTRUCTOR;
        }
    }

    /**
     * Class method.
     *
     * @param name method name
     * @param parameters parameters, in declared order
     * @param returnType return type annotation, may be null
     * @param body statements
     * @param async whether the method is async
     * @param isPrivate whether the method is private
     * @param documentation structured doc comment, may be null
     */
    public record MethodDeclaration(
        String name,
        List<Parameter> parameters,
        String returnType,
        List<Statement> body,
        boolean async,
        boolean isPrivate,
        DocComment documentation
    ) implements Node {
        public MethodDeclaration {
            parameters = copy(parameters);
            body = copy(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.METHOD_DECLARATION;
        }
    }

    /**
     * Function, method or constructor parameter.
     *
     * @param name parameter name
     * @param type type annotation
     * @param optional whether the parameter may be omitted
     */
    public record Parameter(String name, String type, boolean optional) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.PARAMETER;
        }
    }

    // ---------------------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------------------

    /**
     * Binding keyword of a variable declaration.
     */
    public enum Binding {
        CONST("const"),
        LET("let"),
        VAR("var");

        private final String keyword;

        Binding(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    /**
     * Variable declaration.
     *
     * @param binding binding keyword
     * @param name variable name
     * @param valueType type annotation, may be null
     * @param initializer initial value, may be null
     */
    public record VariableDeclaration(
        Binding binding,
        String name,
        String valueType,
        Expression initializer
    ) implements Statement {
        @Override
        public NodeKind kind() {
            return NodeKind.VARIABLE_DECLARATION;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitVariable(this);
        }
    }

    /**
     * Return statement.
     *
     * @param argument returned value, may be null
     */
    public record ReturnStatement(Expression argument) implements Statement {
        @Override
        public NodeKind kind() {
            return NodeKind.RETURN_STATEMENT;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitReturn(this);
        }
    }

    /**
     * Throw statement.
     *
     * @param argument thrown value
     */
    public record ThrowStatement(Expression argument) implements Statement {
        @Override
        public NodeKind kind() {
            return NodeKind.THROW_STATEMENT;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitThrow(this);
        }
    }

    /**
     * If statement with optional else branch.
     *
     * @param condition condition
     * @param consequent statements run when the condition holds
     * @param alternate statements run otherwise, empty for no else branch
     */
    public record IfStatement(
        Expression condition,
        List<Statement> consequent,
        List<Statement> alternate
    ) implements Statement {
        public IfStatement {
            consequent = copy(consequent);
            alternate = copy(alternate);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF_STATEMENT;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitIf(this);
        }
    }

    /**
     * Try statement with optional catch clause and finally block.
     *
     * @param tryBlock guarded statements
     * @param catchClause catch clause, may be null
     * @param finallyBlock finally statements, null for no finally block
     */
    public record TryCatchStatement(
        List<Statement> tryBlock,
        CatchClause catchClause,
        List<Statement> finallyBlock
    ) implements Statement {
        public TryCatchStatement {
            tryBlock = copy(tryBlock);
            finallyBlock = finallyBlock != null ? List.copyOf(finallyBlock) : null;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TRY_CATCH_STATEMENT;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitTryCatch(this);
        }
    }

    /**
     * Catch clause of a try statement.
     *
     * @param param bound exception name
     * @param body handler statements
     */
    public record CatchClause(String param, List<Statement> body) {
        public CatchClause {
            body = copy(body);
        }
    }

    /**
     * Expression evaluated for its side effect (calls, assignments).
     *
     * @param expression expression
     */
    public record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPRESSION_STATEMENT;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitExpressionStatement(this);
        }
    }

    // ---------------------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------------------

    /**
     * Literal with its pre-rendered source text.
     *
     * @param raw source text (e.g. {@code "\"bearer\""}, {@code 30000}, {@code null})
     */
    public record Literal(String raw) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.LITERAL;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        public static Literal string(String value) {
            return new Literal("\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
        }
    }

    /**
     * Identifier reference.
     *
     * @param name identifier
     */
    public record Identifier(String name) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.IDENTIFIER;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Property access, {@code object.property} or {@code object[property]}.
     *
     * @param object accessed object
     * @param property property name or index expression text
     * @param computed whether bracket notation is used
     */
    public record MemberExpression(Operand object, String property, boolean computed) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.MEMBER_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitMember(this);
        }

        public static MemberExpression of(String object, String property) {
            return new MemberExpression(Operand.raw(object), property, false);
        }
    }

    /**
     * Function or method call.
     *
     * @param callee called function
     * @param arguments arguments in order
     */
    public record CallExpression(Operand callee, List<Operand> arguments) implements Expression {
        public CallExpression {
            arguments = copy(arguments);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        public static CallExpression of(String callee, String... arguments) {
            return new CallExpression(Operand.raw(callee), Operand.raw(arguments));
        }
    }

    /**
     * Constructor invocation, {@code new Callee(args)}.
     *
     * @param callee instantiated type
     * @param arguments arguments in order
     */
    public record NewExpression(String callee, List<Operand> arguments) implements Expression {
        public NewExpression {
            arguments = copy(arguments);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NEW_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNew(this);
        }

        public static NewExpression of(String callee, String... arguments) {
            return new NewExpression(callee, Operand.raw(arguments));
        }
    }

    /**
     * Await of a promise.
     *
     * @param argument awaited expression
     */
    public record AwaitExpression(Expression argument) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.AWAIT_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    /**
     * Prefix unary operation.
     *
     * @param operator operator (e.g. "!")
     * @param argument operand
     */
    public record UnaryExpression(String operator, Operand argument) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * Object literal.
     *
     * @param properties key/value pairs in order
     */
    public record ObjectExpression(List<ObjectProperty> properties) implements Expression {
        public ObjectExpression {
            properties = copy(properties);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.OBJECT_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    /**
     * Object literal entry.
     *
     * @param key property key
     * @param value property value
     */
    public record ObjectProperty(String key, Operand value) {
        public static ObjectProperty raw(String key, String value) {
            return new ObjectProperty(key, Operand.raw(value));
        }
    }

    /**
     * Array literal.
     *
     * @param elements elements in order
     */
    public record ArrayExpression(List<Operand> elements) implements Expression {
        public ArrayExpression {
            elements = copy(elements);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /**
     * Binary operation, assignments included.
     *
     * @param left left operand
     * @param operator operator (e.g. "+", "===", "=")
     * @param right right operand
     */
    public record BinaryExpression(Operand left, String operator, Operand right) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.BINARY_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        public static BinaryExpression assign(String target, String value) {
            return new BinaryExpression(Operand.raw(target), "=", Operand.raw(value));
        }
    }

    /**
     * Ternary conditional.
     *
     * @param condition condition
     * @param consequent value when true
     * @param alternate value when false
     */
    public record ConditionalExpression(
        Expression condition,
        Expression consequent,
        Expression alternate
    ) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.CONDITIONAL_EXPRESSION;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    /**
     * Node of a kind no emitter recognizes, identified only by its kind name.
     *
     * <p>Emitters render it as a marker comment and continue with the rest of the program.
     *
     * @param name kind name as produced upstream (e.g. "ForOfStatement")
     */
    public record UnsupportedNode(String name) implements Declaration, Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.UNSUPPORTED;
        }

        @Override
        public String kindName() {
            return name;
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visitUnsupported(this);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }
}

package com.sdkforge.core.emitter;

import com.sdkforge.core.ast.SdkAst.Expression;
import com.sdkforge.core.ast.SdkAst.Program;
import com.sdkforge.core.ast.SdkAst.Statement;
import java.util.List;

/**
 * Renders {@link com.sdkforge.core.ast.SdkAst} trees into source text of one target
 * language family.
 *
 * <p>Implementations are stateless: options are fixed at construction and every call
 * creates its own {@link LineBuilder}, so one instance may serve concurrent runs.
 *
 * <p>Two failure modes apply to every implementation:
 * <ul>
 *   <li>a node of a kind the emitter does not render is written as a marker comment naming
 *       the kind, and emission continues</li>
 *   <li>a node missing a required field raises
 *       {@link com.sdkforge.core.error.MalformedNodeException} and emission stops</li>
 * </ul>
 */
public interface CodeEmitter {

    /**
     * Returns the target language identifier (e.g. "typescript").
     *
     * @return language id
     */
    String id();

    /**
     * Returns the file extension of emitted sources.
     *
     * @return extension without leading dot
     */
    String fileExtension();

    /**
     * Returns the formatting options used by this emitter.
     *
     * @return options
     */
    EmitterOptions options();

    /**
     * Renders a whole program; each top-level declaration is followed by one blank line.
     *
     * @param program program to render
     * @return source text
     */
    String emitProgram(Program program);

    /**
     * Renders a statement list at indentation level zero.
     *
     * @param statements statements to render
     * @return source text
     */
    String emitStatements(List<? extends Statement> statements);

    /**
     * Renders one expression inline.
     *
     * @param expression expression to render
     * @return expression text
     */
    String emitExpression(Expression expression);
}

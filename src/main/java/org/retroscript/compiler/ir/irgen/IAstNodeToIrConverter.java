package org.retroscript.compiler.ir.irgen;

import org.retroscript.compiler.frontend.parser.ast.AstNode;

/**
 * Converts one statement into IR actions, emitting them into the {@link IrGenContext}.
 *
 * @param <T> the concrete statement type
 */
public interface IAstNodeToIrConverter<T extends AstNode> {

    /**
     * Converts the given node.
     *
     * @param node the statement to convert
     * @param ctx  the generation context receiving the actions
     */
    void convert(T node, IrGenContext ctx);
}

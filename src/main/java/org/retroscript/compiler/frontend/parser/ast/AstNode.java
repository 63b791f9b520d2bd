package org.retroscript.compiler.frontend.parser.ast;

import org.retroscript.compiler.model.Span;

import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * The set of node kinds is closed; consumers use {@link AstVisitor} for exhaustive handling
 * or {@link #getChildren()} for generic traversal.
 */
public sealed interface AstNode permits Program, FlowDecl, InterruptDecl, HotkeysDecl, CatchClause,
        Statement, Expression {

    NodeMeta meta();

    default Span span() {
        return meta().span();
    }

    /**
     * Returns the direct children of this node in source order.
     *
     * @return the child nodes, empty for leaves.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }

    <R> R accept(AstVisitor<R> visitor);
}

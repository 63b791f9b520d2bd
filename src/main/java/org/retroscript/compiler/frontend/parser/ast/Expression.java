package org.retroscript.compiler.frontend.parser.ast;

/**
 * Marker for nodes that produce a value.
 */
public sealed interface Expression extends AstNode permits Literal, Identifier, BinaryExpr, UnaryExpr,
        CallExpr, ArrayExpr {
}

package org.retroscript.compiler.frontend.parser.ast;

/**
 * Marker for nodes that may appear in a block.
 */
public sealed interface Statement extends AstNode permits ConstStmt, BlockStmt, IfStmt, WhileStmt, ForStmt,
        LabelStmt, GotoStmt, LetStmt, AssignStmt, BreakStmt, ContinueStmt, ReturnStmt, TryStmt, ExprStmt {
}

package org.retroscript.compiler.frontend.parser.ast;

/**
 * Visitor with one method per node kind. Adding a node kind breaks every implementation,
 * which keeps formatters and mappers exhaustive.
 *
 * @param <R> the result type
 */
public interface AstVisitor<R> {
    R visitProgram(Program node);
    R visitFlow(FlowDecl node);
    R visitInterrupt(InterruptDecl node);
    R visitHotkeys(HotkeysDecl node);
    R visitConst(ConstStmt node);
    R visitBlock(BlockStmt node);
    R visitIf(IfStmt node);
    R visitWhile(WhileStmt node);
    R visitFor(ForStmt node);
    R visitLabel(LabelStmt node);
    R visitGoto(GotoStmt node);
    R visitLet(LetStmt node);
    R visitAssign(AssignStmt node);
    R visitBreak(BreakStmt node);
    R visitContinue(ContinueStmt node);
    R visitReturn(ReturnStmt node);
    R visitTry(TryStmt node);
    R visitCatch(CatchClause node);
    R visitExprStmt(ExprStmt node);
    R visitLiteral(Literal node);
    R visitIdentifier(Identifier node);
    R visitBinary(BinaryExpr node);
    R visitUnary(UnaryExpr node);
    R visitCall(CallExpr node);
    R visitArray(ArrayExpr node);
}

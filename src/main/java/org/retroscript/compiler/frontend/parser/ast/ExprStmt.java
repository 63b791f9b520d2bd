package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

public record ExprStmt(NodeMeta meta, Expression expression) implements Statement {

    /**
     * @return the call when this statement is a plain call, otherwise null.
     */
    public CallExpr call() {
        return expression instanceof CallExpr c ? c : null;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExprStmt(this);
    }
}

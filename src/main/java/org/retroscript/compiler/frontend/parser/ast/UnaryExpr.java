package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A prefix operation: {@code !} (also written {@code not}) or {@code -}.
 */
public record UnaryExpr(NodeMeta meta, String operator, Expression operand) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}

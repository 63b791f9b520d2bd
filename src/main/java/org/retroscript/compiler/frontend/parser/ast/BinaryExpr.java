package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A binary operation. Logical operators are normalized to {@code and} and {@code or}.
 */
public record BinaryExpr(NodeMeta meta, Expression left, String operator, Expression right) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}

package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

public record ArrayExpr(NodeMeta meta, List<Expression> elements) implements Expression {

    public ArrayExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}

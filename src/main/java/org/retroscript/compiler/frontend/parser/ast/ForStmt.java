package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code for NAME in expr { }}. Also the lowering target of {@code repeat}.
 */
public record ForStmt(NodeMeta meta, String variable, Expression iterable, BlockStmt body) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(iterable, body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}

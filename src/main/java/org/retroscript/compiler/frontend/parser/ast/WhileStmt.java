package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

public record WhileStmt(NodeMeta meta, Expression condition, BlockStmt body) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}

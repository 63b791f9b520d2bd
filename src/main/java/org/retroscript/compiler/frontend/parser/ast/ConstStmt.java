package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code const NAME = expr;}
 */
public record ConstStmt(NodeMeta meta, String name, Expression value) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConst(this);
    }
}

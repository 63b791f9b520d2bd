package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param value the returned expression, or null
 */
public record ReturnStmt(NodeMeta meta, Expression value) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}

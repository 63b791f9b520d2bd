package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code target = expr;} where target is an identifier or a {@code $variable}.
 */
public record AssignStmt(NodeMeta meta, String target, Expression value) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}

package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code let NAME [= expr];}
 *
 * @param value the initializer, or null
 */
public record LetStmt(NodeMeta meta, String name, Expression value) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}

package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param variable the bound error variable, or null
 */
public record CatchClause(NodeMeta meta, String variable, BlockStmt body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCatch(this);
    }
}

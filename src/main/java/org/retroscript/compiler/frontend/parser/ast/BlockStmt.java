package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A brace-delimited statement list.
 */
public record BlockStmt(NodeMeta meta, List<Statement> statements) implements Statement {

    public BlockStmt {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}

package org.retroscript.compiler.frontend.parser.ast;

public record BreakStmt(NodeMeta meta) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}

package org.retroscript.compiler.frontend.parser.ast;

public record ContinueStmt(NodeMeta meta) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}

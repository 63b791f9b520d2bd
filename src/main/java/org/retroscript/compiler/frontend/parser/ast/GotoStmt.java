package org.retroscript.compiler.frontend.parser.ast;

public record GotoStmt(NodeMeta meta, String label) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGoto(this);
    }
}

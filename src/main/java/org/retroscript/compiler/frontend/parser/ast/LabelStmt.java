package org.retroscript.compiler.frontend.parser.ast;

public record LabelStmt(NodeMeta meta, String name) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLabel(this);
    }
}

package org.retroscript.compiler.frontend.parser.ast;

/**
 * A name reference. {@code $variables} keep their leading dollar sign.
 */
public record Identifier(NodeMeta meta, String name) implements Expression {

    public boolean isVariable() {
        return name.startsWith("$");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}

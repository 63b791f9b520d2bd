package org.retroscript.compiler.frontend.parser.ast;

/**
 * A literal value.
 *
 * @param kind  the literal kind
 * @param value the decoded value: {@link Long}, {@link Double}, {@link String}, {@link Boolean} or null;
 *              durations keep their source text
 * @param text  the source lexeme
 */
public record Literal(NodeMeta meta, Kind kind, Object value, String text) implements Expression {

    public enum Kind {
        INTEGER, FLOAT, STRING, DURATION, BOOLEAN, NULL
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}

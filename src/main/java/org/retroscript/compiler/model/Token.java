package org.retroscript.compiler.model;

/**
 * A single lexical token. Positions are 1-based; the end column is exclusive.
 *
 * @param type      the token kind
 * @param text      the lexeme; keywords are lowercased, strings carry their unescaped value
 * @param line      start line
 * @param column    start column
 * @param endLine   end line
 * @param endColumn end column (exclusive)
 */
public record Token(TokenType type, String text, int line, int column, int endLine, int endColumn) {

    public Span span() {
        return new Span(line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}

package org.retroscript.compiler.model;

/**
 * A source range. Positions are 1-based and ordered by line, then column.
 */
public record Span(int startLine, int startColumn, int endLine, int endColumn) {

    /** Span used for synthesized nodes that have no source text. */
    public static final Span NONE = new Span(0, 0, 0, 0);

    public static Span of(Token token) {
        return token.span();
    }

    /**
     * @return the span from the start of {@code first} to the end of {@code last}.
     */
    public static Span between(Token first, Token last) {
        return new Span(first.line(), first.column(), last.endLine(), last.endColumn());
    }

    /**
     * Returns the smallest span covering both arguments.
     */
    public static Span merge(Span a, Span b) {
        if (a == null || a == NONE) return b;
        if (b == null || b == NONE) return a;
        boolean aStartsFirst = compare(a.startLine, a.startColumn, b.startLine, b.startColumn) <= 0;
        boolean aEndsLast = compare(a.endLine, a.endColumn, b.endLine, b.endColumn) >= 0;
        return new Span(
                aStartsFirst ? a.startLine : b.startLine,
                aStartsFirst ? a.startColumn : b.startColumn,
                aEndsLast ? a.endLine : b.endLine,
                aEndsLast ? a.endColumn : b.endColumn);
    }

    public boolean contains(Span other) {
        if (other == null || other == NONE || this == NONE) return true;
        return compare(startLine, startColumn, other.startLine, other.startColumn) <= 0
                && compare(endLine, endColumn, other.endLine, other.endColumn) >= 0;
    }

    private static int compare(int line1, int col1, int line2, int col2) {
        return line1 != line2 ? Integer.compare(line1, line2) : Integer.compare(col1, col2);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}

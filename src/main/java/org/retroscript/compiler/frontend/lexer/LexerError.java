package org.retroscript.compiler.frontend.lexer;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.model.Span;

/**
 * A recoverable lexical error. The lexer records it and resumes at the next character.
 */
public record LexerError(Kind kind, String message, String text, int line, int column) {

    public enum Kind {
        UNTERMINATED_STRING,
        UNTERMINATED_COMMENT,
        UNEXPECTED_CHARACTER
    }

    /**
     * Converts this error into the diagnostic the parser reports for it.
     */
    public Diagnostic toDiagnostic() {
        Span span = new Span(line, column, line, column + Math.max(1, text.length()));
        return switch (kind) {
            case UNTERMINATED_STRING -> Diagnostics.unterminatedString(span);
            case UNTERMINATED_COMMENT -> Diagnostics.unterminatedComment(span);
            case UNEXPECTED_CHARACTER -> Diagnostics.unexpectedCharacter(text, span);
        };
    }

    @Override
    public String toString() {
        return message + " at line " + line + ", column " + column;
    }
}

package org.retroscript.compiler.frontend.lexer;

import org.retroscript.compiler.model.Token;

import java.util.List;

/**
 * Output of {@link Lexer#tokenize()}.
 *
 * @param tokens   the token stream without comments, terminated by an EOF token
 * @param comments line and block comments in source order
 * @param errors   recoverable lexical errors
 */
public record LexResult(List<Token> tokens, List<Token> comments, List<LexerError> errors) {

    public LexResult {
        tokens = List.copyOf(tokens);
        comments = List.copyOf(comments);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

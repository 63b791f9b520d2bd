package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.Expression;
import org.retroscript.compiler.frontend.parser.ast.NodeMeta;
import org.retroscript.compiler.model.Span;
import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;

/**
 * Provides statement handlers with access to the token stream and to the core grammar rules.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type     The expected token type.
     * @param expected The expected text, used in the diagnostic (for example {@code "{"}).
     * @return The consumed token.
     * @throws ParseException if the current token has a different type.
     */
    Token consume(TokenType type, String expected);

    /**
     * Parses a full expression at the lowest precedence level.
     * @return The parsed expression.
     */
    Expression expression();

    /**
     * Parses a brace-delimited block, recovering from errors inside it.
     * @return The parsed block.
     */
    BlockStmt block();

    /**
     * Creates node metadata spanning from {@code start} to the last consumed token.
     * @param start The first token of the node.
     * @return Fresh metadata with a unique node id.
     */
    NodeMeta metaFrom(Token start);

    /**
     * Creates node metadata for a synthesized node with the given span.
     * @param span The span to record.
     * @return Fresh metadata with a unique node id.
     */
    NodeMeta meta(Span span);

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}

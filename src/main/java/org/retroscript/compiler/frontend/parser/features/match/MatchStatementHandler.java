package org.retroscript.compiler.frontend.parser.features.match;

import org.retroscript.compiler.frontend.parser.IParserStatementHandler;
import org.retroscript.compiler.frontend.parser.ParsingContext;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.Expression;
import org.retroscript.compiler.frontend.parser.ast.IfStmt;
import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code match expr [:] { Pattern[(a, b)] [:] { ... } ... } [end]}.
 * <p>
 * Pattern matching is simplified: the statement is lowered to an {@code if} on the match
 * expression whose body is the first arm. The remaining arms are parsed for error reporting
 * and then dropped.
 */
public class MatchStatementHandler implements IParserStatementHandler {

    private static final Logger log = LoggerFactory.getLogger(MatchStatementHandler.class);

    @Override
    public Statement parse(ParsingContext context) {
        Token start = context.advance();
        Expression subject = context.expression();
        context.match(TokenType.COLON);

        context.consume(TokenType.LBRACE, "{");
        List<BlockStmt> arms = new ArrayList<>();
        while (!context.check(TokenType.RBRACE) && !context.isAtEnd()) {
            arms.add(arm(context));
        }
        context.consume(TokenType.RBRACE, "}");
        context.match(TokenType.END);

        if (arms.size() > 1) {
            log.debug("match at line {}: keeping first of {} arms", start.line(), arms.size());
        }
        BlockStmt body = arms.isEmpty() ? new BlockStmt(context.meta(start.span()), List.of()) : arms.get(0);
        return new IfStmt(context.metaFrom(start), subject, body, List.of(), null);
    }

    private static BlockStmt arm(ParsingContext context) {
        if (!context.match(TokenType.IDENTIFIER, TokenType.STRING, TokenType.INTEGER, TokenType.NULL,
                TokenType.TRUE, TokenType.FALSE)) {
            context.consume(TokenType.IDENTIFIER, "match pattern");
        }
        if (context.match(TokenType.LPAREN)) {
            if (!context.check(TokenType.RPAREN)) {
                do {
                    context.consume(TokenType.IDENTIFIER, "pattern binding");
                } while (context.match(TokenType.COMMA));
            }
            context.consume(TokenType.RPAREN, ")");
        }
        context.match(TokenType.COLON, TokenType.ARROW);
        BlockStmt body = context.block();
        context.match(TokenType.COMMA, TokenType.SEMICOLON);
        return body;
    }
}

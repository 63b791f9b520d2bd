package org.retroscript.compiler.frontend.parser.features.repeat;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.frontend.parser.IParserStatementHandler;
import org.retroscript.compiler.frontend.parser.ParseException;
import org.retroscript.compiler.frontend.parser.ParsingContext;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.CallExpr;
import org.retroscript.compiler.frontend.parser.ast.ForStmt;
import org.retroscript.compiler.frontend.parser.ast.Identifier;
import org.retroscript.compiler.frontend.parser.ast.Literal;
import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.model.Span;
import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;

import java.util.List;
import java.util.Map;

/**
 * Handles {@code repeat [N] [times] [:] { ... } [end]}.
 * The statement is lowered to {@code for _i in range(N) { ... }}; without a count the loop
 * runs {@value #DEFAULT_COUNT} times.
 */
public class RepeatStatementHandler implements IParserStatementHandler {

    public static final String LOOP_VARIABLE = "_i";
    public static final long DEFAULT_COUNT = 1000;

    @Override
    public Statement parse(ParsingContext context) {
        Token start = context.advance();

        Literal count;
        Span headerSpan;
        if (context.check(TokenType.INTEGER)) {
            Token countToken = context.advance();
            count = new Literal(context.meta(countToken.span()), Literal.Kind.INTEGER,
                    parseCount(countToken), countToken.text());
            headerSpan = Span.between(start, countToken);
        } else {
            headerSpan = Span.of(start);
            count = new Literal(context.meta(headerSpan), Literal.Kind.INTEGER, DEFAULT_COUNT,
                    String.valueOf(DEFAULT_COUNT));
        }
        context.match(TokenType.TIMES);
        context.match(TokenType.COLON);

        BlockStmt body = context.block();
        context.match(TokenType.END);

        Identifier range = new Identifier(context.meta(Span.of(start)), "range");
        CallExpr iterable = new CallExpr(context.meta(headerSpan), range, List.of(count), Map.of());
        return new ForStmt(context.metaFrom(start), LOOP_VARIABLE, iterable, body);
    }

    private static long parseCount(Token token) {
        try {
            return Long.parseLong(token.text());
        } catch (NumberFormatException e) {
            throw new ParseException(Diagnostics.invalidNumber(token.text(), token.span()));
        }
    }
}

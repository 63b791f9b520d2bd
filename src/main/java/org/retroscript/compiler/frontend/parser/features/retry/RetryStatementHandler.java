package org.retroscript.compiler.frontend.parser.features.retry;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.frontend.parser.IParserStatementHandler;
import org.retroscript.compiler.frontend.parser.ParseException;
import org.retroscript.compiler.frontend.parser.ParsingContext;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.CatchClause;
import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.frontend.parser.ast.TryStmt;
import org.retroscript.compiler.model.Span;
import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;

import java.util.List;

/**
 * Handles {@code retry [N] [times] [:] { ... } [end] [else [:] { ... } [end]]}.
 * The statement is lowered to a {@link TryStmt} carrying the attempt count; the else block
 * becomes the catch body bound to {@value TryStmt#RETRY_ERROR_VARIABLE}.
 */
public class RetryStatementHandler implements IParserStatementHandler {

    public static final int DEFAULT_ATTEMPTS = 3;

    @Override
    public Statement parse(ParsingContext context) {
        Token start = context.advance();

        int attempts = DEFAULT_ATTEMPTS;
        if (context.check(TokenType.INTEGER)) {
            Token countToken = context.advance();
            try {
                attempts = Integer.parseInt(countToken.text());
            } catch (NumberFormatException e) {
                throw new ParseException(Diagnostics.invalidNumber(countToken.text(), countToken.span()));
            }
        }
        context.match(TokenType.TIMES);
        context.match(TokenType.COLON);

        BlockStmt tryBlock = context.block();
        context.match(TokenType.END);

        BlockStmt fallback;
        Token catchStart;
        if (context.match(TokenType.ELSE)) {
            catchStart = context.previous();
            context.match(TokenType.COLON);
            fallback = context.block();
            context.match(TokenType.END);
        } else {
            catchStart = context.previous();
            Span end = new Span(catchStart.endLine(), catchStart.endColumn(), catchStart.endLine(), catchStart.endColumn());
            fallback = new BlockStmt(context.meta(end), List.of());
        }
        CatchClause catchClause = new CatchClause(context.metaFrom(catchStart), TryStmt.RETRY_ERROR_VARIABLE, fallback);
        return new TryStmt(context.metaFrom(start), tryBlock, catchClause, attempts);
    }
}

package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.lexer.LexResult;
import org.retroscript.compiler.frontend.lexer.Lexer;
import org.retroscript.compiler.frontend.lexer.LexerError;
import org.retroscript.compiler.frontend.parser.ast.*;
import org.retroscript.compiler.model.Span;
import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for RetroScript.
 * <p>
 * Errors inside a declaration or statement are thrown as {@link ParseException}, recorded by the
 * nearest enclosing block or program loop, and followed by {@link #synchronize()}. A single
 * malformed statement therefore never discards its siblings.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> STATEMENT_STARTS = EnumSet.of(
            TokenType.FLOW, TokenType.INTERRUPT, TokenType.HOTKEYS, TokenType.CONST,
            TokenType.IF, TokenType.WHILE, TokenType.FOR, TokenType.LABEL, TokenType.GOTO,
            TokenType.LET, TokenType.TRY, TokenType.RETURN, TokenType.BREAK, TokenType.CONTINUE,
            TokenType.REPEAT, TokenType.RETRY, TokenType.MATCH, TokenType.RBRACE);

    private static final Set<TokenType> DECLARATION_STARTS = EnumSet.of(
            TokenType.FLOW, TokenType.INTERRUPT, TokenType.HOTKEYS);

    private final List<Token> tokens;
    private final List<Token> comments;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final ParserStatementRegistry statementRegistry;
    private int current = 0;
    private int nodeCounter = 0;

    public Parser(String source) {
        this(new Lexer(source).tokenize());
    }

    public Parser(LexResult lexResult) {
        this(lexResult, ParserStatementRegistry.initialize());
    }

    public Parser(LexResult lexResult, ParserStatementRegistry statementRegistry) {
        this.tokens = lexResult.tokens().stream().filter(t -> t.type() != TokenType.ERROR).toList();
        this.comments = lexResult.comments();
        this.statementRegistry = statementRegistry;
        for (LexerError error : lexResult.errors()) {
            diagnostics.report(error.toDiagnostic());
        }
    }

    /**
     * Parses the whole token stream. Never throws on malformed input.
     *
     * @return the recovered program with all diagnostics and comments.
     */
    public ParseResult parse() {
        Token start = peek();
        HotkeysDecl hotkeys = null;
        List<FlowDecl> flows = new ArrayList<>();
        List<InterruptDecl> interrupts = new ArrayList<>();
        List<ConstStmt> constants = new ArrayList<>();

        while (!isAtEnd()) {
            try {
                switch (peek().type()) {
                    case HOTKEYS -> hotkeys = hotkeysDeclaration();
                    case FLOW -> flows.add(flowDeclaration());
                    case INTERRUPT -> interrupts.add(interruptDeclaration());
                    case CONST -> constants.add(constStatement());
                    default -> throw new ParseException(
                            Diagnostics.expectedDeclaration(describe(peek()), peek().span()));
                }
            } catch (ParseException e) {
                recordAndSynchronize(e);
            }
        }

        Span span = tokens.size() > 1 ? Span.between(start, previousOrStart()) : Span.of(start);
        Program program = new Program(new NodeMeta(span, nextId()), hotkeys, flows, interrupts, constants);
        CommentAttacher.attach(program, comments);
        log.debug("Parsed {} flows, {} interrupts, {} constants with {} diagnostics",
                flows.size(), interrupts.size(), constants.size(), diagnostics.getDiagnostics().size());
        return new ParseResult(program, diagnostics.getDiagnostics(), comments);
    }

    // ---------------------------------------------------------------------------------------------
    // Declarations

    private HotkeysDecl hotkeysDeclaration() {
        Token start = advance();
        consume(TokenType.LBRACE, "{");
        Map<String, String> bindings = new LinkedHashMap<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            Token name = consume(TokenType.IDENTIFIER, "hotkey name");
            consume(TokenType.EQUAL, "=");
            Token value = consume(TokenType.STRING, "key string");
            bindings.put(name.text(), value.text());
            match(TokenType.SEMICOLON, TokenType.COMMA);
        }
        consume(TokenType.RBRACE, "}");
        return new HotkeysDecl(metaFrom(start), bindings);
    }

    private FlowDecl flowDeclaration() {
        Token start = advance();
        Token name = consume(TokenType.IDENTIFIER, "flow name");
        BlockStmt body = block();
        return new FlowDecl(metaFrom(start), name.text(), body);
    }

    private InterruptDecl interruptDeclaration() {
        Token start = advance();
        consume(TokenType.LBRACE, "{");
        int priority = 0;
        String whenAsset = "";
        while (!check(TokenType.LBRACE) && !check(TokenType.RBRACE) && !isAtEnd()) {
            if (match(TokenType.PRIORITY)) {
                Token value = consume(TokenType.INTEGER, "priority number");
                try {
                    priority = Math.toIntExact(parseInteger(value));
                } catch (ArithmeticException e) {
                    throw new ParseException(Diagnostics.invalidNumber(value.text(), value.span()));
                }
            } else if (match(TokenType.WHEN)) {
                consume(TokenType.IMAGE, "image");
                whenAsset = consume(TokenType.STRING, "asset name").text();
            } else {
                throw new ParseException(Diagnostics.unexpectedToken(peek().text(), peek().span()));
            }
        }
        BlockStmt body = block();
        consume(TokenType.RBRACE, "}");
        return new InterruptDecl(metaFrom(start), priority, whenAsset, body);
    }

    private ConstStmt constStatement() {
        Token start = advance();
        Token name = consume(TokenType.IDENTIFIER, "constant name");
        consume(TokenType.EQUAL, "=");
        Expression value = expression();
        endStatement();
        return new ConstStmt(metaFrom(start), name.text(), value);
    }

    // ---------------------------------------------------------------------------------------------
    // Statements

    @Override
    public BlockStmt block() {
        if (!check(TokenType.LBRACE)) {
            throw new ParseException(Diagnostics.expectedBlock(describe(peek()), peek().span()));
        }
        Token start = advance();
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            if (DECLARATION_STARTS.contains(peek().type())) {
                // A declaration keyword inside a block means the closing brace is missing.
                break;
            }
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            try {
                statements.add(statement());
            } catch (ParseException e) {
                recordAndSynchronize(e);
            }
        }
        if (!match(TokenType.RBRACE)) {
            diagnostics.report(Diagnostics.expectedToken("}", describe(peek()), peek().span()));
        }
        return new BlockStmt(metaFrom(start), statements);
    }

    private Statement statement() {
        Optional<IParserStatementHandler> handler = statementRegistry.get(peek().type());
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }
        return switch (peek().type()) {
            case LBRACE -> block();
            case CONST -> constStatement();
            case LABEL -> labelStatement();
            case GOTO -> gotoStatement();
            case IF -> ifStatement();
            case WHILE -> whileStatement();
            case FOR -> forStatement();
            case LET -> letStatement();
            case TRY -> tryStatement();
            case BREAK -> {
                Token start = advance();
                endStatement();
                yield new BreakStmt(metaFrom(start));
            }
            case CONTINUE -> {
                Token start = advance();
                endStatement();
                yield new ContinueStmt(metaFrom(start));
            }
            case RETURN -> returnStatement();
            default -> expressionStatement();
        };
    }

    private LabelStmt labelStatement() {
        Token start = advance();
        Token name = consume(TokenType.IDENTIFIER, "label name");
        consume(TokenType.COLON, ":");
        return new LabelStmt(metaFrom(start), name.text());
    }

    private GotoStmt gotoStatement() {
        Token start = advance();
        Token name = consume(TokenType.IDENTIFIER, "label name");
        endStatement();
        return new GotoStmt(metaFrom(start), name.text());
    }

    private IfStmt ifStatement() {
        Token start = advance();
        Expression condition = expression();
        BlockStmt thenBlock = block();
        List<IfStmt.ElifBranch> elifs = new ArrayList<>();
        while (match(TokenType.ELIF)) {
            Expression elifCondition = expression();
            elifs.add(new IfStmt.ElifBranch(elifCondition, block()));
        }
        BlockStmt elseBlock = null;
        if (match(TokenType.ELSE)) {
            if (check(TokenType.IF)) {
                // "else if" chains become elif branches
                advance();
                Expression elifCondition = expression();
                elifs.add(new IfStmt.ElifBranch(elifCondition, block()));
                while (match(TokenType.ELIF)) {
                    Expression next = expression();
                    elifs.add(new IfStmt.ElifBranch(next, block()));
                }
                if (match(TokenType.ELSE)) {
                    elseBlock = block();
                }
            } else {
                elseBlock = block();
            }
        }
        return new IfStmt(metaFrom(start), condition, thenBlock, elifs, elseBlock);
    }

    private WhileStmt whileStatement() {
        Token start = advance();
        Expression condition = expression();
        BlockStmt body = block();
        return new WhileStmt(metaFrom(start), condition, body);
    }

    private ForStmt forStatement() {
        Token start = advance();
        Token variable = match(TokenType.VARIABLE) ? previous() : consume(TokenType.IDENTIFIER, "loop variable");
        consume(TokenType.IN, "in");
        Expression iterable = expression();
        BlockStmt body = block();
        return new ForStmt(metaFrom(start), variable.text(), iterable, body);
    }

    private LetStmt letStatement() {
        Token start = advance();
        Token name = match(TokenType.VARIABLE) ? previous() : consume(TokenType.IDENTIFIER, "variable name");
        Expression value = null;
        if (match(TokenType.EQUAL)) {
            value = expression();
        }
        endStatement();
        return new LetStmt(metaFrom(start), name.text(), value);
    }

    private TryStmt tryStatement() {
        Token start = advance();
        BlockStmt tryBlock = block();
        CatchClause catchClause = null;
        if (check(TokenType.CATCH)) {
            Token catchStart = advance();
            String variable = null;
            if (match(TokenType.IDENTIFIER, TokenType.VARIABLE)) {
                variable = previous().text();
            }
            BlockStmt body = block();
            catchClause = new CatchClause(metaFrom(catchStart), variable, body);
        }
        return new TryStmt(metaFrom(start), tryBlock, catchClause, null);
    }

    private ReturnStmt returnStatement() {
        Token start = advance();
        Expression value = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE) && !isAtEnd()) {
            value = expression();
        }
        endStatement();
        return new ReturnStmt(metaFrom(start), value);
    }

    private Statement expressionStatement() {
        Token start = peek();
        Expression expr = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            if (!(expr instanceof Identifier target)) {
                throw new ParseException(Diagnostics.invalidAssignmentTarget(Span.merge(expr.span(), equals.span())));
            }
            Expression value = expression();
            endStatement();
            return new AssignStmt(metaFrom(start), target.name(), value);
        }
        endStatement();
        return new ExprStmt(metaFrom(start), expr);
    }

    /**
     * Terminates a simple statement. A missing semicolon is reported without dropping the
     * statement; it may be omitted before a closing brace or at the end of input.
     */
    private void endStatement() {
        if (match(TokenType.SEMICOLON)) {
            return;
        }
        if (check(TokenType.RBRACE) || isAtEnd()) {
            return;
        }
        Token last = previous();
        diagnostics.report(Diagnostics.missingSemicolon(
                new Span(last.endLine(), last.endColumn(), last.endLine(), last.endColumn() + 1)));
    }

    // ---------------------------------------------------------------------------------------------
    // Expressions

    @Override
    public Expression expression() {
        return or();
    }

    private Expression or() {
        Expression expr = and();
        while (match(TokenType.OR, TokenType.PIPE_PIPE)) {
            Expression right = and();
            expr = binary(expr, "or", right);
        }
        return expr;
    }

    private Expression and() {
        Expression expr = equality();
        while (match(TokenType.AND, TokenType.AMP_AMP)) {
            Expression right = equality();
            expr = binary(expr, "and", right);
        }
        return expr;
    }

    private Expression equality() {
        Expression expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            String operator = previous().text();
            Expression right = comparison();
            expr = binary(expr, operator, right);
        }
        return expr;
    }

    private Expression comparison() {
        Expression expr = term();
        while (match(TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL)) {
            String operator = previous().text();
            Expression right = term();
            expr = binary(expr, operator, right);
        }
        return expr;
    }

    private Expression term() {
        Expression expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            String operator = previous().text();
            Expression right = factor();
            expr = binary(expr, operator, right);
        }
        return expr;
    }

    private Expression factor() {
        Expression expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            String operator = previous().text();
            Expression right = unary();
            expr = binary(expr, operator, right);
        }
        return expr;
    }

    private Expression unary() {
        if (match(TokenType.BANG, TokenType.NOT, TokenType.MINUS)) {
            Token operator = previous();
            Expression operand = unary();
            String op = operator.type() == TokenType.MINUS ? "-" : "!";
            return new UnaryExpr(meta(Span.merge(operator.span(), operand.span())), op, operand);
        }
        return call();
    }

    private Expression call() {
        Expression expr = primary();
        while (check(TokenType.LPAREN)) {
            if (!(expr instanceof Identifier)) {
                throw new ParseException(Diagnostics.expectedFunctionName(expr.span()));
            }
            advance();
            expr = finishCall(expr);
        }
        return expr;
    }

    private Expression finishCall(Expression callee) {
        List<Expression> args = new ArrayList<>();
        Map<String, Expression> kwargs = new LinkedHashMap<>();
        if (!check(TokenType.RPAREN)) {
            do {
                if (check(TokenType.RPAREN)) {
                    break;
                }
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) {
                    String name = advance().text();
                    advance();
                    kwargs.put(name, expression());
                } else {
                    args.add(expression());
                }
            } while (match(TokenType.COMMA));
        }
        Token close = consume(TokenType.RPAREN, ")");
        Span span = Span.merge(callee.span(), close.span());
        return new CallExpr(meta(span), callee, args, kwargs);
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case NULL -> {
                advance();
                return new Literal(metaFrom(token), Literal.Kind.NULL, null, "null");
            }
            case TRUE, FALSE -> {
                advance();
                return new Literal(metaFrom(token), Literal.Kind.BOOLEAN, token.type() == TokenType.TRUE, token.text());
            }
            case INTEGER -> {
                advance();
                return new Literal(metaFrom(token), Literal.Kind.INTEGER, parseInteger(token), token.text());
            }
            case FLOAT -> {
                advance();
                return new Literal(metaFrom(token), Literal.Kind.FLOAT, Double.parseDouble(token.text()), token.text());
            }
            case DURATION -> {
                advance();
                return new Literal(metaFrom(token), Literal.Kind.DURATION, token.text(), token.text());
            }
            case STRING -> {
                advance();
                return new Literal(metaFrom(token), Literal.Kind.STRING, token.text(), token.text());
            }
            case IDENTIFIER, VARIABLE -> {
                advance();
                return new Identifier(metaFrom(token), token.text());
            }
            case LBRACKET -> {
                advance();
                List<Expression> elements = new ArrayList<>();
                if (!check(TokenType.RBRACKET)) {
                    do {
                        if (check(TokenType.RBRACKET)) {
                            break;
                        }
                        elements.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RBRACKET, "]");
                return new ArrayExpr(metaFrom(token), elements);
            }
            case LPAREN -> {
                advance();
                Expression inner = expression();
                consume(TokenType.RPAREN, ")");
                return inner;
            }
            default -> throw new ParseException(Diagnostics.expectedExpression(describe(token), token.span()));
        }
    }

    private Expression binary(Expression left, String operator, Expression right) {
        return new BinaryExpr(meta(Span.merge(left.span(), right.span())), left, operator, right);
    }

    private long parseInteger(Token token) {
        try {
            return Long.parseLong(token.text());
        } catch (NumberFormatException e) {
            throw new ParseException(Diagnostics.invalidNumber(token.text(), token.span()));
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Recovery

    private void recordAndSynchronize(ParseException e) {
        Diagnostic diagnostic = e.getDiagnostic();
        log.debug("Recovering from parse error: {}", diagnostic);
        diagnostics.report(diagnostic);
        synchronize();
    }

    /**
     * Discards tokens until a statement boundary: just past a semicolon, or before a token
     * that starts a statement or declaration or closes a block. Always consumes at least
     * one token unless the input is exhausted.
     */
    private void synchronize() {
        if (!isAtEnd()) {
            advance();
        }
        while (!isAtEnd()) {
            if (previous().type() == TokenType.SEMICOLON) {
                return;
            }
            if (STATEMENT_STARTS.contains(peek().type())) {
                return;
            }
            advance();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // ParsingContext

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    @Override
    public Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParseException(Diagnostics.expectedToken(expected, describe(peek()), peek().span()));
    }

    @Override
    public NodeMeta metaFrom(Token start) {
        Token end = previous();
        Span span = current == 0 ? Span.of(start) : Span.merge(Span.of(start), Span.of(end));
        return new NodeMeta(span, nextId());
    }

    @Override
    public NodeMeta meta(Span span) {
        return new NodeMeta(span, nextId());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token previousOrStart() {
        return current == 0 ? peek() : previous();
    }

    private String nextId() {
        return "n" + (++nodeCounter);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : token.text();
    }
}

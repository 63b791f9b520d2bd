package org.retroscript.compiler.frontend.lexer;

import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Converts RetroScript source text into tokens. Whitespace is insignificant, comments are
 * routed to a side channel and lexical errors never stop the scan.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            entry("flow", TokenType.FLOW),
            entry("interrupt", TokenType.INTERRUPT),
            entry("priority", TokenType.PRIORITY),
            entry("when", TokenType.WHEN),
            entry("image", TokenType.IMAGE),
            entry("const", TokenType.CONST),
            entry("let", TokenType.LET),
            entry("if", TokenType.IF),
            entry("elif", TokenType.ELIF),
            entry("else", TokenType.ELSE),
            entry("while", TokenType.WHILE),
            entry("for", TokenType.FOR),
            entry("in", TokenType.IN),
            entry("label", TokenType.LABEL),
            entry("goto", TokenType.GOTO),
            entry("try", TokenType.TRY),
            entry("catch", TokenType.CATCH),
            entry("break", TokenType.BREAK),
            entry("continue", TokenType.CONTINUE),
            entry("return", TokenType.RETURN),
            entry("hotkeys", TokenType.HOTKEYS),
            entry("true", TokenType.TRUE),
            entry("false", TokenType.FALSE),
            entry("null", TokenType.NULL),
            entry("repeat", TokenType.REPEAT),
            entry("retry", TokenType.RETRY),
            entry("match", TokenType.MATCH),
            entry("times", TokenType.TIMES),
            entry("end", TokenType.END),
            entry("and", TokenType.AND),
            entry("or", TokenType.OR),
            entry("not", TokenType.NOT));

    private static final Set<String> DURATION_UNITS = Set.of("ms", "s", "m", "h");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Token> comments = new ArrayList<>();
    private final List<LexerError> errors = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine;
    private int startColumn;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * @return the keyword token type for {@code word}, matched case-insensitively.
     */
    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
    }

    public static Set<String> keywords() {
        return KEYWORDS.keySet();
    }

    /**
     * @return true if {@code word} lexes as a single {@link TokenType#IDENTIFIER} token.
     */
    public static boolean isIdentifier(String word) {
        if (word == null || word.isEmpty() || !isIdentifierStart(word.charAt(0))) {
            return false;
        }
        for (int i = 1; i < word.length(); i++) {
            if (!isIdentifierPart(word.charAt(i))) {
                return false;
            }
        }
        return keyword(word).isEmpty();
    }

    /**
     * Scans the whole source. Calling it again rescans from the beginning.
     */
    public LexResult tokenize() {
        tokens.clear();
        comments.clear();
        errors.clear();
        current = 0;
        line = 1;
        column = 1;

        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line, column, line, column));
        return new LexResult(tokens, comments, errors);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> { }
            case '(' -> addToken(TokenType.LPAREN);
            case ')' -> addToken(TokenType.RPAREN);
            case '{' -> addToken(TokenType.LBRACE);
            case '}' -> addToken(TokenType.RBRACE);
            case '[' -> addToken(TokenType.LBRACKET);
            case ']' -> addToken(TokenType.RBRACKET);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ':' -> addToken(TokenType.COLON);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case '+' -> addToken(TokenType.PLUS);
            case '*' -> addToken(TokenType.STAR);
            case '%' -> addToken(TokenType.PERCENT);
            case '-' -> addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '!' -> addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (match('&')) addToken(TokenType.AMP_AMP);
                else unexpected();
            }
            case '|' -> {
                if (match('|')) addToken(TokenType.PIPE_PIPE);
                else unexpected();
            }
            case '/' -> {
                if (match('/')) lineComment();
                else if (match('*')) blockComment();
                else addToken(TokenType.SLASH);
            }
            case '"', '\'' -> string(c);
            case '$' -> {
                if (isIdentifierStart(peek())) variable();
                else unexpected();
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    unexpected();
                }
            }
        }
    }

    private void lineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
        comments.add(makeToken(TokenType.LINE_COMMENT, source.substring(start, current)));
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                comments.add(makeToken(TokenType.BLOCK_COMMENT, source.substring(start, current)));
                return;
            }
            advance();
        }
        error(LexerError.Kind.UNTERMINATED_COMMENT, "Unterminated block comment", "/*");
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            char c = advance();
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                char escaped = advance();
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
            } else {
                value.append(c);
            }
        }
        if (isAtEnd() || peek() == '\n') {
            error(LexerError.Kind.UNTERMINATED_STRING, "Unterminated string", String.valueOf(quote));
            return;
        }
        advance();
        tokens.add(makeToken(TokenType.STRING, value.toString()));
    }

    private void number() {
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            addToken(TokenType.FLOAT);
            return;
        }

        int mark = current;
        int markColumn = column;
        while (isAlpha(peek())) advance();
        String suffix = source.substring(mark, current).toLowerCase(Locale.ROOT);
        if (!suffix.isEmpty() && DURATION_UNITS.contains(suffix)) {
            addToken(TokenType.DURATION);
            return;
        }
        current = mark;
        column = markColumn;
        addToken(TokenType.INTEGER);
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        Optional<TokenType> keyword = keyword(text);
        if (keyword.isPresent()) {
            tokens.add(makeToken(keyword.get(), text.toLowerCase(Locale.ROOT)));
        } else {
            addToken(TokenType.IDENTIFIER);
        }
    }

    private void variable() {
        while (isIdentifierPart(peek())) advance();
        addToken(TokenType.VARIABLE);
    }

    private void unexpected() {
        String text = source.substring(start, current);
        error(LexerError.Kind.UNEXPECTED_CHARACTER, "Unexpected character '" + text + "'", text);
    }

    private void error(LexerError.Kind kind, String message, String text) {
        errors.add(new LexerError(kind, message, text, startLine, startColumn));
        tokens.add(makeToken(TokenType.ERROR, source.substring(start, current)));
    }

    private void addToken(TokenType type) {
        tokens.add(makeToken(type, source.substring(start, current)));
    }

    private Token makeToken(TokenType type, String text) {
        return new Token(type, text, startLine, startColumn, line, column);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierStart(char c) {
        return isAlpha(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

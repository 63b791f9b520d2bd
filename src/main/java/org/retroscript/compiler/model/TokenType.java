package org.retroscript.compiler.model;

/**
 * Defines all token kinds produced by the RetroScript lexer.
 */
public enum TokenType {
    // Keywords
    FLOW, INTERRUPT, PRIORITY, WHEN, IMAGE, CONST, LET, IF, ELIF, ELSE, WHILE, FOR, IN,
    LABEL, GOTO, TRY, CATCH, BREAK, CONTINUE, RETURN, HOTKEYS, TRUE, FALSE, NULL,
    REPEAT, RETRY, MATCH, TIMES, END, AND, OR, NOT,

    // Literals and names
    IDENTIFIER, VARIABLE, INTEGER, FLOAT, STRING, DURATION,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    EQUAL_EQUAL, BANG_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL,
    AMP_AMP, PIPE_PIPE, BANG, EQUAL, ARROW,

    // Delimiters
    LPAREN, RPAREN, LBRACE, RBRACE, LBRACKET, RBRACKET, SEMICOLON, COLON, COMMA, DOT,

    // Side channel
    LINE_COMMENT, BLOCK_COMMENT,

    ERROR, EOF;

    /**
     * @return true for the comment token kinds that never reach the parser.
     */
    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}

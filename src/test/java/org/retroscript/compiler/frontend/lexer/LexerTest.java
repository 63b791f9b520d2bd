package org.retroscript.compiler.frontend.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.retroscript.compiler.model.Token;
import org.retroscript.compiler.model.TokenType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Lexer}.
 */
@Tag("unit")
class LexerTest {

    private static List<TokenType> types(LexResult result) {
        return result.tokens().stream().map(Token::type).toList();
    }

    @Test
    @DisplayName("Duration suffixes produce DURATION, unknown suffixes backtrack to INTEGER")
    void durationsAndBacktracking() {
        LexResult result = new Lexer("wait 500ms 10x").tokenize();

        assertThat(types(result)).containsExactly(
                TokenType.IDENTIFIER, TokenType.DURATION, TokenType.INTEGER, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(result.tokens().get(1).text()).isEqualTo("500ms");
        assertThat(result.tokens().get(2).text()).isEqualTo("10");
        assertThat(result.tokens().get(3).text()).isEqualTo("x");
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void durationUnitsAreCaseInsensitive() {
        LexResult result = new Lexer("2S 3m 1h 5min").tokenize();

        assertThat(types(result)).containsExactly(
                TokenType.DURATION, TokenType.DURATION, TokenType.DURATION,
                TokenType.INTEGER, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void fractionalNumbersAreFloatsWithoutDurationCheck() {
        LexResult result = new Lexer("1.5s").tokenize();

        assertThat(types(result)).containsExactly(TokenType.FLOAT, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(result.tokens().get(0).text()).isEqualTo("1.5");
    }

    @Test
    void keywordsAreCaseInsensitiveAndLowercased() {
        LexResult result = new Lexer("FLOW Main If").tokenize();

        assertThat(types(result)).containsExactly(TokenType.FLOW, TokenType.IDENTIFIER, TokenType.IF, TokenType.EOF);
        assertThat(result.tokens().get(0).text()).isEqualTo("flow");
        assertThat(result.tokens().get(1).text()).isEqualTo("Main");
        assertThat(result.tokens().get(2).text()).isEqualTo("if");
    }

    @Test
    void dollarNamesAreVariables() {
        LexResult result = new Lexer("$count = 1").tokenize();

        assertThat(result.tokens().get(0).type()).isEqualTo(TokenType.VARIABLE);
        assertThat(result.tokens().get(0).text()).isEqualTo("$count");
    }

    @Test
    void stringsDecodeEscapesInBothQuoteStyles() {
        LexResult result = new Lexer("\"a\\\"b\\n\" 'it\\'s'").tokenize();

        assertThat(types(result)).containsExactly(TokenType.STRING, TokenType.STRING, TokenType.EOF);
        assertThat(result.tokens().get(0).text()).isEqualTo("a\"b\n");
        assertThat(result.tokens().get(1).text()).isEqualTo("it's");
    }

    @Test
    void operatorsAndDelimiters() {
        LexResult result = new Lexer("a == b != c <= d >= e && f || !g -> [1, 2];").tokenize();

        assertThat(types(result)).contains(
                TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.AMP_AMP, TokenType.PIPE_PIPE, TokenType.BANG, TokenType.ARROW,
                TokenType.LBRACKET, TokenType.COMMA, TokenType.RBRACKET, TokenType.SEMICOLON);
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("Comments go to the side channel with their full text")
    void commentsAreCollectedSeparately() {
        LexResult result = new Lexer("// heading\nclick(1, 2) /* inline */").tokenize();

        assertThat(result.comments()).extracting(Token::text).containsExactly("// heading", "/* inline */");
        assertThat(result.comments()).extracting(Token::type)
                .containsExactly(TokenType.LINE_COMMENT, TokenType.BLOCK_COMMENT);
        assertThat(types(result)).doesNotContain(TokenType.LINE_COMMENT, TokenType.BLOCK_COMMENT);
        assertThat(result.tokens().get(0).line()).isEqualTo(2);
    }

    @Test
    void unterminatedStringIsRecordedAndScanningContinues() {
        LexResult result = new Lexer("type_text(\"abc\nclick(1, 2)").tokenize();

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).kind()).isEqualTo(LexerError.Kind.UNTERMINATED_STRING);
        assertThat(result.errors().get(0).line()).isEqualTo(1);
        assertThat(types(result)).contains(TokenType.ERROR);
        assertThat(result.tokens()).extracting(Token::text).contains("click");
    }

    @Test
    void unterminatedBlockComment() {
        LexResult result = new Lexer("click(1, 2) /* never closed").tokenize();

        assertThat(result.errors()).extracting(LexerError::kind).containsExactly(LexerError.Kind.UNTERMINATED_COMMENT);
    }

    @Test
    void unexpectedCharactersDoNotStopTheLexer() {
        LexResult result = new Lexer("a @ b & c").tokenize();

        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors()).extracting(LexerError::kind)
                .containsOnly(LexerError.Kind.UNEXPECTED_CHARACTER);
        assertThat(result.tokens()).filteredOn(t -> t.type() == TokenType.IDENTIFIER)
                .extracting(Token::text).containsExactly("a", "b", "c");
    }

    @Test
    void tokensCarryOneBasedPositions() {
        LexResult result = new Lexer("flow main {\n  click(1, 2);\n}").tokenize();

        Token click = result.tokens().get(3);
        assertThat(click.text()).isEqualTo("click");
        assertThat(click.line()).isEqualTo(2);
        assertThat(click.column()).isEqualTo(3);
        assertThat(click.endColumn()).isEqualTo(8);
    }

    @Test
    void isIdentifierRejectsKeywordsAndOtherTokens() {
        assertThat(Lexer.isIdentifier("login_2")).isTrue();
        assertThat(Lexer.isIdentifier("_tmp")).isTrue();
        assertThat(Lexer.isIdentifier("While")).isFalse();
        assertThat(Lexer.isIdentifier("2fast")).isFalse();
        assertThat(Lexer.isIdentifier("my flow")).isFalse();
        assertThat(Lexer.isIdentifier("$x")).isFalse();
        assertThat(Lexer.isIdentifier("")).isFalse();
    }
}

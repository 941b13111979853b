package org.zeno.compiler.frontend.lexer;

import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the lexer's token recognition, comment skipping and position tracking.
 */
public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source, "test.zeno").scanTokens().stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void tokenizesSimpleLetDeclaration() {
        List<Token> tokens = new Lexer("let x = 5 + 3", "test.zeno").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LET, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INT,
                TokenType.PLUS, TokenType.INT, TokenType.EOF);
        assertThat(tokens).extracting(Token::text).containsExactly("let", "x", "=", "5", "+", "3", "");
    }

    @Test
    @Tag("unit")
    void recognizesMultiCharacterOperators() {
        assertThat(types("== != <= >= && || ...")).containsExactly(
                TokenType.EQ, TokenType.NOT_EQ, TokenType.LT_EQ, TokenType.GT_EQ,
                TokenType.AND, TokenType.OR, TokenType.ELLIPSIS, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void singleCharacterPrefixesFallBack() {
        assertThat(types("= ! < >")).containsExactly(
                TokenType.ASSIGN, TokenType.BANG, TokenType.LT, TokenType.GT, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void loneAmpersandPipeAndDotsAreIllegal() {
        assertThat(types("&")).containsExactly(TokenType.ILLEGAL, TokenType.EOF);
        assertThat(types("|")).containsExactly(TokenType.ILLEGAL, TokenType.EOF);
        assertThat(types(".")).containsExactly(TokenType.ILLEGAL, TokenType.EOF);
        assertThat(types("..")).containsExactly(TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.EOF);
        assertThat(types("@")).containsExactly(TokenType.ILLEGAL, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void recognizesKeywordsBeforeIdentifiers() {
        assertThat(types("let mut pub import from as if else while fn return true false letter")).containsExactly(
                TokenType.LET, TokenType.MUT, TokenType.PUB, TokenType.IMPORT, TokenType.FROM, TokenType.AS,
                TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.FN, TokenType.RETURN,
                TokenType.TRUE, TokenType.FALSE, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void distinguishesIntegersAndFloats() {
        List<Token> tokens = new Lexer("42 3.14 _under_9", "test.zeno").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.INT, TokenType.FLOAT, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(tokens.get(1).text()).isEqualTo("3.14");
    }

    @Test
    @Tag("unit")
    void trailingDotIsNotPartOfNumber() {
        List<Token> tokens = new Lexer("1.", "test.zeno").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.INT, TokenType.ILLEGAL, TokenType.EOF);
        assertThat(tokens.get(0).text()).isEqualTo("1");
        assertThat(tokens.get(1).text()).isEqualTo(".");
    }

    @Test
    @Tag("unit")
    void stringKeepsRawEscapes() {
        List<Token> tokens = new Lexer("\"a\\\"b\"", "test.zeno").scanTokens();

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("\"a\\\"b\"");
    }

    @Test
    @Tag("unit")
    void unterminatedStringIsIllegal() {
        assertThat(types("\"abc")).containsExactly(TokenType.ILLEGAL, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void skipsConsecutiveComments() {
        List<Token> tokens = new Lexer("// line\n/* block */ /* another */ x", "test.zeno").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(tokens.get(0).text()).isEqualTo("x");
    }

    @Test
    @Tag("unit")
    void unterminatedBlockCommentRunsToEndOfInput() {
        assertThat(types("let /* never closed\nx = 1")).containsExactly(TokenType.LET, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void keepsReturningEofAtEnd() {
        Lexer lexer = new Lexer("x", "test.zeno");

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.EOF);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.EOF);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void tracksLinesAndColumns() {
        List<Token> tokens = new Lexer("let x = 1\n  y", "main.zeno").scanTokens();

        Token y = tokens.get(4);
        assertThat(y.text()).isEqualTo("y");
        assertThat(y.line()).isEqualTo(2);
        assertThat(y.column()).isEqualTo(3);
        assertThat(y.fileName()).isEqualTo("main.zeno");
        assertThat(tokens.get(1).column()).isEqualTo(5);
    }
}

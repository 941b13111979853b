package org.zeno.compiler.frontend.lexer;

import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Zeno source text into tokens, one at a time.
 *
 * <p>The lexer never fails: unrecognized characters, lone {@code &}/{@code |}, bare dots and
 * unterminated strings are returned as {@link TokenType#ILLEGAL} tokens and left for the parser
 * to report. An unterminated block comment is consumed to the end of input without a token.
 * Once the input is exhausted every call to {@link #nextToken()} returns an EOF token.
 */
public class Lexer {

    private final String source;
    private final String fileName;

    private int position = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Scans the next token.
     * @return The next token, or EOF at the end of input.
     */
    public Token nextToken() {
        skipWhitespaceAndComments();

        int startLine = line;
        int startColumn = column;
        int start = position;

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", fileName, startLine, startColumn);
        }

        char c = advance();
        TokenType type = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case ':' -> TokenType.COLON;
            case ';' -> TokenType.SEMICOLON;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.ASTERISK;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '=' -> match('=') ? TokenType.EQ : TokenType.ASSIGN;
            case '!' -> match('=') ? TokenType.NOT_EQ : TokenType.BANG;
            case '<' -> match('=') ? TokenType.LT_EQ : TokenType.LT;
            case '>' -> match('=') ? TokenType.GT_EQ : TokenType.GT;
            case '&' -> match('&') ? TokenType.AND : TokenType.ILLEGAL;
            case '|' -> match('|') ? TokenType.OR : TokenType.ILLEGAL;
            case '.' -> ellipsis();
            case '"' -> string();
            default -> {
                if (isIdentifierStart(c)) {
                    yield identifier(start);
                } else if (isDigit(c)) {
                    yield number();
                } else {
                    yield TokenType.ILLEGAL;
                }
            }
        };
        return new Token(type, source.substring(start, position), fileName, startLine, startColumn);
    }

    /**
     * Scans the whole input, including the terminating EOF token.
     * @return All tokens in source order.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private TokenType ellipsis() {
        // The current '.' is consumed; a valid ellipsis needs two more dots.
        if (peek() == '.' && peekNext() == '.') {
            advance();
            advance();
            return TokenType.ELLIPSIS;
        }
        return TokenType.ILLEGAL;
    }

    private TokenType string() {
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
            }
            advance();
        }
        if (isAtEnd()) {
            return TokenType.ILLEGAL;
        }
        advance(); // closing quote
        return TokenType.STRING;
    }

    private TokenType identifier(int start) {
        while (isIdentifierPart(peek())) advance();
        return TokenType.lookupIdentifier(source.substring(start, position));
    }

    private TokenType number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            return TokenType.FLOAT;
        }
        return TokenType.INT;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(position) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(position);
    }

    private char peekNext() {
        return position + 1 >= source.length() ? '\0' : source.charAt(position + 1);
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

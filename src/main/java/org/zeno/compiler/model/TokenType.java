package org.zeno.compiler.model;

import java.util.Map;

/**
 * Defines the types of tokens the lexer can produce.
 */
public enum TokenType {
    // Special
    EOF("EOF"),
    ILLEGAL("ILLEGAL"),

    // Identifiers and literals
    IDENTIFIER("IDENT"),
    INT("INT"),
    FLOAT("FLOAT"),
    STRING("STRING"),

    // Keywords
    LET("let"),
    MUT("mut"),
    PUB("pub"),
    IMPORT("import"),
    FROM("from"),
    AS("as"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    FN("fn"),
    RETURN("return"),
    TRUE("true"),
    FALSE("false"),

    // Operators
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    ASTERISK("*"),
    SLASH("/"),
    PERCENT("%"),
    BANG("!"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_EQ("<="),
    GT(">"),
    GT_EQ(">="),
    AND("&&"),
    OR("||"),
    ELLIPSIS("..."),

    // Punctuation
    COMMA(","),
    COLON(":"),
    SEMICOLON(";"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]");

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("let", LET),
            Map.entry("mut", MUT),
            Map.entry("pub", PUB),
            Map.entry("import", IMPORT),
            Map.entry("from", FROM),
            Map.entry("as", AS),
            Map.entry("if", IF),
            Map.entry("else", ELSE),
            Map.entry("while", WHILE),
            Map.entry("fn", FN),
            Map.entry("return", RETURN),
            Map.entry("true", TRUE),
            Map.entry("false", FALSE));

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /**
     * Returns the spelling used in diagnostics, e.g. {@code "=="} or {@code "IDENT"}.
     * @return The display text.
     */
    public String display() {
        return display;
    }

    /**
     * Looks up an identifier in the keyword set.
     * @param identifier The scanned identifier text.
     * @return The keyword type, or {@link #IDENTIFIER} if the text is not a keyword.
     */
    public static TokenType lookupIdentifier(String identifier) {
        return KEYWORDS.getOrDefault(identifier, IDENTIFIER);
    }
}

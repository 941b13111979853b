package org.zeno.compiler.model;

/**
 * A single lexical token.
 *
 * @param type     The kind of token.
 * @param text     The literal text as it appears in the source (raw, escapes unprocessed).
 * @param fileName The logical name of the source file.
 * @param line     1-based line of the first character.
 * @param column   1-based column of the first character.
 */
public record Token(TokenType type, String text, String fileName, int line, int column) {

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}

package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

/**
 * A string literal.
 *
 * @param token The raw string token.
 * @param value The value with escapes processed.
 */
public record StringLiteral(Token token, String value) implements Expression {
}

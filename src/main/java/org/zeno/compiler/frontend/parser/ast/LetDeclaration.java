package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * AST node for {@code let x = e}, {@code mut x = e} and {@code let mut x = e}.
 *
 * @param token   The introducing keyword.
 * @param name    The declared name.
 * @param type    The declared type, or null if omitted.
 * @param value   The initializer.
 * @param mutable Whether the binding may be re-assigned.
 */
public record LetDeclaration(Token token, Token name, Token type, Expression value, boolean mutable)
        implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}

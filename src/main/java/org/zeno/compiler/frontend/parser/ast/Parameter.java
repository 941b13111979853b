package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

/**
 * A function parameter.
 *
 * @param name     The parameter name.
 * @param type     The declared type, or null if omitted.
 * @param variadic Whether the parameter was written with a leading {@code ...}.
 */
public record Parameter(Token name, Token type, boolean variadic) implements AstNode, SourceLocatable {

    @Override
    public Token token() {
        return name;
    }
}

package org.zeno.compiler.frontend.parser.features.let;

import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

/**
 * Parses variable declarations: {@code let x = e} (immutable), {@code mut x = e} and
 * {@code let mut x = e} (mutable). A type annotation {@code : type} may follow the name.
 */
public class LetDeclarationParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance();
        boolean mutable = keyword.type() == TokenType.MUT;
        if (keyword.type() == TokenType.LET && context.match(TokenType.MUT)) {
            mutable = true;
        }

        Token name = context.consume(TokenType.IDENTIFIER);
        if (name == null) return null;

        Token type = null;
        if (context.match(TokenType.COLON)) {
            type = context.consume(TokenType.IDENTIFIER);
            if (type == null) return null;
        }

        if (context.consume(TokenType.ASSIGN) == null) return null;

        Expression value = context.expression(Precedence.LOWEST);
        if (value == null) return null;

        return new LetDeclaration(keyword, name, type, value, mutable);
    }
}

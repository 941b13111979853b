package org.zeno.compiler.frontend.parser.features.ret;

import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.frontend.parser.ast.ReturnStatement;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

/**
 * Parses {@code return [expression]}. The value is omitted when the statement ends
 * at the keyword (terminator, closing brace, end of input or a line break).
 */
public class ReturnStatementParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance();
        if (context.check(TokenType.SEMICOLON) || context.check(TokenType.RBRACE)
                || context.isAtEnd() || context.peek().line() > keyword.line()) {
            return new ReturnStatement(keyword, null);
        }
        Expression value = context.expression(Precedence.LOWEST);
        return value == null ? null : new ReturnStatement(keyword, value);
    }
}

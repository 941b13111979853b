package org.zeno.compiler.frontend.parser.features.control;

import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.IfStatement;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

/**
 * Parses {@code if cond { } [else if cond { }]* [else { }]}. An {@code else if} chain is
 * represented as nested {@link IfStatement}s in the alternative position.
 */
public class IfStatementParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance();

        Expression condition = context.expression(Precedence.LOWEST);
        if (condition == null) return null;

        Block consequence = context.block();
        if (consequence == null) return null;

        Statement alternative = null;
        if (context.match(TokenType.ELSE)) {
            alternative = context.check(TokenType.IF) ? parse(context) : context.block();
            if (alternative == null) return null;
        }
        return new IfStatement(keyword, condition, consequence, alternative);
    }
}

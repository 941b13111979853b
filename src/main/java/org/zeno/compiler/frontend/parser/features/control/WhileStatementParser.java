package org.zeno.compiler.frontend.parser.features.control;

import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.frontend.parser.ast.WhileStatement;
import org.zeno.compiler.model.Token;

public class WhileStatementParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance();

        Expression condition = context.expression(Precedence.LOWEST);
        if (condition == null) return null;

        Block body = context.block();
        if (body == null) return null;

        return new WhileStatement(keyword, condition, body);
    }
}

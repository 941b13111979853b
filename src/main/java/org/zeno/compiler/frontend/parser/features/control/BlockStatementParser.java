package org.zeno.compiler.frontend.parser.features.control;

import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.Statement;

/**
 * Parses a bare nested block used as a statement.
 */
public class BlockStatementParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        return context.block();
    }
}

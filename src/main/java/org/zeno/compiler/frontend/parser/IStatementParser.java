package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.frontend.parser.ast.Statement;

/**
 * Handler interface for statements introduced by a keyword.
 */
public interface IStatementParser {

    /**
     * Parses the statement starting at the current token, which is the introducing keyword.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The parsed statement, or {@code null} if an error was reported.
     */
    Statement parse(ParsingContext context);
}

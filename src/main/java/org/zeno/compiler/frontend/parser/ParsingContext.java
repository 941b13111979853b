package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

/**
 * Provides statement parsers with access to the token stream and to the shared
 * expression and block grammar. This interface decouples handlers from the concrete {@link Parser}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports an "expected next token" error.
     * @param type The expected token type.
     * @return The consumed token, or null if the type did not match.
     */
    Token consume(TokenType type);

    /**
     * Parses an expression whose operators bind tighter than the given precedence.
     * @param precedence The binding power of the surrounding context.
     * @return The expression, or null if an error was reported.
     */
    Expression expression(Precedence precedence);

    /**
     * Parses a brace-delimited block.
     * @return The block, or null if an error was reported.
     */
    Block block();

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}

package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.model.Token;

/**
 * Capability interface for AST nodes that know where they start in the source.
 */
public interface SourceLocatable {

    /**
     * Returns the token at which this node begins.
     * @return The starting token.
     */
    Token token();

    default String getSourceFileName() {
        return token().fileName();
    }

    default int getLine() {
        return token().line();
    }

    default int getColumn() {
        return token().column();
    }
}

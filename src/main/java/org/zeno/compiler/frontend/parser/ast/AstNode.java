package org.zeno.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The base type of every node in the abstract syntax tree. The set of node variants is closed;
 * consumers dispatch over it with {@code instanceof} patterns.
 */
public sealed interface AstNode permits Program, Statement, Expression, Parameter {

    /**
     * Returns the direct children of this node in source order.
     * @return The child nodes, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}

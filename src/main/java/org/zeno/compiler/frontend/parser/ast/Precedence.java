package org.zeno.compiler.frontend.parser.ast;

/**
 * Binding power levels, lowest first.
 */
public enum Precedence {
    LOWEST,
    OR,
    AND,
    EQUALS,
    COMPARISON,
    SUM,
    PRODUCT,
    PREFIX,
    CALL
}

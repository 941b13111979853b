package org.zeno.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface Expression extends AstNode, SourceLocatable
        permits Identifier, IntegerLiteral, FloatLiteral, StringLiteral, BooleanLiteral,
                BinaryExpression, UnaryExpression, FunctionCall {
}

package org.zeno.compiler.frontend.parser.ast;

/**
 * A node that may appear in a block or at the top level of a program.
 */
public sealed interface Statement extends AstNode, SourceLocatable
        permits ImportStatement, FunctionDefinition, LetDeclaration, AssignmentStatement,
                ReturnStatement, ExpressionStatement, IfStatement, WhileStatement, Block {
}

package org.zeno.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the AST: the top-level statements of one source file.
 *
 * @param fileName   The logical name of the parsed file.
 * @param statements Imports, function definitions and top-level statements in source order.
 */
public record Program(String fileName, List<Statement> statements) implements AstNode {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }

    /**
     * Returns the function definitions of this program in source order.
     * @return The top-level functions.
     */
    public List<FunctionDefinition> functions() {
        return statements.stream()
                .filter(FunctionDefinition.class::isInstance)
                .map(FunctionDefinition.class::cast)
                .toList();
    }

    /**
     * Returns the import statements of this program in source order.
     * @return The imports.
     */
    public List<ImportStatement> imports() {
        return statements.stream()
                .filter(ImportStatement.class::isInstance)
                .map(ImportStatement.class::cast)
                .toList();
    }
}

package org.zeno.compiler.frontend.semantics.rules;

import org.zeno.compiler.frontend.parser.ast.AstNode;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.semantics.AnalysisState;
import org.zeno.compiler.frontend.semantics.Issue;

import java.util.List;

public class VariableNamingRule implements ILintRule {

    public static final String NAME = "variable-naming-convention";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Checks that variables are lowerCamelCase.";
    }

    @Override
    public List<Issue> inspect(AstNode node, AnalysisState state) {
        if (!(node instanceof LetDeclaration let)) return List.of();
        String name = let.name().text();
        if ("_".equals(name) || NamingConventions.isLowerCamelCase(name)) return List.of();
        return List.of(Issue.at(let.name(), NAME, String.format(
                "Variable '%s' should be in lowerCamelCase (e.g., myVariable).", name)));
    }
}

package org.zeno.compiler.frontend.semantics.rules;

import org.zeno.compiler.frontend.semantics.AnalysisState;
import org.zeno.compiler.frontend.semantics.Issue;
import org.zeno.compiler.frontend.semantics.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports {@code let}/{@code mut} bindings that are never referenced.
 *
 * <p>Known limitation: assigning to a variable counts as a use, so a variable that is only
 * ever written is not reported. Parameters and {@code _} are never reported.
 */
public class UnusedVariableRule implements ILintRule {

    public static final String NAME = "unused-variable";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Checks for variables that are declared but not used.";
    }

    @Override
    public List<Issue> afterTraversal(AnalysisState state) {
        List<Issue> issues = new ArrayList<>();
        for (Symbol variable : state.declaredVariables().keySet()) {
            if (!state.isUsed(variable)) {
                issues.add(Issue.at(variable.name(), NAME,
                        String.format("Variable '%s' is declared but not used.", variable.text())));
            }
        }
        return issues;
    }
}

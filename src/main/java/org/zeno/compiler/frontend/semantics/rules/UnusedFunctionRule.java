package org.zeno.compiler.frontend.semantics.rules;

import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.semantics.AnalysisState;
import org.zeno.compiler.frontend.semantics.Issue;

import java.util.List;

/**
 * Reports private functions that are never called. {@code main} and {@code pub} functions
 * are not tracked and therefore never reported.
 */
public class UnusedFunctionRule implements ILintRule {

    public static final String NAME = "unused-function";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Checks for private functions that are defined but never called.";
    }

    @Override
    public List<Issue> afterTraversal(AnalysisState state) {
        return state.declaredFunctions().values().stream()
                .filter(fn -> !state.isCalled(fn.name().text()))
                .map(this::issue)
                .toList();
    }

    private Issue issue(FunctionDefinition fn) {
        return Issue.at(fn.name(), NAME, String.format("Function '%s' is defined but not used.", fn.name().text()));
    }
}

package org.zeno.compiler.frontend.semantics.rules;

import org.zeno.compiler.frontend.parser.ast.AstNode;
import org.zeno.compiler.frontend.semantics.AnalysisState;
import org.zeno.compiler.frontend.semantics.Issue;

import java.util.List;

/**
 * Interface for pluggable analysis rules. A rule either inspects nodes as the analyzer walks
 * the tree, or inspects the completed {@link AnalysisState} once the walk has finished, or both.
 */
public interface ILintRule {

    /**
     * The rule identifier printed in issues, e.g. {@code unused-variable}.
     */
    String name();

    /**
     * A one-line description of what the rule checks.
     */
    String description();

    /**
     * Inspects a single node during the walk.
     * @param node  The node being visited.
     * @param state The analysis state accumulated so far.
     * @return The issues found at this node.
     */
    default List<Issue> inspect(AstNode node, AnalysisState state) {
        return List.of();
    }

    /**
     * Runs once after the whole program has been walked.
     * @param state The complete analysis state.
     * @return The issues that need whole-file knowledge.
     */
    default List<Issue> afterTraversal(AnalysisState state) {
        return List.of();
    }
}

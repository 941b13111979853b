package org.zeno.compiler.frontend.semantics.rules;

import org.zeno.compiler.frontend.parser.ast.AstNode;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.semantics.AnalysisState;
import org.zeno.compiler.frontend.semantics.Issue;

import java.util.List;

/**
 * Public functions must be UpperCamelCase, private functions lowerCamelCase. {@code main} is exempt.
 */
public class FunctionNamingRule implements ILintRule {

    public static final String NAME = "function-naming-convention";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Checks that public functions are UpperCamelCase and private functions lowerCamelCase.";
    }

    @Override
    public List<Issue> inspect(AstNode node, AnalysisState state) {
        if (!(node instanceof FunctionDefinition fn)) return List.of();
        String name = fn.name().text();
        if ("main".equals(name)) return List.of();

        if (fn.isPublic() && !NamingConventions.isUpperCamelCase(name)) {
            return List.of(Issue.at(fn.name(), NAME, String.format(
                    "Public function '%s' should be in UpperCamelCase (e.g., MyFunction).", name)));
        }
        if (!fn.isPublic() && !NamingConventions.isLowerCamelCase(name)) {
            return List.of(Issue.at(fn.name(), NAME, String.format(
                    "Private function '%s' should be in lowerCamelCase (e.g., myFunction).", name)));
        }
        return List.of();
    }
}

package org.zeno.compiler.frontend.semantics.rules;

import org.zeno.compiler.frontend.semantics.AnalysisState;
import org.zeno.compiler.frontend.semantics.Issue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class UnusedImportRule implements ILintRule {

    public static final String NAME = "unused-import";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Checks for imported symbols that are never referenced.";
    }

    @Override
    public List<Issue> afterTraversal(AnalysisState state) {
        List<Issue> issues = new ArrayList<>();
        for (Map.Entry<String, AnalysisState.ImportedName> entry : state.importedSymbols().entrySet()) {
            if (state.isImportUsed(entry.getKey())) continue;
            AnalysisState.ImportedName imported = entry.getValue();
            issues.add(Issue.at(imported.symbol().localToken(), NAME,
                    String.format("Imported symbol '%s' from module '%s' is not used.",
                            entry.getKey(), imported.declaredBy().modulePath())));
        }
        return issues;
    }
}

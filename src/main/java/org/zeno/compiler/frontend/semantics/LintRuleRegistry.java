package org.zeno.compiler.frontend.semantics;

import org.zeno.compiler.frontend.semantics.rules.FunctionNamingRule;
import org.zeno.compiler.frontend.semantics.rules.ILintRule;
import org.zeno.compiler.frontend.semantics.rules.UnusedFunctionRule;
import org.zeno.compiler.frontend.semantics.rules.UnusedImportRule;
import org.zeno.compiler.frontend.semantics.rules.UnusedVariableRule;
import org.zeno.compiler.frontend.semantics.rules.VariableNamingRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of lint rules. Registration order determines the order in which
 * the issues of different rules appear in the analyzer's output.
 */
public final class LintRuleRegistry {

    private final List<ILintRule> rules = new ArrayList<>();

    /**
     * Appends a rule. A rule with the same name replaces the earlier one in place.
     * @param rule The rule to register.
     */
    public void register(ILintRule rule) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).name().equals(rule.name())) {
                rules.set(i, rule);
                return;
            }
        }
        rules.add(rule);
    }

    public Optional<ILintRule> resolve(String name) {
        return rules.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    public List<ILintRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Creates a registry holding only the named rules, in the order of this registry.
     * @param enabled The rule names to keep.
     * @return A new registry.
     * @throws IllegalArgumentException if a name does not match any registered rule.
     */
    public LintRuleRegistry retainOnly(Collection<String> enabled) {
        for (String name : enabled) {
            if (resolve(name).isEmpty()) {
                throw new IllegalArgumentException("Unknown lint rule: " + name);
            }
        }
        LintRuleRegistry filtered = new LintRuleRegistry();
        rules.stream().filter(r -> enabled.contains(r.name())).forEach(filtered::register);
        return filtered;
    }

    /**
     * Creates a registry pre-populated with the default rules.
     * @return A fully initialized registry.
     */
    public static LintRuleRegistry initializeWithDefaults() {
        LintRuleRegistry registry = new LintRuleRegistry();
        registry.register(new UnusedVariableRule());
        registry.register(new UnusedFunctionRule());
        registry.register(new FunctionNamingRule());
        registry.register(new VariableNamingRule());
        registry.register(new UnusedImportRule());
        return registry;
    }
}

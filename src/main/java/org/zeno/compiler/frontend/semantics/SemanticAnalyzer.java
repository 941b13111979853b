package org.zeno.compiler.frontend.semantics;

import org.zeno.compiler.frontend.parser.ast.AssignmentStatement;
import org.zeno.compiler.frontend.parser.ast.AstNode;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.FunctionCall;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.Identifier;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.parser.ast.Parameter;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.frontend.semantics.rules.ILintRule;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.ZenoType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a program, tracks declarations and references across nested scopes, and runs the
 * registered lint rules over it.
 *
 * <p>The analysis is advisory: it never fails and never changes the AST. References that do
 * not resolve are ignored here; they are rejected by the generator.
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    /** Calls to names with this prefix go straight to the runtime bridge. */
    public static final String NATIVE_PREFIX = "__native_";

    private final LintRuleRegistry registry;

    public SemanticAnalyzer() {
        this(LintRuleRegistry.initializeWithDefaults());
    }

    public SemanticAnalyzer(LintRuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Analyzes one program.
     * @param program  The parsed program.
     * @param filePath The path recorded in issues that do not carry one.
     * @return The issues of all rules, grouped by rule in registration order.
     */
    public List<Issue> analyze(Program program, String filePath) {
        AnalysisState state = new AnalysisState(program);
        Map<ILintRule, List<Issue>> byRule = new LinkedHashMap<>();
        registry.rules().forEach(rule -> byRule.put(rule, new ArrayList<>()));

        collectTopLevel(program, state);
        for (Statement statement : program.statements()) {
            walk(statement, state, byRule);
        }
        byRule.forEach((rule, issues) -> issues.addAll(rule.afterTraversal(state)));

        List<Issue> result = new ArrayList<>();
        for (List<Issue> issues : byRule.values()) {
            for (Issue issue : issues) {
                result.add(issue.filePath() == null || issue.filePath().isEmpty() ? issue.withFilePath(filePath) : issue);
            }
        }
        log.debug("Analyzed {}: {} issue(s) from {} rule(s)", filePath, result.size(), byRule.size());
        return result;
    }

    /**
     * Pass 1: defines functions and imports in the root scope so that references resolve
     * regardless of declaration order.
     */
    private void collectTopLevel(Program program, AnalysisState state) {
        SymbolTable symbols = state.symbolTable();
        for (Statement statement : program.statements()) {
            if (statement instanceof FunctionDefinition fn) {
                symbols.define(new Symbol(fn.name(), Symbol.Kind.FUNCTION, ZenoType.UNRESOLVED, false));
                if (!fn.isPublic() && !"main".equals(fn.name().text())) {
                    state.declareFunction(fn);
                }
            } else if (statement instanceof ImportStatement imp) {
                for (ImportStatement.ImportedSymbol symbol : imp.symbols()) {
                    symbols.define(new Symbol(symbol.localToken(), Symbol.Kind.IMPORT, ZenoType.UNRESOLVED, false));
                    state.declareImport(symbol, imp);
                }
            }
        }
    }

    private void walk(AstNode node, AnalysisState state, Map<ILintRule, List<Issue>> byRule) {
        byRule.forEach((rule, issues) -> issues.addAll(rule.inspect(node, state)));
        SymbolTable symbols = state.symbolTable();

        if (node instanceof FunctionDefinition fn) {
            symbols.enterScope();
            for (Parameter parameter : fn.parameters()) {
                symbols.define(new Symbol(parameter.name(), Symbol.Kind.PARAMETER, declaredType(parameter.type()), false));
            }
            walk(fn.body(), state, byRule);
            symbols.leaveScope();
        } else if (node instanceof Block block) {
            symbols.enterScope();
            block.statements().forEach(s -> walk(s, state, byRule));
            symbols.leaveScope();
        } else if (node instanceof LetDeclaration let) {
            walk(let.value(), state, byRule);
            Symbol symbol = new Symbol(let.name(), Symbol.Kind.VARIABLE, declaredType(let.type()), let.mutable());
            symbols.define(symbol);
            if (!"_".equals(let.name().text())) {
                state.declareVariable(symbol, let);
            }
        } else if (node instanceof AssignmentStatement assign) {
            // The target counts as a use.
            reference(assign.name().text(), state);
            walk(assign.value(), state, byRule);
        } else if (node instanceof Identifier id) {
            reference(id.name(), state);
        } else if (node instanceof FunctionCall call) {
            if (!call.name().startsWith(NATIVE_PREFIX)) {
                state.markFunctionCalled(call.name());
            }
            state.markImportUsed(call.name());
            call.arguments().forEach(a -> walk(a, state, byRule));
        } else {
            node.getChildren().forEach(child -> walk(child, state, byRule));
        }
    }

    private void reference(String name, AnalysisState state) {
        state.symbolTable().resolve(name).ifPresent(symbol -> {
            switch (symbol.kind()) {
                case VARIABLE -> state.markVariableUsed(symbol);
                case IMPORT -> state.markImportUsed(name);
                case FUNCTION -> state.markFunctionCalled(name);
                default -> { }
            }
        });
    }

    private static ZenoType declaredType(Token type) {
        return type == null ? ZenoType.UNRESOLVED : ZenoType.fromName(type.text()).orElse(ZenoType.UNRESOLVED);
    }
}

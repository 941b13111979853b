package org.zeno.compiler.frontend.semantics;

import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.parser.ast.Program;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Everything the analyzer learns during one walk of a program. A fresh state is created for
 * every call to {@link SemanticAnalyzer#analyze}; rules read it but never modify it.
 */
public final class AnalysisState {

    /**
     * A symbol brought into the file by an import.
     *
     * @param symbol     The imported entry.
     * @param declaredBy The import statement that introduced it.
     */
    public record ImportedName(ImportStatement.ImportedSymbol symbol, ImportStatement declaredBy) {}

    private final Program program;
    private final SymbolTable symbolTable = new SymbolTable();

    private final Map<Symbol, LetDeclaration> declaredVariables = new LinkedHashMap<>();
    private final Set<Symbol> usedVariables = new HashSet<>();
    private final Map<String, FunctionDefinition> declaredFunctions = new LinkedHashMap<>();
    private final Set<String> calledFunctions = new HashSet<>();
    private final Map<String, ImportedName> importedSymbols = new LinkedHashMap<>();
    private final Set<String> usedImports = new HashSet<>();

    AnalysisState(Program program) {
        this.program = program;
    }

    public Program program() {
        return program;
    }

    SymbolTable symbolTable() {
        return symbolTable;
    }

    // === Recording, used by the analyzer ===

    void declareVariable(Symbol symbol, LetDeclaration declaration) {
        declaredVariables.put(symbol, declaration);
    }

    void markVariableUsed(Symbol symbol) {
        usedVariables.add(symbol);
    }

    void declareFunction(FunctionDefinition function) {
        declaredFunctions.putIfAbsent(function.name().text(), function);
    }

    void markFunctionCalled(String name) {
        calledFunctions.add(name);
    }

    void declareImport(ImportStatement.ImportedSymbol symbol, ImportStatement statement) {
        importedSymbols.putIfAbsent(symbol.localName(), new ImportedName(symbol, statement));
    }

    void markImportUsed(String localName) {
        if (importedSymbols.containsKey(localName)) {
            usedImports.add(localName);
        }
    }

    // === Queries, used by rules ===

    public Map<Symbol, LetDeclaration> declaredVariables() {
        return Collections.unmodifiableMap(declaredVariables);
    }

    public boolean isUsed(Symbol variable) {
        return usedVariables.contains(variable);
    }

    /**
     * Functions that could be reported as unused: private and not named {@code main}.
     */
    public Map<String, FunctionDefinition> declaredFunctions() {
        return Collections.unmodifiableMap(declaredFunctions);
    }

    public boolean isCalled(String functionName) {
        return calledFunctions.contains(functionName);
    }

    public Map<String, ImportedName> importedSymbols() {
        return Collections.unmodifiableMap(importedSymbols);
    }

    public boolean isImportUsed(String localName) {
        return usedImports.contains(localName);
    }
}

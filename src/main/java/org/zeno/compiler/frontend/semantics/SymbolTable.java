package org.zeno.compiler.frontend.semantics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing nested lexical scopes during one analysis or generation pass.
 * The root scope holds functions and imports; a scope is entered for every function body
 * and every block and left when the walk of that construct finishes.
 */
public class SymbolTable {

    private static final class Scope {
        private final Scope parent;
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }
    }

    private Scope currentScope;

    public SymbolTable() {
        this.currentScope = new Scope(null);
    }

    // === Scope management ===

    /**
     * Enters a new scope nested in the current one.
     */
    public void enterScope() {
        currentScope = new Scope(currentScope);
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    // === Symbol definition and resolution ===

    /**
     * Defines a symbol in the current scope.
     * @param symbol The symbol to define.
     * @return false if a symbol with the same name already exists in the current scope.
     */
    public boolean define(Symbol symbol) {
        return currentScope.symbols.putIfAbsent(symbol.text(), symbol) == null;
    }

    /**
     * Resolves a symbol by name, searching from the current scope outwards to the root.
     * @param name The name to resolve.
     * @return The innermost symbol with that name, or empty if none is visible.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) return Optional.of(symbol);
        }
        return Optional.empty();
    }
}

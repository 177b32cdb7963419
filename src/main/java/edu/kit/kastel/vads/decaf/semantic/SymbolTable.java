package edu.kit.kastel.vads.decaf.semantic;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// The symbols declared directly in one scope, plus a link to the enclosing scope.
///
/// Local symbols keep their declaration order and may contain the same name more than once;
/// reporting duplicates is left to the analysis.
public class SymbolTable {
    private final List<Symbol> localSymbols;
    private final @Nullable SymbolTable parent;

    public SymbolTable() {
        this.localSymbols = new ArrayList<>();
        this.parent = null;
    }

    public SymbolTable(SymbolTable parent) {
        this.localSymbols = new ArrayList<>();
        this.parent = parent;
    }

    public void insert(Symbol symbol) {
        this.localSymbols.add(symbol);
    }

    public List<Symbol> localSymbols() {
        return Collections.unmodifiableList(this.localSymbols);
    }

    public @Nullable SymbolTable parent() {
        return this.parent;
    }

    /// The first local declaration of {@code name}, ignoring enclosing scopes.
    public @Nullable Symbol lookupLocal(String name) {
        for (Symbol symbol : this.localSymbols) {
            if (symbol.name().equals(name)) {
                return symbol;
            }
        }
        return null;
    }

    /// Searches this scope, then the enclosing ones outwards.
    public @Nullable Symbol lookup(String name) {
        Symbol symbol = lookupLocal(name);
        if (symbol == null && this.parent != null) {
            return this.parent.lookup(name);
        }
        return symbol;
    }

    public int countLocal(String name) {
        int count = 0;
        for (Symbol symbol : this.localSymbols) {
            if (symbol.name().equals(name)) {
                count++;
            }
        }
        return count;
    }

    /// Creates a new, empty nested scope.
    public SymbolTable enter() {
        return new SymbolTable(this);
    }
}

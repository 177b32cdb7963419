package edu.kit.kastel.vads.decaf.semantic;

public enum SymbolKind {
    SCALAR,
    ARRAY,
    FUNCTION
}

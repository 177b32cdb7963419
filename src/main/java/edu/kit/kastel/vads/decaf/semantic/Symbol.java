package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.type.BasicType;

import java.util.List;

/// A declared name. For functions, {@code type} is the return type and {@code parameters} holds the
/// parameter types in declaration order; variables have no parameters.
public record Symbol(String name, BasicType type, SymbolKind kind, int length, List<BasicType> parameters) {

    public Symbol {
        parameters = List.copyOf(parameters);
    }

    public static Symbol scalar(String name, BasicType type) {
        return new Symbol(name, type, SymbolKind.SCALAR, 1, List.of());
    }

    public static Symbol array(String name, BasicType type, int length) {
        return new Symbol(name, type, SymbolKind.ARRAY, length, List.of());
    }

    public static Symbol function(String name, BasicType returnType, List<BasicType> parameters) {
        return new Symbol(name, returnType, SymbolKind.FUNCTION, 1, parameters);
    }

    public boolean isFunction() {
        return kind == SymbolKind.FUNCTION;
    }
}

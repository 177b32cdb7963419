package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

/// A global or block-local variable. Scalars have length 1.
public record VarDeclTree(BasicType type, String name, boolean isArray, int length, Span span) implements Tree {

    public static VarDeclTree scalar(BasicType type, String name, Span span) {
        return new VarDeclTree(type, name, false, 1, span);
    }

    public static VarDeclTree array(BasicType type, String name, int length, Span span) {
        return new VarDeclTree(type, name, true, length, span);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

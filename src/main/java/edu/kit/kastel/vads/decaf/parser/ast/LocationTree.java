package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;
import org.jspecify.annotations.Nullable;

/// A variable reference, optionally indexed: {@code name} or {@code name[index]}.
public record LocationTree(String name, @Nullable ExpressionTree index, Span span) implements ExpressionTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

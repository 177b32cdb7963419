package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

import java.util.List;

/// A function call, usable both as an expression and as a statement.
public record CallTree(String name, List<ExpressionTree> arguments, Span span) implements ExpressionTree, StatementTree {
    public CallTree {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

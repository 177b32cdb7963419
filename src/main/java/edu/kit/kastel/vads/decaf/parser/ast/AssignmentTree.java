package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

public record AssignmentTree(LocationTree lValue, ExpressionTree expression, Span span) implements StatementTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

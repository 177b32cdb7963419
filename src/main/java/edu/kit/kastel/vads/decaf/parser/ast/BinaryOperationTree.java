package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

public record BinaryOperationTree(ExpressionTree lhs, ExpressionTree rhs, BinaryOperator operatorType)
    implements ExpressionTree {

    @Override
    public Span span() {
        return lhs().span().merge(rhs().span());
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

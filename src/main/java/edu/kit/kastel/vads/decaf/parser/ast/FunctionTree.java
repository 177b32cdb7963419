package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

import java.util.List;

public record FunctionTree(BasicType returnType, String name, List<Parameter> parameters, BlockTree body, Span span)
    implements Tree {

    public FunctionTree {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    /// Parameters are not visited on their own; they live in the function's scope.
    public record Parameter(BasicType type, String name, Span span) {
        public int line() {
            return span.start().line();
        }
    }
}

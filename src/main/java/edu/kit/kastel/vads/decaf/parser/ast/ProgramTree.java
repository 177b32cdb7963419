package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

import java.util.List;

public record ProgramTree(List<VarDeclTree> variables, List<FunctionTree> functions, Span span) implements Tree {
    public ProgramTree {
        variables = List.copyOf(variables);
        functions = List.copyOf(functions);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

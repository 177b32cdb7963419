package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

import java.util.List;

public record BlockTree(List<VarDeclTree> variables, List<StatementTree> statements, Span span) implements StatementTree {
    public BlockTree {
        variables = List.copyOf(variables);
        statements = List.copyOf(statements);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

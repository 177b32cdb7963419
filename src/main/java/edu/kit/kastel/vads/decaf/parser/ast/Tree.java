package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

public sealed interface Tree permits ExpressionTree, StatementTree, ProgramTree, VarDeclTree, FunctionTree {

    Span span();

    /// The source line this tree starts on.
    default int line() {
        return span().start().line();
    }

    <T, R> R accept(Visitor<T, R> visitor, T data);
}

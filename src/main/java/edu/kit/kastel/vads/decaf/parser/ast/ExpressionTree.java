package edu.kit.kastel.vads.decaf.parser.ast;

public sealed interface ExpressionTree extends Tree
    permits BinaryOperationTree, CallTree, LiteralTree, LocationTree, UnaryOperationTree {
}

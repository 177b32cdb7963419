package edu.kit.kastel.vads.decaf.parser.ast;

public sealed interface StatementTree extends Tree
    permits AssignmentTree, BlockTree, BreakTree, CallTree, ContinueTree, IfTree, ReturnTree, WhileTree {
}

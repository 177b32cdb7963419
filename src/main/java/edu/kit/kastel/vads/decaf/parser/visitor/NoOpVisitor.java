package edu.kit.kastel.vads.decaf.parser.visitor;

import edu.kit.kastel.vads.decaf.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.BlockTree;
import edu.kit.kastel.vads.decaf.parser.ast.BreakTree;
import edu.kit.kastel.vads.decaf.parser.ast.CallTree;
import edu.kit.kastel.vads.decaf.parser.ast.ContinueTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.IfTree;
import edu.kit.kastel.vads.decaf.parser.ast.LiteralTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.ast.ReturnTree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.VarDeclTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;

/// A visitor that does nothing and returns {@link Unit#INSTANCE} by default.
public interface NoOpVisitor<T> extends Visitor<T, Unit> {

    @Override
    default Unit visit(ProgramTree programTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(VarDeclTree varDeclTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(FunctionTree functionTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(BlockTree blockTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(LocationTree locationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(LiteralTree literalTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(BinaryOperationTree binaryOperationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(UnaryOperationTree unaryOperationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(IfTree ifTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(WhileTree whileTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(BreakTree breakTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ContinueTree continueTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ReturnTree returnTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(AssignmentTree assignmentTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(CallTree callTree, T data) {
        return Unit.INSTANCE;
    }
}

package edu.kit.kastel.vads.decaf.parser.visitor;

import edu.kit.kastel.vads.decaf.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.BlockTree;
import edu.kit.kastel.vads.decaf.parser.ast.BreakTree;
import edu.kit.kastel.vads.decaf.parser.ast.CallTree;
import edu.kit.kastel.vads.decaf.parser.ast.ContinueTree;
import edu.kit.kastel.vads.decaf.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.IfTree;
import edu.kit.kastel.vads.decaf.parser.ast.LiteralTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.ast.ReturnTree;
import edu.kit.kastel.vads.decaf.parser.ast.StatementTree;
import edu.kit.kastel.vads.decaf.parser.ast.Tree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.VarDeclTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;

import java.util.ArrayList;
import java.util.List;

/// Walks a tree depth-first in source order.
///
/// For every node, all preorder visitors are called in registration order, then the children are
/// visited, then all postorder visitors are called in registration order. The walker itself does
/// not look at the nodes beyond finding their children.
public class RecursiveVisitor<T> implements Visitor<T, Unit> {
    private final List<Visitor<T, Unit>> preorder;
    private final List<Visitor<T, Unit>> postorder;

    public RecursiveVisitor(List<? extends Visitor<T, Unit>> preorder, List<? extends Visitor<T, Unit>> postorder) {
        this.preorder = List.copyOf(preorder);
        this.postorder = List.copyOf(postorder);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public void traverse(Tree root, T data) {
        root.accept(this, data);
    }

    private void enter(Tree tree, T data) {
        for (Visitor<T, Unit> visitor : this.preorder) {
            tree.accept(visitor, data);
        }
    }

    private void exit(Tree tree, T data) {
        for (Visitor<T, Unit> visitor : this.postorder) {
            tree.accept(visitor, data);
        }
    }

    @Override
    public Unit visit(ProgramTree programTree, T data) {
        enter(programTree, data);
        for (VarDeclTree variable : programTree.variables()) {
            variable.accept(this, data);
        }
        for (FunctionTree function : programTree.functions()) {
            function.accept(this, data);
        }
        exit(programTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(VarDeclTree varDeclTree, T data) {
        enter(varDeclTree, data);
        exit(varDeclTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(FunctionTree functionTree, T data) {
        enter(functionTree, data);
        functionTree.body().accept(this, data);
        exit(functionTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(BlockTree blockTree, T data) {
        enter(blockTree, data);
        for (VarDeclTree variable : blockTree.variables()) {
            variable.accept(this, data);
        }
        for (StatementTree statement : blockTree.statements()) {
            statement.accept(this, data);
        }
        exit(blockTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(LocationTree locationTree, T data) {
        enter(locationTree, data);
        if (locationTree.index() != null) {
            locationTree.index().accept(this, data);
        }
        exit(locationTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(LiteralTree literalTree, T data) {
        enter(literalTree, data);
        exit(literalTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(BinaryOperationTree binaryOperationTree, T data) {
        enter(binaryOperationTree, data);
        binaryOperationTree.lhs().accept(this, data);
        binaryOperationTree.rhs().accept(this, data);
        exit(binaryOperationTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(UnaryOperationTree unaryOperationTree, T data) {
        enter(unaryOperationTree, data);
        unaryOperationTree.operand().accept(this, data);
        exit(unaryOperationTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(IfTree ifTree, T data) {
        enter(ifTree, data);
        ifTree.condition().accept(this, data);
        ifTree.thenBranch().accept(this, data);
        if (ifTree.elseBranch() != null) {
            ifTree.elseBranch().accept(this, data);
        }
        exit(ifTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(WhileTree whileTree, T data) {
        enter(whileTree, data);
        whileTree.condition().accept(this, data);
        whileTree.body().accept(this, data);
        exit(whileTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(BreakTree breakTree, T data) {
        enter(breakTree, data);
        exit(breakTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(ContinueTree continueTree, T data) {
        enter(continueTree, data);
        exit(continueTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(ReturnTree returnTree, T data) {
        enter(returnTree, data);
        if (returnTree.expression() != null) {
            returnTree.expression().accept(this, data);
        }
        exit(returnTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(AssignmentTree assignmentTree, T data) {
        enter(assignmentTree, data);
        assignmentTree.lValue().accept(this, data);
        assignmentTree.expression().accept(this, data);
        exit(assignmentTree, data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(CallTree callTree, T data) {
        enter(callTree, data);
        for (ExpressionTree argument : callTree.arguments()) {
            argument.accept(this, data);
        }
        exit(callTree, data);
        return Unit.INSTANCE;
    }

    public static final class Builder<T> {
        private final List<Visitor<T, Unit>> preorder = new ArrayList<>();
        private final List<Visitor<T, Unit>> postorder = new ArrayList<>();

        private Builder() {
        }

        public Builder<T> preorder(Visitor<T, Unit> visitor) {
            this.preorder.add(visitor);
            return this;
        }

        public Builder<T> postorder(Visitor<T, Unit> visitor) {
            this.postorder.add(visitor);
            return this;
        }

        public RecursiveVisitor<T> build() {
            return new RecursiveVisitor<>(this.preorder, this.postorder);
        }
    }
}

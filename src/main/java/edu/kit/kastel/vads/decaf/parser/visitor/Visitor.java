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

/// One method per tree kind. A new kind has to be handled by every visitor.
public interface Visitor<T, R> {

    R visit(ProgramTree programTree, T data);

    R visit(VarDeclTree varDeclTree, T data);

    R visit(FunctionTree functionTree, T data);

    R visit(BlockTree blockTree, T data);

    R visit(LocationTree locationTree, T data);

    R visit(LiteralTree literalTree, T data);

    R visit(BinaryOperationTree binaryOperationTree, T data);

    R visit(UnaryOperationTree unaryOperationTree, T data);

    R visit(IfTree ifTree, T data);

    R visit(WhileTree whileTree, T data);

    R visit(BreakTree breakTree, T data);

    R visit(ContinueTree continueTree, T data);

    R visit(ReturnTree returnTree, T data);

    R visit(AssignmentTree assignmentTree, T data);

    R visit(CallTree callTree, T data);
}

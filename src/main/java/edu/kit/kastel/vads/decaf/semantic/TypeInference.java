package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.CallTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.IfTree;
import edu.kit.kastel.vads.decaf.parser.ast.LiteralTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.ReturnTree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.VarDeclTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

/// Records the type of every tree whose type does not depend on its children.
///
/// Operators have a fixed result type, so all inference happens on entry. Names that cannot be
/// resolved are typed {@code void}; reporting them is {@link SymbolUsageAnalysis}'s job.
public class TypeInference implements NoOpVisitor<AnalysisContext> {

    @Override
    public Unit visit(LiteralTree literalTree, AnalysisContext data) {
        data.types().set(literalTree, literalTree.type());
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(VarDeclTree varDeclTree, AnalysisContext data) {
        data.types().set(varDeclTree, varDeclTree.type());
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(FunctionTree functionTree, AnalysisContext data) {
        data.types().set(functionTree, functionTree.returnType());
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(LocationTree locationTree, AnalysisContext data) {
        Symbol symbol = data.lookup(locationTree.name());
        data.types().set(locationTree, symbol == null ? BasicType.VOID : symbol.type());
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(IfTree ifTree, AnalysisContext data) {
        data.types().set(ifTree, BasicType.BOOL);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(WhileTree whileTree, AnalysisContext data) {
        data.types().set(whileTree, BasicType.BOOL);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(ReturnTree returnTree, AnalysisContext data) {
        BasicType returnType = data.currentReturnType();
        data.types().set(returnTree, returnType == null ? BasicType.VOID : returnType);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(CallTree callTree, AnalysisContext data) {
        Symbol function = data.lookup(callTree.name());
        data.types().set(callTree, function == null || !function.isFunction() ? BasicType.VOID : function.type());
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(BinaryOperationTree binaryOperationTree, AnalysisContext data) {
        BasicType type = switch (binaryOperationTree.operatorType()) {
            case OR, AND, EQ, NEQ, LT, LE, GE, GT -> BasicType.BOOL;
            case ADD, SUB, MUL, DIV, MOD -> BasicType.INT;
        };
        data.types().set(binaryOperationTree, type);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(UnaryOperationTree unaryOperationTree, AnalysisContext data) {
        BasicType type = switch (unaryOperationTree.operatorType()) {
            case NEG -> BasicType.INT;
            case NOT -> BasicType.BOOL;
        };
        data.types().set(unaryOperationTree, type);
        return Unit.INSTANCE;
    }
}

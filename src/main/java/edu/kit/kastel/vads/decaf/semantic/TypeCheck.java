package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.CallTree;
import edu.kit.kastel.vads.decaf.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.decaf.parser.ast.IfTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.ReturnTree;
import edu.kit.kastel.vads.decaf.parser.ast.Tree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

import java.util.List;

/// Compares the inferred types of a tree and its children once the children have been visited.
public class TypeCheck implements NoOpVisitor<AnalysisContext> {

    @Override
    public Unit visit(LocationTree locationTree, AnalysisContext data) {
        ExpressionTree index = locationTree.index();
        if (index != null) {
            BasicType indexType = data.types().typeOrVoid(index);
            if (indexType != BasicType.INT) {
                data.diagnostics().report(locationTree.line(),
                    "Invalid array index on line %d. Expected 'int' but was '%s'", locationTree.line(), indexType);
            }
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(AssignmentTree assignmentTree, AnalysisContext data) {
        BasicType lValueType = data.types().typeOrVoid(assignmentTree.lValue());
        BasicType exprType = data.types().typeOrVoid(assignmentTree.expression());
        if (lValueType != exprType) {
            data.diagnostics().report(assignmentTree.line(),
                "Type mismatch on line %d. Expected '%s' to be of type '%s', but was '%s'",
                assignmentTree.line(), assignmentTree.lValue().name(), lValueType, exprType);
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(IfTree ifTree, AnalysisContext data) {
        checkCondition(ifTree, ifTree.condition(), data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(WhileTree whileTree, AnalysisContext data) {
        checkCondition(whileTree, whileTree.condition(), data);
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(BinaryOperationTree binaryOperationTree, AnalysisContext data) {
        BasicType lhsType = data.types().typeOrVoid(binaryOperationTree.lhs());
        BasicType rhsType = data.types().typeOrVoid(binaryOperationTree.rhs());
        int line = binaryOperationTree.line();
        var operator = binaryOperationTree.operatorType();

        switch (operator) {
            case OR, AND -> requireOperands(BasicType.BOOL, lhsType, rhsType, binaryOperationTree, data);
            case EQ, NEQ -> {
                if (lhsType != rhsType) {
                    data.diagnostics().report(line,
                        "Invalid binary operation on line %d. Expected values to be of the same type, but was '%s %s %s'",
                        line, lhsType, operator, rhsType);
                }
            }
            case LT, LE, GE, GT, ADD, SUB, MUL, DIV, MOD ->
                requireOperands(BasicType.INT, lhsType, rhsType, binaryOperationTree, data);
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(UnaryOperationTree unaryOperationTree, AnalysisContext data) {
        BasicType expected = data.types().typeOrVoid(unaryOperationTree);
        BasicType actual = data.types().typeOrVoid(unaryOperationTree.operand());
        if (expected != actual) {
            data.diagnostics().report(unaryOperationTree.line(),
                "Invalid unary operation on line %d. Expected '%s%s' but was '%s%s'",
                unaryOperationTree.line(), unaryOperationTree.operatorType(), expected,
                unaryOperationTree.operatorType(), actual);
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(ReturnTree returnTree, AnalysisContext data) {
        BasicType expected = data.types().typeOrVoid(returnTree);
        ExpressionTree value = returnTree.expression();
        if (value == null) {
            if (expected != BasicType.VOID) {
                reportReturnMismatch(returnTree, expected, BasicType.VOID, data);
            }
            return Unit.INSTANCE;
        }
        BasicType actual = data.types().typeOrVoid(value);
        // a void value stems from an error reported elsewhere
        if (actual != BasicType.VOID && actual != expected) {
            reportReturnMismatch(returnTree, expected, actual, data);
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(CallTree callTree, AnalysisContext data) {
        Symbol function = data.lookup(callTree.name());
        if (function == null || !function.isFunction()) {
            return Unit.INSTANCE;
        }
        List<BasicType> parameters = function.parameters();
        List<ExpressionTree> arguments = callTree.arguments();
        if (parameters.size() != arguments.size()) {
            data.diagnostics().report(callTree.line(),
                "Invalid call to '%s' on line %d. Expected %d argument(s) but was %d",
                callTree.name(), callTree.line(), parameters.size(), arguments.size());
            return Unit.INSTANCE;
        }
        for (int i = 0; i < arguments.size(); i++) {
            BasicType actual = data.types().typeOrVoid(arguments.get(i));
            if (actual != parameters.get(i)) {
                data.diagnostics().report(callTree.line(),
                    "Invalid argument type on line %d. Expected argument %d of '%s' to be of type '%s', but was '%s'",
                    callTree.line(), i + 1, callTree.name(), parameters.get(i), actual);
            }
        }
        return Unit.INSTANCE;
    }

    private static void checkCondition(Tree statement, ExpressionTree condition, AnalysisContext data) {
        BasicType expected = data.types().typeOrVoid(statement);
        BasicType actual = data.types().typeOrVoid(condition);
        if (expected != actual) {
            data.diagnostics().report(statement.line(),
                "Invalid condition on line %d. Expected condition to be of type '%s', but was '%s'",
                statement.line(), expected, actual);
        }
    }

    private static void requireOperands(BasicType required, BasicType lhsType, BasicType rhsType,
                                        BinaryOperationTree tree, AnalysisContext data) {
        if (lhsType != required || rhsType != required) {
            data.diagnostics().report(tree.line(),
                "Invalid binary operation on line %d. Expected '%s %s %s' but was '%s %s %s'",
                tree.line(), required, tree.operatorType(), required, lhsType, tree.operatorType(), rhsType);
        }
    }

    private static void reportReturnMismatch(ReturnTree returnTree, BasicType expected, BasicType actual,
                                             AnalysisContext data) {
        data.diagnostics().report(returnTree.line(),
            "Type mismatch on line %d. Expected method to return type to be '%s', but was '%s'",
            returnTree.line(), expected, actual);
    }
}

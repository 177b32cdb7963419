package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.CallTree;
import edu.kit.kastel.vads.decaf.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.decaf.parser.ast.LiteralTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperator;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

import java.util.OptionalLong;

/// Checks that names are
/// - declared in an enclosing scope
/// - used as what they were declared as (variable, array or function)
/// - indexed within bounds, if the index is a constant
public class SymbolUsageAnalysis implements NoOpVisitor<AnalysisContext> {

    @Override
    public Unit visit(LocationTree locationTree, AnalysisContext data) {
        Diagnostics diagnostics = data.diagnostics();
        Symbol symbol = data.lookup(locationTree.name());
        if (symbol == null) {
            diagnostics.report(locationTree.line(), "Symbol '%s' undefined on line %d",
                locationTree.name(), locationTree.line());
            return Unit.INSTANCE;
        }
        if (symbol.isFunction()) {
            diagnostics.report(locationTree.line(), "Invalid use of function '%s' as a variable on line %d",
                locationTree.name(), locationTree.line());
            return Unit.INSTANCE;
        }

        ExpressionTree index = locationTree.index();
        if (index == null) {
            if (symbol.length() > 1) {
                diagnostics.report(locationTree.line(), "Invalid array access on line %d. Array '%s' used as scalar",
                    locationTree.line(), locationTree.name());
            }
            return Unit.INSTANCE;
        }

        OptionalLong constant = constantIndex(index);
        if (constant.isEmpty()) {
            return Unit.INSTANCE;
        }
        long value = constant.getAsLong();
        if (value < 0) {
            diagnostics.report(locationTree.line(),
                "Array access '%s[%d]' on line %d is invalid. Index must not be negative",
                locationTree.name(), value, locationTree.line());
        } else if (value >= symbol.length()) {
            diagnostics.report(locationTree.line(),
                "Array access '%s[%d]' on line %d is invalid. Index out of bounds for length %d",
                locationTree.name(), value, locationTree.line(), symbol.length());
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(CallTree callTree, AnalysisContext data) {
        Symbol symbol = data.lookup(callTree.name());
        if (symbol == null) {
            data.diagnostics().report(callTree.line(), "Symbol '%s' undefined on line %d",
                callTree.name(), callTree.line());
        } else if (!symbol.isFunction()) {
            data.diagnostics().report(callTree.line(), "Invalid call on line %d. '%s' is not a function",
                callTree.line(), callTree.name());
        }
        return Unit.INSTANCE;
    }

    /// Integer literals, and negated integer literals for parsers that do not fold the sign.
    /// Anything else is only known at run time.
    static OptionalLong constantIndex(ExpressionTree index) {
        if (index instanceof LiteralTree literal) {
            return literal.parseValue();
        }
        if (index instanceof UnaryOperationTree unary
            && unary.operatorType() == UnaryOperator.NEG
            && unary.operand() instanceof LiteralTree literal) {
            OptionalLong value = literal.parseValue();
            return value.isPresent() ? OptionalLong.of(-value.getAsLong()) : value;
        }
        return OptionalLong.empty();
    }
}

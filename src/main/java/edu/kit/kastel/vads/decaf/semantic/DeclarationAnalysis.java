package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.VarDeclTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

import java.util.HashSet;
import java.util.Set;

/// Checks that declarations are
/// - not of type void
/// - not named {@code main}, unless they declare the main function
/// - arrays of positive length
/// - unique within their scope
///
/// Runs before the declaration's own scope is entered, so function names are checked
/// against the global scope.
public class DeclarationAnalysis implements NoOpVisitor<AnalysisContext> {

    private static final String MAIN = "main";

    @Override
    public Unit visit(VarDeclTree varDeclTree, AnalysisContext data) {
        Diagnostics diagnostics = data.diagnostics();
        if (varDeclTree.type() == BasicType.VOID) {
            diagnostics.report(varDeclTree.line(), "Void variable '%s' on line %d",
                varDeclTree.name(), varDeclTree.line());
        }
        if (varDeclTree.name().equals(MAIN)) {
            diagnostics.report(varDeclTree.line(), "Invalid variable name '%s' on line %d",
                varDeclTree.name(), varDeclTree.line());
        }
        if (varDeclTree.isArray() && varDeclTree.length() < 1) {
            diagnostics.report(varDeclTree.line(),
                "Invalid array declaration on line %d. Array length must be greater than 0 but was %d",
                varDeclTree.line(), varDeclTree.length());
        }
        checkDuplicate(data, data.currentScope(), varDeclTree.name(), varDeclTree.line());
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(FunctionTree functionTree, AnalysisContext data) {
        checkDuplicate(data, data.currentScope(), functionTree.name(), functionTree.line());

        SymbolTable functionScope = data.scopes().tableOf(functionTree);
        Set<String> seen = new HashSet<>();
        for (FunctionTree.Parameter parameter : functionTree.parameters()) {
            if (parameter.type() == BasicType.VOID) {
                data.diagnostics().report(parameter.line(), "Void parameter '%s' on line %d",
                    parameter.name(), parameter.line());
            }
            if (parameter.name().equals(MAIN)) {
                data.diagnostics().report(parameter.line(), "Invalid parameter name '%s' on line %d",
                    parameter.name(), parameter.line());
            }
            boolean first = seen.add(parameter.name());
            if (!first && (functionScope == null || functionScope.countLocal(parameter.name()) > 1)) {
                data.diagnostics().report(parameter.line(), "Duplicate symbol '%s' on line %d",
                    parameter.name(), parameter.line());
            }
        }
        return Unit.INSTANCE;
    }

    private static void checkDuplicate(AnalysisContext data, SymbolTable scope, String name, int line) {
        boolean first = data.declare(name);
        if (!first && scope.countLocal(name) > 1) {
            data.diagnostics().report(line, "Duplicate symbol '%s' on line %d", name, line);
        }
    }
}

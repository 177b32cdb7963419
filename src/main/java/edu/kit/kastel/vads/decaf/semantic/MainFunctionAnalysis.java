package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

/// Checks that the program declares a function {@code main} without parameters.
/// Runs after the whole program has been visited, while the global scope is still active.
public class MainFunctionAnalysis implements NoOpVisitor<AnalysisContext> {

    private static final String MAIN = "main";

    @Override
    public Unit visit(ProgramTree programTree, AnalysisContext data) {
        Symbol main = null;
        for (Symbol symbol : data.globalScope().localSymbols()) {
            if (symbol.isFunction() && symbol.name().equals(MAIN)) {
                main = symbol;
                break;
            }
        }
        if (main == null) {
            data.diagnostics().reportWithoutLine("Program does not contain a main function");
        } else if (!main.parameters().isEmpty()) {
            int line = mainLine(programTree);
            data.diagnostics().report(line, "Main method on line %d should not have any parameters", line);
        }
        return Unit.INSTANCE;
    }

    private static int mainLine(ProgramTree programTree) {
        for (FunctionTree function : programTree.functions()) {
            if (function.name().equals(MAIN)) {
                return function.line();
            }
        }
        return programTree.line();
    }
}

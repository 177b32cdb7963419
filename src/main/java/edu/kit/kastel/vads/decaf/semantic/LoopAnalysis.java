package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.BreakTree;
import edu.kit.kastel.vads.decaf.parser.ast.ContinueTree;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

/// Checks that {@code break} and {@code continue} only appear inside a while loop.
public class LoopAnalysis implements NoOpVisitor<AnalysisContext> {

    @Override
    public Unit visit(BreakTree breakTree, AnalysisContext data) {
        if (!data.inLoop()) {
            data.diagnostics().report(breakTree.line(), "Invalid break on line %d", breakTree.line());
        }
        return Unit.INSTANCE;
    }

    @Override
    public Unit visit(ContinueTree continueTree, AnalysisContext data) {
        if (!data.inLoop()) {
            data.diagnostics().report(continueTree.line(), "Invalid continue on line %d", continueTree.line());
        }
        return Unit.INSTANCE;
    }
}

package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.BlockTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

/// Keeps the {@link AnalysisContext} in step with the traversal.
/// {@link Enter} has to run before and {@link Exit} after all other rules of a node.
final class ContextTracking {

    private ContextTracking() {
    }

    static final class Enter implements NoOpVisitor<AnalysisContext> {

        @Override
        public Unit visit(ProgramTree programTree, AnalysisContext data) {
            data.enterScope(programTree);
            // built-ins count as declared before the first user declaration
            for (Symbol builtIn : SymbolTableBuilder.BUILT_INS) {
                data.declare(builtIn.name());
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(FunctionTree functionTree, AnalysisContext data) {
            data.enterFunction(functionTree);
            data.enterScope(functionTree);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(BlockTree blockTree, AnalysisContext data) {
            data.enterScope(blockTree);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(WhileTree whileTree, AnalysisContext data) {
            data.enterLoop();
            return Unit.INSTANCE;
        }
    }

    static final class Exit implements NoOpVisitor<AnalysisContext> {

        @Override
        public Unit visit(ProgramTree programTree, AnalysisContext data) {
            data.exitScope(programTree);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(FunctionTree functionTree, AnalysisContext data) {
            data.exitScope(functionTree);
            data.exitFunction();
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(BlockTree blockTree, AnalysisContext data) {
            data.exitScope(blockTree);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(WhileTree whileTree, AnalysisContext data) {
            data.exitLoop();
            return Unit.INSTANCE;
        }
    }
}

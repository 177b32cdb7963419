package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import org.jspecify.annotations.Nullable;

/// Entry point for the compiler pipeline: fails with a {@link SemanticException} listing every
/// diagnostic, or returns the inferred types for code generation.
public class SemanticAnalysis {

    public InferredTypes analyze(@Nullable ProgramTree program) {
        Scopes scopes = program == null ? new Scopes() : new SymbolTableBuilder().build(program);
        return analyze(program, scopes);
    }

    public InferredTypes analyze(@Nullable ProgramTree program, Scopes scopes) {
        AnalysisResult result = new StaticAnalysis().analyze(program, scopes);
        if (!result.isWellFormed()) {
            throw new SemanticException(result.diagnostics());
        }
        return result.types();
    }
}

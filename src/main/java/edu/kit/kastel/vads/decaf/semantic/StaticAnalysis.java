package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.visitor.RecursiveVisitor;
import org.jspecify.annotations.Nullable;

/// Resolves names, infers and checks types and validates the structure of a program in a single
/// traversal. Every defect is collected; only a missing tree stops the analysis.
///
/// The order of the rules matters: declarations are checked before a node opens its scope, types
/// are inferred before names are validated, and the context is restored after all exit rules ran.
public class StaticAnalysis {

    public AnalysisResult analyze(@Nullable ProgramTree program, Scopes scopes) {
        Diagnostics diagnostics = new Diagnostics();
        InferredTypes types = new InferredTypes();
        if (program == null) {
            diagnostics.reportWithoutLine("Null tree");
            return new AnalysisResult(diagnostics, types);
        }

        AnalysisContext context = new AnalysisContext(scopes, diagnostics, types);
        RecursiveVisitor<AnalysisContext> walker = RecursiveVisitor.<AnalysisContext>builder()
            .preorder(new DeclarationAnalysis())
            .preorder(new ContextTracking.Enter())
            .preorder(new TypeInference())
            .preorder(new SymbolUsageAnalysis())
            .preorder(new LoopAnalysis())
            .postorder(new TypeCheck())
            .postorder(new MainFunctionAnalysis())
            .postorder(new ContextTracking.Exit())
            .build();
        walker.traverse(program, context);

        if (!context.isInInitialState()) {
            throw new IllegalStateException("analysis context was not restored after the traversal");
        }
        return new AnalysisResult(diagnostics, types);
    }
}

package edu.kit.kastel.vads.decaf.semantic;

/// What one analysis run produced: the diagnostics in detection order and the inferred types.
public record AnalysisResult(Diagnostics diagnostics, InferredTypes types) {

    public boolean isWellFormed() {
        return diagnostics.isEmpty();
    }
}

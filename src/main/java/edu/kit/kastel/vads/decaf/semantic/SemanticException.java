package edu.kit.kastel.vads.decaf.semantic;

import java.util.List;

public class SemanticException extends RuntimeException {
    private final List<Diagnostic> diagnostics;

    public SemanticException(Diagnostics diagnostics) {
        super(diagnostics.toString());
        this.diagnostics = List.copyOf(diagnostics.entries());
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}

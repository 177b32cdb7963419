package edu.kit.kastel.vads.decaf.semantic;

import java.util.OptionalInt;

/// A single reported defect. Program-level defects have no line.
public record Diagnostic(String message, OptionalInt line) {

    @Override
    public String toString() {
        return message;
    }
}

package edu.kit.kastel.vads.decaf;

public sealed interface Position {
    int line();

    int column();

    /// Lines and columns are 1-based, as reported in diagnostics.
    record SimplePosition(int line, int column) implements Position {
        @Override
        public String toString() {
            return line() + ":" + column();
        }
    }
}

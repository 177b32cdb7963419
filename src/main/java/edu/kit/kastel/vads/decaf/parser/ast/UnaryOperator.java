package edu.kit.kastel.vads.decaf.parser.ast;

public enum UnaryOperator {
    NEG("-"),
    NOT("!");

    private final String value;

    UnaryOperator(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return this.value;
    }
}

package edu.kit.kastel.vads.decaf.parser.ast;

public enum BinaryOperator {
    // Logical operators
    OR("||"),
    AND("&&"),

    // Equality operators
    EQ("=="),
    NEQ("!="),

    // Relational operators
    LT("<"),
    LE("<="),
    GE(">="),
    GT(">"),

    // Arithmetic operators
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%");

    private final String value;

    BinaryOperator(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return this.value;
    }
}

package edu.kit.kastel.vads.decaf.parser.visitor;

public enum Unit {
    INSTANCE
}

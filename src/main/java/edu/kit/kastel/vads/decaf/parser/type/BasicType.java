package edu.kit.kastel.vads.decaf.parser.type;

import java.util.Locale;

public enum BasicType {
    INT,
    BOOL,
    VOID,
    STR;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}

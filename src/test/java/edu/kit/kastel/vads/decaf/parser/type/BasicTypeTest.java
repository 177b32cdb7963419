package edu.kit.kastel.vads.decaf.parser.type;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class BasicTypeTest {

    @Test
    void names_are_lowercase_keywords() {
        assertEquals("int", BasicType.INT.toString());
        assertEquals("bool", BasicType.BOOL.toString());
        assertEquals("void", BasicType.VOID.toString());
        assertEquals("str", BasicType.STR.toString());
    }

    @Test
    void names_do_not_depend_on_the_default_locale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertEquals("int", BasicType.INT.toString());
        } finally {
            Locale.setDefault(previous);
        }
    }
}

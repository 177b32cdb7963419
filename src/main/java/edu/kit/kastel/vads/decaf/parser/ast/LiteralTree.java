package edu.kit.kastel.vads.decaf.parser.ast;

import edu.kit.kastel.vads.decaf.Span;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.Visitor;

import java.util.Locale;
import java.util.OptionalLong;

public record LiteralTree(BasicType type, String value, Span span) implements ExpressionTree {

    public static LiteralTree ofInt(long value, Span span) {
        return new LiteralTree(BasicType.INT, Long.toString(value), span);
    }

    public static LiteralTree ofBool(boolean value, Span span) {
        return new LiteralTree(BasicType.BOOL, Boolean.toString(value), span);
    }

    public static LiteralTree ofString(String value, Span span) {
        return new LiteralTree(BasicType.STR, value, span);
    }

    /// Decimal and {@code 0x} hexadecimal integer literals, possibly signed.
    /// Empty for non-integer literals or values that do not fit a long.
    public OptionalLong parseValue() {
        if (this.type != BasicType.INT) {
            return OptionalLong.empty();
        }
        String text = this.value.trim();
        boolean negative = text.startsWith("-");
        if (negative) {
            text = text.substring(1);
        }
        try {
            long parsed = text.toLowerCase(Locale.ROOT).startsWith("0x")
                ? Long.parseLong(text.substring(2), 16)
                : Long.parseLong(text, 10);
            return OptionalLong.of(negative ? -parsed : parsed);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

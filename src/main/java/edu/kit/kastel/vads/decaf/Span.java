package edu.kit.kastel.vads.decaf;

public sealed interface Span {
    Position start();

    Position end();

    Span merge(Span later);

    static Span ofLine(int line) {
        return new SimpleSpan(new Position.SimplePosition(line, 1), new Position.SimplePosition(line, 1));
    }

    record SimpleSpan(Position start, Position end) implements Span {
        @Override
        public Span merge(Span later) {
            return new SimpleSpan(start(), later.end());
        }

        @Override
        public String toString() {
            return "[" + start() + "|" + end() + "]";
        }
    }
}

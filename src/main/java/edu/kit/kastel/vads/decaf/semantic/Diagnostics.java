package edu.kit.kastel.vads.decaf.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/// Append-only list of diagnostics in detection order. Entries are never merged or dropped.
public final class Diagnostics implements Iterable<Diagnostic> {
    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(int line, String format, Object... args) {
        this.entries.add(new Diagnostic(String.format(Locale.ROOT, format, args), OptionalInt.of(line)));
    }

    public void reportWithoutLine(String format, Object... args) {
        this.entries.add(new Diagnostic(String.format(Locale.ROOT, format, args), OptionalInt.empty()));
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(this.entries);
    }

    public List<String> messages() {
        return this.entries.stream().map(Diagnostic::message).toList();
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    public int size() {
        return this.entries.size();
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return entries().iterator();
    }

    @Override
    public String toString() {
        return String.join(System.lineSeparator(), messages());
    }
}

package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    @Test
    void lookup_prefers_the_innermost_declaration() {
        SymbolTable global = new SymbolTable();
        global.insert(Symbol.scalar("x", BasicType.INT));
        SymbolTable block = global.enter();
        block.insert(Symbol.scalar("x", BasicType.BOOL));

        assertEquals(BasicType.BOOL, block.lookup("x").type());
        assertEquals(BasicType.INT, global.lookup("x").type());
    }

    @Test
    void lookup_falls_back_to_enclosing_scopes() {
        SymbolTable global = new SymbolTable();
        global.insert(Symbol.array("a", BasicType.INT, 4));
        SymbolTable inner = global.enter().enter();

        Symbol symbol = inner.lookup("a");
        assertNotNull(symbol);
        assertEquals(4, symbol.length());
        assertNull(inner.lookupLocal("a"));
        assertSame(global, inner.parent().parent());
    }

    @Test
    void unknown_names_resolve_to_null() {
        assertNull(new SymbolTable().enter().lookup("missing"));
    }

    @Test
    void duplicates_are_kept_in_declaration_order() {
        SymbolTable table = new SymbolTable();
        table.insert(Symbol.scalar("a", BasicType.INT));
        table.insert(Symbol.scalar("a", BasicType.BOOL));
        table.insert(Symbol.scalar("b", BasicType.INT));

        assertEquals(2, table.countLocal("a"));
        assertEquals(0, table.countLocal("c"));
        assertEquals(BasicType.INT, table.lookupLocal("a").type());
        assertEquals(3, table.localSymbols().size());
    }

    @Test
    void local_symbols_cannot_be_modified_through_the_view() {
        SymbolTable table = new SymbolTable();
        assertThrows(UnsupportedOperationException.class,
            () -> table.localSymbols().add(Symbol.scalar("x", BasicType.INT)));
    }

    @Test
    void function_symbols_copy_their_parameters() {
        var parameters = new ArrayList<>(List.of(BasicType.INT, BasicType.BOOL));
        Symbol function = Symbol.function("f", BasicType.VOID, parameters);
        parameters.clear();

        assertTrue(function.isFunction());
        assertEquals(List.of(BasicType.INT, BasicType.BOOL), function.parameters());
        assertEquals(SymbolKind.SCALAR, Symbol.scalar("x", BasicType.INT).kind());
    }
}

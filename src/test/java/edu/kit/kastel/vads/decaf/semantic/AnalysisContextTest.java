package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.BlockTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import org.junit.jupiter.api.Test;

import static edu.kit.kastel.vads.decaf.parser.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisContextTest {

    private final ProgramTree program = program(validMain(1));
    private final FunctionTree main = program.functions().get(0);
    private final BlockTree body = main.body();
    private final Scopes scopes = new SymbolTableBuilder().build(program);
    private final AnalysisContext context = new AnalysisContext(scopes, new Diagnostics(), new InferredTypes());

    @Test
    void starts_in_initial_state() {
        assertTrue(context.isInInitialState());
        assertNull(context.currentFunction());
        assertNull(context.currentReturnType());
        assertFalse(context.inLoop());
        assertThrows(IllegalStateException.class, context::currentScope);
    }

    @Test
    void scopes_nest_and_restore() {
        context.enterScope(program);
        context.enterFunction(main);
        context.enterScope(main);
        context.enterScope(body);

        assertSame(scopes.tableOf(body), context.currentScope());
        assertSame(scopes.tableOf(program), context.globalScope());
        assertEquals("main", context.currentFunction());
        assertEquals(BasicType.INT, context.currentReturnType());

        context.exitScope(body);
        context.exitScope(main);
        context.exitFunction();
        assertSame(scopes.tableOf(program), context.currentScope());
        context.exitScope(program);
        assertTrue(context.isInInitialState());
    }

    @Test
    void leaving_a_scope_that_is_not_active_fails() {
        context.enterScope(program);
        context.enterScope(main);

        assertThrows(IllegalStateException.class, () -> context.exitScope(program));
    }

    @Test
    void loop_depth_counts_nesting_and_never_goes_negative() {
        context.enterLoop();
        context.enterLoop();
        assertEquals(2, context.loopDepth());
        context.exitLoop();
        assertTrue(context.inLoop());
        context.exitLoop();
        assertFalse(context.inLoop());

        assertThrows(IllegalStateException.class, context::exitLoop);
    }

    @Test
    void declare_reports_repeated_names_per_scope() {
        context.enterScope(program);
        assertTrue(context.declare("a"));
        assertFalse(context.declare("a"));
        context.enterScope(main);
        assertTrue(context.declare("a"));
    }
}

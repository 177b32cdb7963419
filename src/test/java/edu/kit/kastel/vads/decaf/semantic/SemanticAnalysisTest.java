package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static edu.kit.kastel.vads.decaf.parser.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class SemanticAnalysisTest {

    @Test
    void valid_program_returns_inferred_types() {
        ProgramTree program = program(validMain(1));

        InferredTypes types = new SemanticAnalysis().analyze(program);

        assertEquals(BasicType.INT, types.typeOrVoid(program.functions().get(0)));
    }

    @Test
    void invalid_program_throws_with_every_diagnostic() {
        ProgramTree program = program(List.of(var(BasicType.VOID, "v", 1)),
            function(BasicType.INT, "main", 2, block(2, breakAt(3), ret(intLit(0, 4), 4))));

        SemanticException exception = assertThrows(SemanticException.class,
            () -> new SemanticAnalysis().analyze(program));

        assertEquals(2, exception.diagnostics().size());
        assertEquals("Void variable 'v' on line 1", exception.diagnostics().get(0).message());
        assertEquals(OptionalInt.of(3), exception.diagnostics().get(1).line());
        assertEquals("Void variable 'v' on line 1" + System.lineSeparator() + "Invalid break on line 3",
            exception.getMessage());
    }

    @Test
    void null_tree_throws_with_a_single_diagnostic() {
        SemanticException exception = assertThrows(SemanticException.class,
            () -> new SemanticAnalysis().analyze(null));

        assertEquals(1, exception.diagnostics().size());
        assertEquals("Null tree", exception.getMessage());
        assertTrue(exception.diagnostics().get(0).line().isEmpty());
    }
}

package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperator;
import edu.kit.kastel.vads.decaf.parser.ast.CallTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.LiteralTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.ast.ReturnTree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.UnaryOperator;
import edu.kit.kastel.vads.decaf.parser.ast.VarDeclTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static edu.kit.kastel.vads.decaf.parser.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class InferredTypesTest {

    @Test
    void analysis_records_a_type_for_each_typed_tree() {
        VarDeclTree x = var(BasicType.INT, "x", 2);
        LocationTree target = loc("x", 3);
        LiteralTree one = intLit(1, 3);
        BinaryOperationTree less = bin(loc("x", 4), BinaryOperator.LT, intLit(5, 4));
        UnaryOperationTree not = unary(UnaryOperator.NOT, less, 4);
        LocationTree unknown = loc("nope", 5);
        CallTree print = call("print_int", 6, loc("x", 6));
        WhileTree loop = whileLoop(not, block(4, breakAt(4)), 4);
        AssignmentTree assignment = assign(target, one, 3);
        ReturnTree ret = ret(loc("x", 7), 7);
        FunctionTree main = function(BasicType.INT, "main", 1,
            block(1, List.of(x), assignment, loop, assign(unknown, intLit(2, 5), 5), print, ret));
        ProgramTree program = program(main);

        AnalysisResult result = new StaticAnalysis().analyze(program, new SymbolTableBuilder().build(program));
        InferredTypes types = result.types();

        assertEquals(Optional.of(BasicType.INT), types.typeOf(x));
        assertEquals(Optional.of(BasicType.INT), types.typeOf(main));
        assertEquals(Optional.of(BasicType.INT), types.typeOf(target));
        assertEquals(Optional.of(BasicType.INT), types.typeOf(one));
        assertEquals(Optional.of(BasicType.BOOL), types.typeOf(less));
        assertEquals(Optional.of(BasicType.BOOL), types.typeOf(not));
        assertEquals(Optional.of(BasicType.BOOL), types.typeOf(loop));
        assertEquals(Optional.of(BasicType.VOID), types.typeOf(unknown));
        assertEquals(Optional.of(BasicType.VOID), types.typeOf(print));
        assertEquals(Optional.of(BasicType.INT), types.typeOf(ret));
        assertEquals(Optional.empty(), types.typeOf(assignment));
        assertEquals(Optional.empty(), types.typeOf(main.body()));
    }

    @Test
    void calling_a_variable_is_typed_void() {
        // int main() { int x; x(); return 0; }
        CallTree callOnVariable = call("x", 3);
        ProgramTree program = program(function(BasicType.INT, "main", 1,
            block(1, List.of(var(BasicType.INT, "x", 2)), callOnVariable, ret(intLit(0, 4), 4))));

        AnalysisResult result = new StaticAnalysis().analyze(program, new SymbolTableBuilder().build(program));

        assertEquals(Optional.of(BasicType.VOID), result.types().typeOf(callOnVariable));
    }

    @Test
    void a_tree_is_typed_only_once() {
        InferredTypes types = new InferredTypes();
        LiteralTree literal = intLit(1, 1);
        types.set(literal, BasicType.INT);

        assertThrows(IllegalStateException.class, () -> types.set(literal, BasicType.BOOL));
        assertEquals(BasicType.INT, types.typeOrVoid(literal));
    }

    @Test
    void equal_trees_are_typed_separately() {
        InferredTypes types = new InferredTypes();
        LiteralTree first = intLit(1, 1);
        LiteralTree second = intLit(1, 1);
        types.set(first, BasicType.INT);

        assertEquals(first, second);
        assertEquals(Optional.empty(), types.typeOf(second));
        assertEquals(BasicType.VOID, types.typeOrVoid(second));
    }
}

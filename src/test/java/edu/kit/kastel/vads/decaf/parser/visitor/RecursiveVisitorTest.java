package edu.kit.kastel.vads.decaf.parser.visitor;

import edu.kit.kastel.vads.decaf.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.decaf.parser.ast.BinaryOperator;
import edu.kit.kastel.vads.decaf.parser.ast.LiteralTree;
import edu.kit.kastel.vads.decaf.parser.ast.LocationTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static edu.kit.kastel.vads.decaf.parser.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class RecursiveVisitorTest {

    private static final class Recorder implements NoOpVisitor<List<String>> {
        private final String phase;

        Recorder(String phase) {
            this.phase = phase;
        }

        @Override
        public Unit visit(AssignmentTree assignmentTree, List<String> data) {
            data.add(phase + " assign");
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(LocationTree locationTree, List<String> data) {
            data.add(phase + " " + locationTree.name());
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(LiteralTree literalTree, List<String> data) {
            data.add(phase + " " + literalTree.value());
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(BinaryOperationTree binaryOperationTree, List<String> data) {
            data.add(phase + " " + binaryOperationTree.operatorType());
            return Unit.INSTANCE;
        }
    }

    private static ProgramTree sample() {
        // int main() { x = x + 1; }
        return program(function(BasicType.INT, "main", 1, block(1,
            assign(loc("x", 2), bin(loc("x", 2), BinaryOperator.ADD, intLit(1, 2)), 2))));
    }

    @Test
    void visits_children_in_source_order_between_pre_and_post() {
        List<String> events = new ArrayList<>();
        RecursiveVisitor.<List<String>>builder()
            .preorder(new Recorder("pre"))
            .postorder(new Recorder("post"))
            .build()
            .traverse(sample(), events);

        assertEquals(List.of(
            "pre assign",
            "pre x", "post x",
            "pre +",
            "pre x", "post x",
            "pre 1", "post 1",
            "post +",
            "post assign"
        ), events);
    }

    @Test
    void calls_registered_visitors_in_registration_order() {
        List<String> events = new ArrayList<>();
        RecursiveVisitor.<List<String>>builder()
            .preorder(new Recorder("first"))
            .preorder(new Recorder("second"))
            .build()
            .traverse(intLit(7, 1), events);

        assertEquals(List.of("first 7", "second 7"), events);
    }

    @Test
    void kinds_without_callbacks_are_still_traversed() {
        List<String> events = new ArrayList<>();
        // the program, function, block and return have no callbacks, the literal below them does
        ProgramTree program = program(validMain(1));
        new RecursiveVisitor<>(List.of(new Recorder("pre")), List.of()).traverse(program, events);

        assertEquals(List.of("pre 0"), events);
    }

    @Test
    void visits_every_node_once() {
        List<String> events = new ArrayList<>();
        var walker = new RecursiveVisitor<>(List.of(new Recorder("pre")), List.<Recorder>of());
        walker.traverse(sample(), events);

        assertEquals(5, events.size());
    }
}

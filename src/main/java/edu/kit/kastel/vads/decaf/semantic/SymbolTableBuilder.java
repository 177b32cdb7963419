package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.BlockTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.IfTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.ast.StatementTree;
import edu.kit.kastel.vads.decaf.parser.ast.VarDeclTree;
import edu.kit.kastel.vads.decaf.parser.ast.WhileTree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import edu.kit.kastel.vads.decaf.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.decaf.parser.visitor.Unit;

import java.util.List;

/// Builds the symbol tables that {@link StaticAnalysis} expects to find attached to a program.
///
/// The program table holds the globals, the functions and then the built-in functions, a function
/// table its parameters, and a block table its local variables. Nothing is rejected here:
/// duplicate names are kept in declaration order so that the analysis can report them.
public class SymbolTableBuilder {

    public static final List<Symbol> BUILT_INS = List.of(
        Symbol.function("print_int", BasicType.VOID, List.of(BasicType.INT)),
        Symbol.function("print_bool", BasicType.VOID, List.of(BasicType.BOOL)),
        Symbol.function("print_str", BasicType.VOID, List.of(BasicType.STR))
    );

    public Scopes build(ProgramTree program) {
        Scopes scopes = new Scopes();
        program.accept(new Declarations(scopes), new SymbolTable());
        return scopes;
    }

    static Symbol symbolOf(VarDeclTree varDeclTree) {
        if (varDeclTree.isArray()) {
            return Symbol.array(varDeclTree.name(), varDeclTree.type(), varDeclTree.length());
        }
        return Symbol.scalar(varDeclTree.name(), varDeclTree.type());
    }

    static Symbol symbolOf(FunctionTree functionTree) {
        List<BasicType> parameterTypes = functionTree.parameters().stream()
            .map(FunctionTree.Parameter::type)
            .toList();
        return Symbol.function(functionTree.name(), functionTree.returnType(), parameterTypes);
    }

    private static final class Declarations implements NoOpVisitor<SymbolTable> {
        private final Scopes scopes;

        Declarations(Scopes scopes) {
            this.scopes = scopes;
        }

        @Override
        public Unit visit(ProgramTree programTree, SymbolTable data) {
            for (VarDeclTree variable : programTree.variables()) {
                data.insert(symbolOf(variable));
            }
            for (FunctionTree function : programTree.functions()) {
                data.insert(symbolOf(function));
            }
            // after the user's declarations, so a redeclared built-in resolves to the user's one
            BUILT_INS.forEach(data::insert);
            this.scopes.attach(programTree, data);
            for (FunctionTree function : programTree.functions()) {
                function.accept(this, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(FunctionTree functionTree, SymbolTable data) {
            SymbolTable functionScope = data.enter();
            for (FunctionTree.Parameter parameter : functionTree.parameters()) {
                functionScope.insert(Symbol.scalar(parameter.name(), parameter.type()));
            }
            this.scopes.attach(functionTree, functionScope);
            functionTree.body().accept(this, functionScope);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(BlockTree blockTree, SymbolTable data) {
            SymbolTable blockScope = data.enter();
            for (VarDeclTree variable : blockTree.variables()) {
                blockScope.insert(symbolOf(variable));
            }
            this.scopes.attach(blockTree, blockScope);
            for (StatementTree statement : blockTree.statements()) {
                statement.accept(this, blockScope);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(IfTree ifTree, SymbolTable data) {
            ifTree.thenBranch().accept(this, data);
            if (ifTree.elseBranch() != null) {
                ifTree.elseBranch().accept(this, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(WhileTree whileTree, SymbolTable data) {
            whileTree.body().accept(this, data);
            return Unit.INSTANCE;
        }
    }
}

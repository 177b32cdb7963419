package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.BlockTree;
import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.ProgramTree;
import edu.kit.kastel.vads.decaf.parser.ast.Tree;
import org.jspecify.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/// Symbol tables attached to the scope-introducing trees of one program.
/// Keys are compared by identity, so structurally equal blocks keep separate tables.
public final class Scopes {
    private final Map<Tree, SymbolTable> tables = new IdentityHashMap<>();

    public void attach(ProgramTree programTree, SymbolTable table) {
        this.tables.put(programTree, table);
    }

    public void attach(FunctionTree functionTree, SymbolTable table) {
        this.tables.put(functionTree, table);
    }

    public void attach(BlockTree blockTree, SymbolTable table) {
        this.tables.put(blockTree, table);
    }

    public @Nullable SymbolTable tableOf(Tree tree) {
        return this.tables.get(tree);
    }
}

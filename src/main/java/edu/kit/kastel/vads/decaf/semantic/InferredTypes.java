package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.Tree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/// The type inferred for each tree during one analysis. Code generation reads it afterwards.
public final class InferredTypes {
    private final Map<Tree, BasicType> types = new IdentityHashMap<>();

    void set(Tree tree, BasicType type) {
        BasicType previous = this.types.putIfAbsent(tree, type);
        if (previous != null) {
            throw new IllegalStateException("type of " + tree + " already inferred as " + previous);
        }
    }

    public Optional<BasicType> typeOf(Tree tree) {
        return Optional.ofNullable(this.types.get(tree));
    }

    /// Unresolved trees count as {@code void}, so that dependent checks keep running.
    public BasicType typeOrVoid(Tree tree) {
        return this.types.getOrDefault(tree, BasicType.VOID);
    }

    public int size() {
        return this.types.size();
    }
}

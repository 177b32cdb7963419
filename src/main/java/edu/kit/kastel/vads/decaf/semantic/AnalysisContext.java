package edu.kit.kastel.vads.decaf.semantic;

import edu.kit.kastel.vads.decaf.parser.ast.FunctionTree;
import edu.kit.kastel.vads.decaf.parser.ast.Tree;
import edu.kit.kastel.vads.decaf.parser.type.BasicType;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/// State shared by all rules during one traversal: the active scope, the enclosing function and
/// the loop nesting depth. Every change is made when a tree is entered and undone when it is left.
public final class AnalysisContext {
    private final Scopes scopes;
    private final Diagnostics diagnostics;
    private final InferredTypes types;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private @Nullable FunctionTree currentFunction;
    private int loopDepth;

    public AnalysisContext(Scopes scopes, Diagnostics diagnostics, InferredTypes types) {
        this.scopes = scopes;
        this.diagnostics = diagnostics;
        this.types = types;
    }

    public Diagnostics diagnostics() {
        return this.diagnostics;
    }

    public InferredTypes types() {
        return this.types;
    }

    public Scopes scopes() {
        return this.scopes;
    }

    void enterScope(Tree owner) {
        SymbolTable table = this.scopes.tableOf(owner);
        if (table == null) {
            // no table attached: an empty scope that still sees everything outside
            Frame enclosing = this.frames.peek();
            table = enclosing == null ? new SymbolTable() : enclosing.table().enter();
        }
        this.frames.push(new Frame(owner, table, new HashSet<>()));
    }

    void exitScope(Tree owner) {
        Frame frame = this.frames.peek();
        if (frame == null || frame.owner() != owner) {
            throw new IllegalStateException("scope of " + owner.getClass().getSimpleName()
                + " on line " + owner.line() + " is not the active one");
        }
        this.frames.pop();
    }

    public SymbolTable currentScope() {
        Frame frame = this.frames.peek();
        if (frame == null) {
            throw new IllegalStateException("no active scope");
        }
        return frame.table();
    }

    /// The outermost scope, holding globals and functions.
    public SymbolTable globalScope() {
        Frame frame = this.frames.peekLast();
        if (frame == null) {
            throw new IllegalStateException("no active scope");
        }
        return frame.table();
    }

    public @Nullable Symbol lookup(String name) {
        return currentScope().lookup(name);
    }

    /// Marks {@code name} as declared in the active scope.
    /// Returns {@code false} if an earlier declaration of the same scope already used it.
    boolean declare(String name) {
        Frame frame = this.frames.peek();
        if (frame == null) {
            throw new IllegalStateException("no active scope");
        }
        return frame.declared().add(name);
    }

    void enterFunction(FunctionTree function) {
        this.currentFunction = function;
    }

    void exitFunction() {
        this.currentFunction = null;
    }

    public @Nullable String currentFunction() {
        return this.currentFunction == null ? null : this.currentFunction.name();
    }

    /// The declared return type of the enclosing function, or {@code null} outside functions.
    public @Nullable BasicType currentReturnType() {
        return this.currentFunction == null ? null : this.currentFunction.returnType();
    }

    void enterLoop() {
        this.loopDepth++;
    }

    void exitLoop() {
        if (this.loopDepth == 0) {
            throw new IllegalStateException("left a loop that was never entered");
        }
        this.loopDepth--;
    }

    public boolean inLoop() {
        return this.loopDepth > 0;
    }

    public int loopDepth() {
        return this.loopDepth;
    }

    /// True once every scope, function and loop entered has been left again.
    public boolean isInInitialState() {
        return this.frames.isEmpty() && this.currentFunction == null && this.loopDepth == 0;
    }

    private record Frame(Tree owner, SymbolTable table, Set<String> declared) {
    }
}

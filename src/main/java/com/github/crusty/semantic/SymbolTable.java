package com.github.crusty.semantic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Stack of lexical scopes. Entering a block pushes a scope, leaving it pops; lookup walks from
 * the innermost scope outwards. The bottom scope holds the top-level declarations and may be a
 * program-wide scope shared read-only between files.
 */
public class SymbolTable {

    public record Resolution(Symbol symbol, Scope scope) {}

    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable() {
        scopes.push(new Scope(0, true));
    }

    /**
     * A table whose lookups fall back to {@code program} after the file's own top-level scope.
     */
    public SymbolTable(Scope program) {
        scopes.push(program);
        scopes.push(new Scope(program.depth() + 1, true));
    }

    public Scope enterScope() {
        return enterScope(false);
    }

    public Scope enterScope(boolean global) {
        var scope = new Scope(scopes.peek().depth() + 1, global);
        scopes.push(scope);
        return scope;
    }

    public void exitScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("cannot exit the top-level scope");
        }
        scopes.pop();
    }

    /**
     * Declares a symbol in the current scope. Returns the symbol already declared under that
     * name in the same scope, if any; the new symbol is not inserted then.
     */
    public Optional<Symbol> insert(Symbol symbol) {
        return scopes.peek().define(symbol);
    }

    public Optional<Symbol> lookup(String name) {
        return resolve(name).map(Resolution::symbol);
    }

    public Optional<Symbol> lookupInCurrentScope(String name) {
        return scopes.peek().lookupLocal(name);
    }

    /**
     * Like {@link #lookup(String)} but also returns the scope the name was found in.
     */
    public Optional<Resolution> resolve(String name) {
        for (var scope : scopes) {
            var symbol = scope.lookupLocal(name);
            if (symbol.isPresent()) {
                return Optional.of(new Resolution(symbol.get(), scope));
            }
        }
        return Optional.empty();
    }

    public int depth() {
        return scopes.peek().depth();
    }

    public Scope current() {
        return scopes.peek();
    }
}

package com.github.crusty.semantic;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * One level of the lexical scope stack. Names are unique within a scope.
 */
@RequiredArgsConstructor
@ToString(of = {"depth", "global"})
public class Scope {

    @Getter
    @Accessors(fluent = true)
    private final int depth;
    /** Top-level and namespace scopes; their symbols are never captured. */
    @Getter
    @Accessors(fluent = true)
    private final boolean global;

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    /**
     * Declares a symbol unless the name is taken. Returns the existing symbol in that case.
     */
    public Optional<Symbol> define(Symbol symbol) {
        var existing = symbols.putIfAbsent(symbol.name(), symbol);
        return Optional.ofNullable(existing);
    }

    public Optional<Symbol> lookupLocal(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }
}

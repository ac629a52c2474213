package com.github.crusty.semantic;

import com.github.crusty.error.Span;
import com.github.crusty.parser.CompilationUnit.Type;

/**
 * A declared name. {@code type} is the declared or inferred type, {@code AutoType} when it is
 * not known.
 */
public record Symbol(String name, Type type, SymbolKind kind, boolean mutable, Span span) {

    public static Symbol variable(String name, Type type, boolean mutable, Span span) {
        return new Symbol(name, type, SymbolKind.VARIABLE, mutable, span);
    }

    public boolean isValue() {
        return kind == SymbolKind.VARIABLE || kind == SymbolKind.CONST || kind == SymbolKind.FUNCTION;
    }
}

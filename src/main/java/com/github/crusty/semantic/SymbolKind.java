package com.github.crusty.semantic;

public enum SymbolKind {
    VARIABLE,
    FUNCTION,
    TYPE,
    CONST,
    MODULE
}

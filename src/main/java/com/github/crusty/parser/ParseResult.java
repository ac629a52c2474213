package com.github.crusty.parser;

import java.util.List;

import com.github.crusty.error.Diagnostic;

public record ParseResult(CompilationUnit unit, List<Diagnostic> diagnostics) {

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}

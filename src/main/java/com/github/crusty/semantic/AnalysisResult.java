package com.github.crusty.semantic;

import java.util.List;

import com.github.crusty.error.SemanticError;
import com.github.crusty.parser.CompilationUnit;

/**
 * The annotated tree, with capture sets and inferred types filled in, and every semantic error
 * found.
 */
public record AnalysisResult(CompilationUnit unit, List<SemanticError> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.github.crusty.error;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.experimental.Accessors;

public class TranslationException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final List<Diagnostic> diagnostics;

    public TranslationException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::render).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }
}

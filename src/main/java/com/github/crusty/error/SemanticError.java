package com.github.crusty.error;

import java.util.Objects;

public record SemanticError(SemanticErrorKind kind, String message, Span span) implements Diagnostic {

    @Override
    public String category() {
        return kind.name().toLowerCase().replace('_', ' ');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SemanticError other && kind == other.kind && message.equals(other.message)
                && span.sameRange(other.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, span.rangeHash());
    }
}

package com.github.crusty.error;

import java.util.Objects;

public record LexError(Kind kind, String message, Span span) implements Diagnostic {

    public enum Kind {
        UNTERMINATED_STRING,
        UNTERMINATED_COMMENT,
        INVALID_ESCAPE,
        UNEXPECTED_CHARACTER
    }

    @Override
    public String category() {
        return "lex error";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LexError other && kind == other.kind && message.equals(other.message)
                && span.sameRange(other.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, span.rangeHash());
    }
}

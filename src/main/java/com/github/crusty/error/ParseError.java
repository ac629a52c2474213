package com.github.crusty.error;

import java.util.List;
import java.util.Objects;

public record ParseError(String message, List<String> expected, String found, Span span) implements Diagnostic {

    public ParseError {
        expected = List.copyOf(expected);
    }

    @Override
    public String category() {
        return "parse error";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParseError other && message.equals(other.message) && expected.equals(other.expected)
                && found.equals(other.found) && span.sameRange(other.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, expected, found, span.rangeHash());
    }

    @Override
    public String render() {
        return category() + " at " + span.start() + ": " + message
                + " (expected " + String.join(", ", expected) + ", found " + found + ")";
    }
}

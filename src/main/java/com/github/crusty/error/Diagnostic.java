package com.github.crusty.error;

/**
 * A user-facing error record. Every diagnostic carries the span it refers to and a message;
 * parse errors additionally carry the expected-token set and the token actually found.
 */
public sealed interface Diagnostic permits LexError, ParseError, SemanticError {

    Span span();

    String message();

    String category();

    default String render() {
        return category() + " at " + span().start() + ": " + message();
    }
}

package com.github.crusty.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Unwinds a parser to its nearest synchronization point. Never escapes the parsers.
 */
public class ParseException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.render());
        this.error = error;
    }
}

package com.viffx.WhileLang.Compiler;

/**
 * Thrown by {@link ParseResult#orElseThrow()} for callers that want a failed parse as an exception.
 */
public class ParseException extends Exception {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}

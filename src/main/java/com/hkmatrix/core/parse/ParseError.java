package com.hkmatrix.core.parse;

/** Malformed, empty or ragged matrix text. */
public class ParseError extends RuntimeException {

    public ParseError(String message) {
        super(message);
    }

    public ParseError(String message, Throwable cause) {
        super(message, cause);
    }
}

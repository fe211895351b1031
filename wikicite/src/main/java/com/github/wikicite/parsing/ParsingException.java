package com.github.wikicite.parsing;

/**
 * Thrown when a document tree breaks an invariant the citation code relies on,
 * e.g. an occurrence points to a content fragment the store does not hold.
 * Authoring mistakes never end up here: those are reported as node errors.
 */
public class ParsingException extends RuntimeException {
    private static final long serialVersionUID = -8845784388792588721L;

    public ParsingException(String message) {
        super(message);
    }

    public ParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}

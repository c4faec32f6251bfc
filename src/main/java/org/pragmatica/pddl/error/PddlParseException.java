package org.pragmatica.pddl.error;

/**
 * Thrown when a document cannot be turned into a model at all.
 */
public final class PddlParseException extends RuntimeException {
    private final ParseError error;

    public PddlParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}

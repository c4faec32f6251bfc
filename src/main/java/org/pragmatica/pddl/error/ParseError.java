package org.pragmatica.pddl.error;

import org.pragmatica.pddl.tree.SourceLocation;

/**
 * Conditions that prevent a domain or problem model from being built.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * The document has no top-level {@code (define ...)} construct.
     */
    record MissingDefine(SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "Missing (define ...) at " + location;
        }
    }

    /**
     * The {@code (define ...)} construct does not start with the expected {@code (domain ...)} or
     * {@code (problem ...)} head.
     */
    record MissingHead(SourceLocation location, String expected) implements ParseError {
        @Override
        public String message() {
            return "Missing (" + expected + " ...) in (define ...) at " + location;
        }
    }
}

package org.pragmatica.pddl.parser;

/**
 * Parser configuration options.
 *
 * @param implicitParameterType type given to parameters declared without {@code - type}
 * @param captureDocumentation  attach comment blocks preceding declarations as their documentation
 */
public record ParserConfig(
    String implicitParameterType,
    boolean captureDocumentation
) {
    public static final ParserConfig DEFAULT = new ParserConfig("object", true);

    public ParserConfig {
        if (implicitParameterType == null || implicitParameterType.isBlank()) {
            throw new IllegalArgumentException("Implicit parameter type must not be blank");
        }
    }
}

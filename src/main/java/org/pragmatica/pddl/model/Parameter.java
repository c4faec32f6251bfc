package org.pragmatica.pddl.model;

/**
 * Typed parameter of a predicate, function or action.
 *
 * @param name parameter name without the leading {@code ?}
 * @param type declared type
 */
public record Parameter(String name, String type) {
    public static Parameter of(String name, String type) {
        return new Parameter(name, type);
    }

    public String toPddlString() {
        return "?" + name + " - " + type;
    }
}

package org.pragmatica.pddl.model;

/**
 * Value of a ground predicate or function in an initial state.
 */
public sealed interface VariableValue {
    /**
     * Ground variable name, e.g. {@code at r1 base}.
     */
    String variableName();

    /**
     * Name of the lifted variable, e.g. {@code at}.
     */
    default String liftedVariableName() {
        var name = variableName().trim();
        int space = name.indexOf(' ');
        return space < 0
               ? name
               : name.substring(0, space);
    }

    record Fact(String variableName, boolean value) implements VariableValue {
        public Fact negate() {
            return new Fact(variableName, !value);
        }
    }

    record Fluent(String variableName, double value) implements VariableValue {}
}

package org.pragmatica.pddl.model;

/**
 * Initial value, or a timed initial literal when {@code time} is positive.
 */
public record TimedVariableValue(double time, VariableValue value) {
    public static TimedVariableValue initial(VariableValue value) {
        return new TimedVariableValue(0, value);
    }

    public static TimedVariableValue at(double time, VariableValue value) {
        return new TimedVariableValue(time, value);
    }

    public boolean isTimed() {
        return time > 0;
    }

    public String variableName() {
        return value.variableName();
    }

    @Override
    public String toString() {
        var shown = value instanceof VariableValue.Fact fact
                    ? String.valueOf(fact.value())
                    : String.valueOf(((VariableValue.Fluent) value).value());
        return value.variableName() + "=" + shown + " @ " + time;
    }
}

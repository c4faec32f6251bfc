package org.pragmatica.pddl.model;

import org.pragmatica.pddl.tree.SyntaxNode;

/**
 * Derived predicate or function: a variable whose value follows from a condition.
 *
 * @param variable  declared head with parameters
 * @param condition node of the defining condition
 */
public record DerivedVariable(Variable variable, SyntaxNode condition) {
    public String name() {
        return variable.name();
    }
}

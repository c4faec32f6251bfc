package org.pragmatica.pddl.model;

import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.Optional;

/**
 * Entry of a {@code :constraints} section.
 */
public sealed interface Constraint {
    SyntaxNode node();

    /**
     * Constraint the parser does not interpret further.
     */
    record Plain(SyntaxNode node) implements Constraint {}

    /**
     * Condition with a name, e.g. {@code (name goal1 (at-base r1))}. Goals of ordering constraints may carry only
     * the name or only the condition.
     */
    record NamedCondition(
    SyntaxNode node,
    Optional<String> name,
    Optional<SyntaxNode> condition) implements Constraint {}

    /**
     * The successor must hold at some point after the predecessor held.
     */
    record After(
    SyntaxNode node,
    NamedCondition predecessor,
    NamedCondition successor) implements Constraint {}

    /**
     * Like {@link After}, but the successor must not hold in the same state as the predecessor.
     */
    record StrictlyAfter(
    SyntaxNode node,
    NamedCondition predecessor,
    NamedCondition successor) implements Constraint {}
}

package org.pragmatica.pddl.model;

import org.pragmatica.pddl.tree.SourceSpan;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Action, process or event declared in a domain. Clauses refer to nodes of the syntax tree; a clause
 * missing from the source is empty.
 */
public sealed interface Action {
    Optional<String> name();

    List<Parameter> parameters();

    /**
     * The whole {@code (:action ...)} bracket.
     */
    SyntaxNode node();

    SourceSpan span();

    List<String> documentation();

    Optional<SyntaxNode> effect();

    default String nameOrEmpty() {
        return name().orElse("");
    }

    default boolean isDurative() {
        return this instanceof DurativeAction;
    }

    record InstantAction(
    Optional<String> name,
    List<Parameter> parameters,
    Optional<SyntaxNode> precondition,
    Optional<SyntaxNode> effect,
    SyntaxNode node,
    SourceSpan span,
    List<String> documentation) implements Action {
        public InstantAction {
            parameters = List.copyOf(parameters);
            documentation = List.copyOf(documentation);
        }
    }

    record DurativeAction(
    Optional<String> name,
    List<Parameter> parameters,
    Optional<SyntaxNode> duration,
    Optional<SyntaxNode> condition,
    Optional<SyntaxNode> effect,
    SyntaxNode node,
    SourceSpan span,
    List<String> documentation) implements Action {
        public DurativeAction {
            parameters = List.copyOf(parameters);
            documentation = List.copyOf(documentation);
        }
    }
}

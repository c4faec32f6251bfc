package org.pragmatica.pddl.model;

import org.pragmatica.pddl.tree.SyntaxNode;

/**
 * Named {@code (supply-demand ...)} contract of a problem's initial state.
 */
public record SupplyDemand(String name, SyntaxNode node) {}

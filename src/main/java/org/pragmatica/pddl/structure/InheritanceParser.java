package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.InheritanceGraph;
import org.pragmatica.pddl.parser.SyntaxTreeBuilder;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses type and object declaration lists such as {@code truck car - vehicle place}.
 *
 * <p>Names are collected until a dash; the name after the dash becomes the parent of all of them. Names
 * not followed by a dash are declared without a parent. {@code (either a b)} after a dash gives every
 * collected name both parents.
 */
public final class InheritanceParser {
    private InheritanceParser() {}

    /**
     * Parse the declarations of a {@code :types}, {@code :constants} or {@code :objects} section.
     */
    public static InheritanceGraph parse(SyntaxNode section) {
        return parse(PddlStructure.significantChildren(section));
    }

    /**
     * Parse a declaration list given as text.
     */
    public static InheritanceGraph parse(String declarations) {
        return parse(PddlStructure.significantChildren(SyntaxTreeBuilder.build(declarations)
                                                                         .tree()
                                                                         .root()));
    }

    /**
     * Parse a flat sequence of declaration nodes; whitespace and comments must already be left out.
     */
    public static InheritanceGraph parse(List<SyntaxNode> declarations) {
        var graph = InheritanceGraph.builder();
        declare(graph, declarations);
        return graph.build();
    }

    /**
     * Parse several sections into one graph. Names left without a parent at the end of a section stay without one.
     */
    public static InheritanceGraph parseSections(List<SyntaxNode> sections) {
        var graph = InheritanceGraph.builder();
        sections.forEach(section -> declare(graph, PddlStructure.significantChildren(section)));
        return graph.build();
    }

    private static void declare(InheritanceGraph.Builder graph, List<SyntaxNode> declarations) {
        var pending = new ArrayList<String>();
        boolean expectParent = false;
        for (var node : declarations) {
            if (node.isType(TokenKind.DASH)) {
                expectParent = true;
                continue;
            }
            if (expectParent) {
                expectParent = false;
                var parents = parentsOf(node);
                for (var child : pending) {
                    graph.vertex(child);
                    parents.forEach(parent -> graph.edge(child, parent));
                }
                if (!pending.isEmpty()) {
                    parents.forEach(graph::vertex);
                }
                pending.clear();
                continue;
            }
            if (node.isType(TokenKind.OTHER)) {
                pending.add(node.token()
                                .text());
            }
        }
        pending.forEach(graph::vertex);
    }

    private static List<String> parentsOf(SyntaxNode node) {
        if (node.isType(TokenKind.OTHER)) {
            return List.of(node.token()
                               .text());
        }
        if (node.kind()
                .isOpenBracket()) {
            var names = PddlStructure.significantChildren(node)
                                     .stream()
                                     .filter(child -> child.isType(TokenKind.OTHER))
                                     .map(child -> child.token()
                                                        .text())
                                     .toList();
            if (!names.isEmpty() && names.get(0)
                                         .equalsIgnoreCase("either")) {
                return names.subList(1, names.size());
            }
        }
        return List.of();
    }
}

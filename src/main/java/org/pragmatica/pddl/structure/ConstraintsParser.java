package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.Constraint;
import org.pragmatica.pddl.model.Constraint.NamedCondition;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the entries of a {@code :constraints} section.
 *
 * <p>Recognised forms are {@code (name n (condition))} (also spelled {@code named-condition} or
 * {@code state-satisfying}), {@code (after a b)} and {@code (strictly-after a b)}, where each goal is a name
 * or a condition. Anything else is kept as a {@link Constraint.Plain} constraint. A malformed recognised form
 * is dropped. A top-level {@code (and ...)} is flattened.
 */
public final class ConstraintsParser {
    private static final Logger log = LoggerFactory.getLogger(ConstraintsParser.class);
    private static final Pattern AND = Pattern.compile("^\\(\\s*and$", Pattern.CASE_INSENSITIVE);

    private ConstraintsParser() {}

    public static List<Constraint> parse(SyntaxNode constraintsNode) {
        var children = bracketsOf(constraintsNode);
        while (!children.isEmpty() && isAnd(children.get(0))) {
            children = bracketsOf(children.get(0));
        }
        return children.stream()
                       .map(ConstraintsParser::parseConstraint)
                       .flatMap(Optional::stream)
                       .toList();
    }

    private static List<SyntaxNode> bracketsOf(SyntaxNode node) {
        return node.nonWhitespaceChildren()
                   .stream()
                   .filter(child -> child.kind()
                                         .isOpenBracket())
                   .toList();
    }

    private static boolean isAnd(SyntaxNode node) {
        return node.isType(TokenKind.OPEN_BRACKET_OPERATOR) && AND.matcher(node.token()
                                                                             .text())
                                                                   .matches();
    }

    private static Optional<Constraint> parseConstraint(SyntaxNode node) {
        var children = PddlStructure.significantChildren(node);
        if (children.isEmpty() || !children.get(0)
                                           .isType(TokenKind.OTHER)) {
            return Optional.of(new Constraint.Plain(node));
        }
        var arguments = children.subList(1, children.size());
        var head = children.get(0)
                           .text()
                           .toLowerCase(Locale.ROOT);
        Optional<Constraint> constraint = switch (head) {
            case "name", "named-condition", "state-satisfying" -> namedCondition(node, arguments).map(Constraint.class::cast);
            case "after" -> goals(arguments).map(pair -> new Constraint.After(node, pair.get(0), pair.get(1)));
            case "strictly-after" -> goals(arguments).map(pair -> new Constraint.StrictlyAfter(node,
                                                                                                 pair.get(0),
                                                                                                 pair.get(1)));
            default -> Optional.of(new Constraint.Plain(node));
        };
        if (constraint.isEmpty()) {
            log.debug("Skipping malformed '{}' constraint at offset {}", head, node.start());
        }
        return constraint;
    }

    private static Optional<NamedCondition> namedCondition(SyntaxNode node, List<SyntaxNode> arguments) {
        if (arguments.size() < 2 || !arguments.get(0)
                                              .isType(TokenKind.OTHER) || !arguments.get(1)
                                                                                    .kind()
                                                                                    .isOpenBracket()) {
            return Optional.empty();
        }
        return Optional.of(new NamedCondition(node, Optional.of(arguments.get(0)
                                                                         .text()), Optional.of(arguments.get(1))));
    }

    private static Optional<List<NamedCondition>> goals(List<SyntaxNode> arguments) {
        if (arguments.size() < 2) {
            return Optional.empty();
        }
        var predecessor = goal(arguments.get(0));
        var successor = goal(arguments.get(1));
        if (predecessor.isEmpty() || successor.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(List.of(predecessor.get(), successor.get()));
    }

    private static Optional<NamedCondition> goal(SyntaxNode node) {
        if (node.isType(TokenKind.OTHER)) {
            return Optional.of(new NamedCondition(node, Optional.of(node.text()), Optional.empty()));
        }
        if (node.kind()
                .isOpenBracket()) {
            return Optional.of(new NamedCondition(node, Optional.empty(), Optional.of(node)));
        }
        return Optional.empty();
    }
}

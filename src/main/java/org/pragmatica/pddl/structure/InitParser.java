package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.SupplyDemand;
import org.pragmatica.pddl.model.TimedVariableValue;
import org.pragmatica.pddl.model.VariableValue;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the {@code :init} section of a problem: facts {@code (at r1 base)}, negated facts
 * {@code (not (busy r1))}, numeric values {@code (= (fuel r1) 10)}, timed initial literals
 * {@code (at 10 (open shop))} and {@code (supply-demand ...)} contracts. Entries of any other shape are skipped.
 */
public final class InitParser {
    private static final Pattern AT = Pattern.compile("^\\(\\s*at$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EQUALS = Pattern.compile("^\\(\\s*=$");
    private static final Pattern NOT = Pattern.compile("^\\(\\s*not$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUPPLY_DEMAND = Pattern.compile("^\\(\\s*supply-demand", Pattern.CASE_INSENSITIVE);

    private InitParser() {}

    public static List<TimedVariableValue> values(SyntaxNode initNode) {
        return initNode.nestedChildren()
                       .stream()
                       .filter(node -> node.kind()
                                           .isOpenBracket())
                       .filter(node -> !matches(node, SUPPLY_DEMAND))
                       .map(InitParser::timedValue)
                       .flatMap(Optional::stream)
                       .toList();
    }

    public static List<SupplyDemand> supplyDemands(SyntaxNode initNode) {
        return initNode.childrenOfType(TokenKind.OPEN_BRACKET_OPERATOR, SUPPLY_DEMAND)
                       .stream()
                       .map(InitParser::supplyDemand)
                       .flatMap(Optional::stream)
                       .toList();
    }

    private static Optional<TimedVariableValue> timedValue(SyntaxNode bracket) {
        if (matches(bracket, AT)) {
            var children = PddlStructure.significantChildren(bracket);
            if (children.size() > 1 && PddlStructure.isNumber(children.get(0)
                                                                      .text())) {
                double time = Double.parseDouble(children.get(0)
                                                         .text());
                return variableValue(children.get(1)).map(value -> TimedVariableValue.at(time, value));
            }
        }
        return variableValue(bracket).map(TimedVariableValue::initial);
    }

    private static Optional<VariableValue> variableValue(SyntaxNode node) {
        if (!node.kind()
                 .isOpenBracket()) {
            return Optional.empty();
        }
        if (matches(node, EQUALS)) {
            var children = PddlStructure.significantChildren(node);
            if (children.size() > 1 && children.get(0)
                                               .kind()
                                               .isOpenBracket() && PddlStructure.isNumber(children.get(1)
                                                                                                  .text())) {
                return Optional.of(new VariableValue.Fluent(PddlStructure.declaration(children.get(0)),
                                                            Double.parseDouble(children.get(1)
                                                                                       .text())));
            }
            return Optional.empty();
        }
        if (matches(node, NOT)) {
            return node.firstChild(child -> child.kind()
                                                 .isOpenBracket())
                       .flatMap(InitParser::fact)
                       .<VariableValue>map(VariableValue.Fact::negate);
        }
        return fact(node).map(VariableValue.class::cast);
    }

    private static Optional<VariableValue.Fact> fact(SyntaxNode node) {
        if (node.nestedChildren()
                .stream()
                .anyMatch(child -> child.kind()
                                        .isOpenBracket())) {
            return Optional.empty();
        }
        return Optional.of(new VariableValue.Fact(PddlStructure.declaration(node), true));
    }

    private static Optional<SupplyDemand> supplyDemand(SyntaxNode node) {
        var children = PddlStructure.significantChildren(node);
        if (children.isEmpty() || !children.get(0)
                                           .isType(TokenKind.OTHER)) {
            return Optional.empty();
        }
        return Optional.of(new SupplyDemand(children.get(0)
                                                    .text(), node));
    }

    private static boolean matches(SyntaxNode node, Pattern pattern) {
        return node.isType(TokenKind.OPEN_BRACKET_OPERATOR) && pattern.matcher(node.token()
                                                                                   .text())
                                                                      .find();
    }
}

package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.model.DerivedVariable;
import org.pragmatica.pddl.model.Variable;
import org.pragmatica.pddl.parser.ParserConfig;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Parses {@code (:derived (name ?p - type) (condition))}.
 */
public final class DerivedVariableParser {
    private DerivedVariableParser() {}

    /**
     * @return the derived variable, or empty if the node does not consist of a head and a condition
     */
    public static Optional<DerivedVariable> parse(SyntaxNode node, PositionResolver resolver, ParserConfig config) {
        var children = PddlStructure.significantChildren(node);
        if (children.size() != 2 || !children.get(0)
                                             .kind()
                                             .isOpenBracket()) {
            return Optional.empty();
        }
        var head = children.get(0);
        var variable = new Variable(PddlStructure.declaration(head),
                                    ParametersParser.parse(head, config.implicitParameterType()),
                                    resolver.spanOf(node),
                                    config.captureDocumentation()
                                    ? Documentation.above(node)
                                    : List.of());
        return Optional.of(new DerivedVariable(variable, children.get(1)));
    }
}

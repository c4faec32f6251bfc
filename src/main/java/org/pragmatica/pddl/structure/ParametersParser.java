package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.Parameter;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses typed parameter lists such as {@code ?from ?to - location ?v - vehicle}.
 */
public final class ParametersParser {
    private ParametersParser() {}

    /**
     * Parse the parameters among the children of the node. Parameters not followed by {@code - type}
     * get the implicit type.
     */
    public static List<Parameter> parse(SyntaxNode node, String implicitType) {
        var parameters = new ArrayList<Parameter>();
        var pending = new ArrayList<String>();
        boolean expectType = false;
        for (var child : PddlStructure.significantChildren(node)) {
            if (child.isType(TokenKind.PARAMETER)) {
                expectType = false;
                pending.add(child.token()
                                 .text()
                                 .substring(1));
            } else if (child.isType(TokenKind.DASH)) {
                expectType = true;
            } else if (expectType) {
                var type = child.isType(TokenKind.OTHER)
                           ? child.token()
                                  .text()
                           : PddlStructure.declaration(child);
                pending.forEach(name -> parameters.add(Parameter.of(name, type)));
                pending.clear();
                expectType = false;
            }
        }
        pending.forEach(name -> parameters.add(Parameter.of(name, implicitType)));
        return parameters;
    }
}

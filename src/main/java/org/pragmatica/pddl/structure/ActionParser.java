package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.Action.DurativeAction;
import org.pragmatica.pddl.model.Action.InstantAction;
import org.pragmatica.pddl.model.Parameter;
import org.pragmatica.pddl.parser.ParserConfig;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses {@code (:action ...)}, {@code (:process ...)}, {@code (:event ...)} and {@code (:durative-action ...)}.
 *
 * <p>A clause missing from the source leaves the corresponding field empty; the action is produced anyway so
 * that partially typed text can still be navigated.
 */
public final class ActionParser {
    private static final Pattern NAME = Pattern.compile("[\\w-]+");

    private ActionParser() {}

    /**
     * <pre>
     * (:action name
     *     :parameters (&lt;parameters&gt;)
     *     :precondition (&lt;condition&gt;)
     *     :effect (&lt;effect&gt;))
     * </pre>
     */
    public static InstantAction instant(SyntaxNode node, PositionResolver resolver, ParserConfig config) {
        return new InstantAction(name(node),
                                 parameters(node, config),
                                 node.keywordOpenBracket("precondition"),
                                 node.keywordOpenBracket("effect"),
                                 node,
                                 resolver.spanOf(node),
                                 documentation(node, config));
    }

    /**
     * <pre>
     * (:durative-action name
     *     :parameters (&lt;parameters&gt;)
     *     :duration (&lt;duration constraint&gt;)
     *     :condition (&lt;timed condition&gt;)
     *     :effect (&lt;timed effect&gt;))
     * </pre>
     */
    public static DurativeAction durative(SyntaxNode node, PositionResolver resolver, ParserConfig config) {
        return new DurativeAction(name(node),
                                  parameters(node, config),
                                  node.keywordOpenBracket("duration"),
                                  node.keywordOpenBracket("condition"),
                                  node.keywordOpenBracket("effect"),
                                  node,
                                  resolver.spanOf(node),
                                  documentation(node, config));
    }

    private static Optional<String> name(SyntaxNode node) {
        return node.firstChild(TokenKind.OTHER, NAME)
                   .map(SyntaxNode::text);
    }

    private static List<Parameter> parameters(SyntaxNode node, ParserConfig config) {
        return node.keywordOpenBracket("parameters")
                   .map(parameters -> ParametersParser.parse(parameters, config.implicitParameterType()))
                   .orElse(List.of());
    }

    private static List<String> documentation(SyntaxNode node, ParserConfig config) {
        return config.captureDocumentation()
               ? Documentation.above(node)
               : List.of();
    }
}

package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.Variable;
import org.pragmatica.pddl.parser.ParserConfig;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the declarations of a {@code :predicates} or {@code :functions} section.
 *
 * <p>The section is split into chunks, one per declaration: a chunk ends at the first line break after a
 * declaration bracket, and an empty line discards the pending chunk. Comments in a chunk (on the lines above
 * the declaration or to the right of it) become its documentation.
 */
public final class VariablesParser {
    private final PositionResolver resolver;
    private final ParserConfig config;
    private final List<List<SyntaxNode>> chunks = new ArrayList<>();
    private List<SyntaxNode> current = new ArrayList<>();
    private boolean declarationSeen;
    private int consecutiveLineBreaks;

    private VariablesParser(PositionResolver resolver, ParserConfig config) {
        this.resolver = resolver;
        this.config = config;
    }

    public static List<Variable> parse(SyntaxNode section, PositionResolver resolver, ParserConfig config) {
        var parser = new VariablesParser(resolver, config);
        parser.chunk(section);
        return parser.chunks.stream()
                            .map(parser::variablesOf)
                            .flatMap(List::stream)
                            .toList();
    }

    private void chunk(SyntaxNode section) {
        for (var node : section.nestedChildren()) {
            if (node.isType(TokenKind.WHITESPACE)) {
                int lineBreaks = Documentation.lineBreaks(node.text());
                if (lineBreaks > 0 && declarationSeen) {
                    flush();
                }
                consecutiveLineBreaks += lineBreaks;
                if (consecutiveLineBreaks >= 2) {
                    reset();
                }
                continue;
            }
            consecutiveLineBreaks = 0;
            if (node.kind()
                    .isOpenBracket()) {
                declarationSeen = true;
            }
            current.add(node);
        }
        if (!current.isEmpty()) {
            flush();
        }
    }

    private void flush() {
        chunks.add(current);
        reset();
    }

    private void reset() {
        current = new ArrayList<>();
        declarationSeen = false;
        consecutiveLineBreaks = 0;
    }

    /**
     * Declarations of one chunk. Several declarations on one line share the chunk's documentation.
     */
    private List<Variable> variablesOf(List<SyntaxNode> chunk) {
        var documentation = config.captureDocumentation()
                            ? chunk.stream()
                                   .filter(node -> node.isType(TokenKind.COMMENT))
                                   .map(Documentation::commentText)
                                   .toList()
                            : List.<String>of();
        return chunk.stream()
                    .filter(node -> node.kind()
                                        .isOpenBracket())
                    .map(declaration -> new Variable(PddlStructure.declaration(declaration),
                                                     ParametersParser.parse(declaration,
                                                                            config.implicitParameterType()),
                                                     resolver.spanOf(declaration),
                                                     documentation))
                    .toList();
    }
}

package org.pragmatica.pddl.parser;

import org.pragmatica.pddl.error.Diagnostic;
import org.pragmatica.pddl.lexer.Token;
import org.pragmatica.pddl.tree.LinePositionResolver;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SyntaxTree;

import java.util.List;

/**
 * Result of building a syntax tree: the tree itself and the close brackets that had no open bracket to match.
 *
 * @param tree            syntax tree covering the parsed text
 * @param offendingTokens unmatched close brackets in source order
 */
public record SyntaxTreeResult(SyntaxTree tree, List<Token> offendingTokens) {
    public static final String UNMATCHED_BRACKET_CODE = "P0001";

    public boolean hasErrors() {
        return !offendingTokens.isEmpty();
    }

    /**
     * One error diagnostic per unmatched close bracket.
     */
    public List<Diagnostic> diagnostics(PositionResolver resolver) {
        return offendingTokens.stream()
                              .map(token -> Diagnostic.error(UNMATCHED_BRACKET_CODE,
                                                             "unmatched close bracket",
                                                             resolver.resolveToSpan(token.start(), token.end()))
                                                      .withLabel("no open bracket to close")
                                                      .withHelp("remove the bracket or add the missing '('"))
                              .toList();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics(LinePositionResolver.of(tree.source()));
    }

    /**
     * Render all diagnostics, separated by empty lines. Returns an empty string if there are none.
     */
    public String formatDiagnostics(String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics()) {
            sb.append(diagnostic.format(tree.source(), filename))
              .append("\n");
        }
        return sb.toString();
    }
}

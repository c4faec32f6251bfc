package org.pragmatica.pddl.parser;

import org.pragmatica.pddl.lexer.PddlLexer;
import org.pragmatica.pddl.lexer.Token;
import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SyntaxTree} from the PDDL token stream.
 *
 * <p>The builder never fails on malformed input. Keywords implicitly end the previous keyword section,
 * unclosed brackets simply extend to the last token, and close brackets without a matching open bracket
 * are reported as offending tokens while still being kept in the tree, so every offset of the input
 * resolves to a node.
 */
public final class SyntaxTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeBuilder.class);
    private static final int NO_CUTOFF = Integer.MAX_VALUE;

    private final SyntaxTree.Arena arena = SyntaxTree.arena();
    private final List<Token> offendingTokens = new ArrayList<>();
    private final int cutoff;
    private int cursor;

    private SyntaxTreeBuilder(int cutoff) {
        this.cutoff = cutoff;
        this.cursor = arena.root();
    }

    /**
     * Build the tree of the whole text.
     */
    public static SyntaxTreeResult build(String text) {
        var builder = new SyntaxTreeBuilder(NO_CUTOFF);
        PddlLexer.tokenize(text, builder::onToken);
        return builder.result(text);
    }

    /**
     * Build the tree of the text up to the cutoff offset, e.g. the caret position during code completion.
     *
     * @throws IllegalArgumentException if the cutoff is negative
     */
    public static SyntaxTreeResult build(String text, int cutoff) {
        var builder = new SyntaxTreeBuilder(cutoff);
        PddlLexer.tokenize(text, cutoff, builder::onToken);
        return builder.result(text);
    }

    private SyntaxTreeResult result(String text) {
        return new SyntaxTreeResult(arena.build(text), List.copyOf(offendingTokens));
    }

    private void onToken(Token token) {
        if (token.start() > cutoff) {
            return;
        }
        switch (token.kind()) {
            case KEYWORD -> {
                closeKeyword();
                addChild(token);
            }
            case CLOSE_BRACKET -> closeBracket(token);
            default -> {
                if (inLeaf()) {
                    cursor = arena.parent(cursor);
                }
                addChild(token);
            }
        }
    }

    private void addChild(Token token) {
        cursor = arena.add(token, cursor);
    }

    private boolean inLeaf() {
        return arena.token(cursor)
                    .kind()
                    .isLeaf();
    }

    /**
     * Walk up to the enclosing keyword section and step out of it. Stops at an open bracket or the root.
     */
    private void closeKeyword() {
        while (!arena.isRoot(cursor)) {
            var kind = arena.token(cursor)
                            .kind();
            if (kind == TokenKind.KEYWORD) {
                cursor = arena.parent(cursor);
                return;
            }
            if (kind.isOpenBracket()) {
                return;
            }
            cursor = arena.parent(cursor);
        }
    }

    private void closeBracket(Token token) {
        int node = cursor;
        while (!arena.isRoot(node)) {
            if (arena.token(node)
                     .kind()
                     .isOpenBracket()) {
                arena.close(node, token);
                cursor = arena.parent(node);
                return;
            }
            node = arena.parent(node);
        }
        log.debug("Unmatched close bracket at offset {}", token.start());
        offendingTokens.add(token);
        int container = cursor;
        while (arena.token(container)
                    .kind()
                    .isLeaf()) {
            container = arena.parent(container);
        }
        arena.add(token, container);
    }
}

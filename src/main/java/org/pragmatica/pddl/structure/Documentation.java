package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Comments used as documentation of the declarations they precede.
 */
final class Documentation {
    private Documentation() {}

    /**
     * Collect the block of comment lines directly above the node. An empty line or a comment trailing code on
     * its line ends the block.
     */
    static List<String> above(SyntaxNode node) {
        var siblings = node.precedingSiblings();
        var lines = new ArrayList<String>();
        for (int i = siblings.size() - 1; i >= 0; i--) {
            var sibling = siblings.get(i);
            if (sibling.isType(TokenKind.WHITESPACE)) {
                if (lineBreaks(sibling.text()) > 1) {
                    break;
                }
                continue;
            }
            if (!sibling.isType(TokenKind.COMMENT) || !startsLine(siblings, i)) {
                break;
            }
            lines.add(0, commentText(sibling));
        }
        return lines;
    }

    /**
     * A comment trailing code on the same line documents that code, not the node below it.
     */
    private static boolean startsLine(List<SyntaxNode> siblings, int index) {
        if (index == 0) {
            return siblings.get(0)
                           .parent()
                           .map(SyntaxNode::isDocument)
                           .orElse(true);
        }
        var previous = siblings.get(index - 1);
        return previous.isType(TokenKind.WHITESPACE) && lineBreaks(previous.text()) > 0;
    }

    static String commentText(SyntaxNode comment) {
        return comment.text()
                      .replaceFirst("^;+", "")
                      .trim();
    }

    static int lineBreaks(String whitespace) {
        int count = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            if (whitespace.charAt(i) == '\n') {
                count++ ;
            }
        }
        return count;
    }
}

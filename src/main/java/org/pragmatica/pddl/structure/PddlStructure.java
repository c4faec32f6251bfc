package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.tree.SyntaxNode;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Section keywords and small helpers shared by the structural parsers.
 */
public final class PddlStructure {
    public static final String DEFINE = "define";
    public static final String DOMAIN = "domain";
    public static final String PROBLEM = "problem";
    public static final String DOMAIN_REFERENCE = ":domain";
    public static final String REQUIREMENTS = ":requirements";
    public static final String TYPES = ":types";
    public static final String CONSTANTS = ":constants";
    public static final String PREDICATES = ":predicates";
    public static final String FUNCTIONS = ":functions";
    public static final String DERIVED = ":derived";
    public static final String ACTION = ":action";
    public static final String DURATIVE_ACTION = ":durative-action";
    public static final String PROCESS = ":process";
    public static final String EVENT = ":event";
    public static final String CONSTRAINTS = ":constraints";
    public static final String OBJECTS = ":objects";
    public static final String INIT = ":init";
    public static final String GOAL = ":goal";

    private static final Pattern NUMBER = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PddlStructure() {}

    /**
     * Nested children without whitespace and comments.
     */
    public static List<SyntaxNode> significantChildren(SyntaxNode node) {
        return node.nonWhitespaceChildren()
                   .stream()
                   .filter(child -> !child.isType(TokenKind.COMMENT))
                   .toList();
    }

    /**
     * Bracket content as a single-spaced declaration: {@code (at  ?r - robot)} gives {@code at ?r - robot}.
     * Comments are left out.
     */
    public static String declaration(SyntaxNode bracket) {
        var head = bracket.token()
                          .text()
                          .substring(1);
        return WHITESPACE.matcher(head + bracket.nestedNonCommentText())
                         .replaceAll(" ")
                         .trim();
    }

    public static boolean isNumber(String text) {
        return NUMBER.matcher(text)
                     .matches();
    }
}

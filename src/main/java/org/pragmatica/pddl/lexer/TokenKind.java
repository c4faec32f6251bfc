package org.pragmatica.pddl.lexer;

/**
 * Kinds of PDDL tokens.
 */
public enum TokenKind {
    /**
     * Open bracket immediately followed by an operator or keyword, e.g. {@code (define}, {@code (:action}, {@code (increase}.
     */
    OPEN_BRACKET_OPERATOR,

    /**
     * Plain open bracket {@code (}.
     */
    OPEN_BRACKET,

    /**
     * Close bracket {@code )}.
     */
    CLOSE_BRACKET,

    /**
     * Keyword, e.g. {@code :parameters} or {@code :effect}.
     */
    KEYWORD,

    /**
     * Dash separating declared names from their type.
     */
    DASH,

    /**
     * Parameter name, e.g. {@code ?p1}.
     */
    PARAMETER,

    /**
     * Anything after {@code ;} up to the end of the line, including the semicolon.
     */
    COMMENT,

    /**
     * Vertical or horizontal whitespace.
     */
    WHITESPACE,

    /**
     * Bareword, number or any unclassified text.
     */
    OTHER,

    /**
     * Synthetic kind of the syntax tree root.
     */
    DOCUMENT;

    public boolean isOpenBracket() {
        return this == OPEN_BRACKET_OPERATOR || this == OPEN_BRACKET;
    }

    /**
     * Leaf kinds never own child nodes in the syntax tree.
     */
    public boolean isLeaf() {
        return switch (this) {
            case COMMENT, OTHER, PARAMETER, DASH, WHITESPACE, CLOSE_BRACKET -> true;
            default -> false;
        };
    }
}

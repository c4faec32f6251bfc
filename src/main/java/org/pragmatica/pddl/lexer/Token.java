package org.pragmatica.pddl.lexer;

/**
 * PDDL token covering the source range from {@code start} (inclusive) to {@code end} (exclusive).
 *
 * @param kind  token kind
 * @param text  exact source text of the token
 * @param start offset of the first character
 * @param end   offset just after the last character
 */
public record Token(TokenKind kind, String text, int start, int end) {

    public static Token of(TokenKind kind, String text, int start) {
        return new Token(kind, text, start, start + text.length());
    }

    public static Token document() {
        return new Token(TokenKind.DOCUMENT, "", 0, 0);
    }

    public int length() {
        return end - start;
    }

    /**
     * Offsets are included up to and including {@code end}, so the position just after the token still hits it.
     */
    public boolean includes(int offset) {
        return offset >= start && offset <= end;
    }

    @Override
    public String toString() {
        return kind + "('" + text.replace("\r", "\\r").replace("\n", "\\n") + "')@" + start + "~" + end;
    }
}

package org.pragmatica.pddl.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for PDDL domain and problem text.
 *
 * <p>Tokens are reported left to right and cover the input without gaps: concatenating the text of all
 * reported tokens reproduces the input. Characters no rule recognizes are reported as {@link TokenKind#OTHER}.
 */
public final class PddlLexer {
    private static final int NO_CUTOFF = Integer.MAX_VALUE;

    private static final Pattern OPERATOR = Pattern.compile(
        "\\(\\s*(?:"
        + "(?::\\w[\\w-]*"
        + "|at\\s+start|at\\s+end|over\\s+all"
        + "|define|domain|problem|and|or|not|imply|at|assign|increase|decrease|scale-up|scale-down"
        + "|always|sometime|sometime-before|sometime-after|always-within|at-most-once|within"
        + "|hold-during|hold-after|forall|exists|when|preference|supply-demand"
        + ")(?![\\w-])"
        + "|(?:[-/+*]|[<>]=?|=)(?!-))",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+");

    private final String input;
    private final int cutoff;
    private final Consumer<Token> callback;
    private final Matcher operatorMatcher;
    private final Matcher numberMatcher;
    private int pos;
    private int gapStart;
    private boolean stopped;

    private PddlLexer(String input, int cutoff, Consumer<Token> callback) {
        this.input = input;
        this.cutoff = cutoff;
        this.callback = callback;
        this.operatorMatcher = OPERATOR.matcher(input);
        this.numberMatcher = NUMBER.matcher(input);
        this.pos = 0;
        this.gapStart = -1;
        this.stopped = false;
    }

    /**
     * Tokenize the whole input.
     */
    public static void tokenize(String input, Consumer<Token> callback) {
        new PddlLexer(input, NO_CUTOFF, callback).run();
    }

    /**
     * Tokenize the input until the token that passes {@code cutoff} was reported.
     *
     * @param input    PDDL text
     * @param cutoff   last offset of interest
     * @param callback receives each token in source order
     */
    public static void tokenize(String input, int cutoff, Consumer<Token> callback) {
        if (cutoff < 0) {
            throw new IllegalArgumentException("Cutoff offset must not be negative: " + cutoff);
        }
        new PddlLexer(input, cutoff, callback).run();
    }

    /**
     * Tokenize the whole input into a list.
     */
    public static List<Token> tokenize(String input) {
        var tokens = new ArrayList<Token>();
        tokenize(input, tokens::add);
        return tokens;
    }

    private void run() {
        while (!isAtEnd() && !stopped) {
            int start = pos;
            var kind = scan();
            if (kind == null) {
                if (gapStart < 0) {
                    gapStart = start;
                }
                pos = start + 1;
                continue;
            }
            flushGap(start);
            if (!stopped) {
                emit(kind, start);
            }
        }
        if (!stopped) {
            flushGap(pos);
        }
    }

    /**
     * Scan one token at the current position. Returns {@code null} and leaves the position unchanged
     * when no rule matches.
     */
    private TokenKind scan() {
        char c = peek();
        if (c == '(') {
            return scanOpenBracket();
        }
        if (c == ')') {
            advance();
            return TokenKind.CLOSE_BRACKET;
        }
        if (c == ':') {
            return scanPrefixedName(TokenKind.KEYWORD, false);
        }
        if (c == '?') {
            return scanPrefixedName(TokenKind.PARAMETER, true);
        }
        if (c == ';') {
            return scanComment();
        }
        if (lookingAt(numberMatcher)) {
            pos = numberMatcher.end();
            skipNameParts();
            return TokenKind.OTHER;
        }
        if (c == '-') {
            advance();
            return TokenKind.DASH;
        }
        if (c == '#' && pos + 1 < input.length() && input.charAt(pos + 1) == 't') {
            pos += 2;
            return TokenKind.OTHER;
        }
        if (isWordChar(c)) {
            skipNameParts();
            return TokenKind.OTHER;
        }
        if (Character.isWhitespace(c)) {
            while (!isAtEnd() && Character.isWhitespace(peek())) {
                advance();
            }
            return TokenKind.WHITESPACE;
        }
        return null;
    }

    private TokenKind scanOpenBracket() {
        if (lookingAt(operatorMatcher)) {
            pos = operatorMatcher.end();
            return TokenKind.OPEN_BRACKET_OPERATOR;
        }
        advance();
        return TokenKind.OPEN_BRACKET;
    }

    private TokenKind scanPrefixedName(TokenKind kind, boolean wordStartRequired) {
        if (pos + 1 >= input.length()) {
            return null;
        }
        char first = input.charAt(pos + 1);
        if (!isWordChar(first) && (wordStartRequired || first != '-')) {
            return null;
        }
        advance();
        skipNameParts();
        return kind;
    }

    private TokenKind scanComment() {
        int lineBreak = input.indexOf('\n', pos);
        int end = lineBreak < 0
                  ? input.length()
                  : lineBreak;
        // a CRLF line break is not part of the comment
        if (lineBreak > pos && input.charAt(lineBreak - 1) == '\r') {
            end = lineBreak - 1;
        }
        pos = Math.max(end, pos + 1);
        return TokenKind.COMMENT;
    }

    private void flushGap(int end) {
        if (gapStart >= 0) {
            int start = gapStart;
            gapStart = -1;
            emit(TokenKind.OTHER, start, end);
        }
    }

    private void emit(TokenKind kind, int start) {
        emit(kind, start, pos);
    }

    private void emit(TokenKind kind, int start, int end) {
        var token = new Token(kind, input.substring(start, end), start, end);
        callback.accept(token);
        if (token.end() > cutoff) {
            stopped = true;
        }
    }

    private boolean lookingAt(Matcher matcher) {
        matcher.region(pos, input.length());
        return matcher.lookingAt();
    }

    private void skipNameParts() {
        while (!isAtEnd() && (isWordChar(peek()) || peek() == '-')) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private void advance() {
        pos++ ;
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}

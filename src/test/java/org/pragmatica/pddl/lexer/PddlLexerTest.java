package org.pragmatica.pddl.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PDDL tokenization.
 */
class PddlLexerTest {

    private static List<TokenKind> kinds(String input) {
        return PddlLexer.tokenize(input)
                        .stream()
                        .map(Token::kind)
                        .toList();
    }

    private static List<String> texts(String input) {
        return PddlLexer.tokenize(input)
                        .stream()
                        .map(Token::text)
                        .toList();
    }

    // === Coverage ===

    @Test
    void tokenize_anyInput_concatenationReproducesInput() {
        var inputs = List.of("",
                             "(define (domain d))",
                             "(:action a :parameters (?p - t1) :precondition (p) :effect (q))",
                             "; comment\r\n(p @@ q) #t -1.5 ))",
                             "(p))\n\t(:types a b - c",
                             "€ ^ & |");
        for (var input : inputs) {
            var joined = PddlLexer.tokenize(input)
                                  .stream()
                                  .map(Token::text)
                                  .collect(Collectors.joining());
            assertEquals(input, joined);
        }
    }

    @Test
    void tokenize_consecutiveTokens_areContiguous() {
        var tokens = PddlLexer.tokenize("(define (problem p1) (:domain d) ; c\n)");

        for (int i = 1; i < tokens.size(); i++) {
            assertEquals(tokens.get(i - 1)
                               .end(),
                         tokens.get(i)
                               .start());
        }
        assertEquals(0,
                     tokens.get(0)
                           .start());
    }

    @Test
    void tokenize_unrecognizedCharacters_becomeOtherToken() {
        assertThat(texts("(p @@ q)")).containsExactly("(", "p", " ", "@@", " ", "q", ")");
        assertThat(kinds("(p @@ q)")).containsExactly(TokenKind.OPEN_BRACKET,
                                                      TokenKind.OTHER,
                                                      TokenKind.WHITESPACE,
                                                      TokenKind.OTHER,
                                                      TokenKind.WHITESPACE,
                                                      TokenKind.OTHER,
                                                      TokenKind.CLOSE_BRACKET);
    }

    // === Classification ===

    @Test
    void tokenize_defineHead_recognizesOperators() {
        assertThat(texts("(define (domain d))")).containsExactly("(define", " ", "(domain", " ", "d", ")", ")");
        assertThat(kinds("(define (domain d))")).containsExactly(TokenKind.OPEN_BRACKET_OPERATOR,
                                                                 TokenKind.WHITESPACE,
                                                                 TokenKind.OPEN_BRACKET_OPERATOR,
                                                                 TokenKind.WHITESPACE,
                                                                 TokenKind.OTHER,
                                                                 TokenKind.CLOSE_BRACKET,
                                                                 TokenKind.CLOSE_BRACKET);
    }

    @Test
    void tokenize_sectionKeyword_isOperatorBracket() {
        var tokens = PddlLexer.tokenize("(:durative-action move)");

        assertEquals(TokenKind.OPEN_BRACKET_OPERATOR,
                     tokens.get(0)
                           .kind());
        assertEquals("(:durative-action",
                     tokens.get(0)
                           .text());
    }

    @Test
    void tokenize_temporalQualifier_consumedWithBracket() {
        assertThat(texts("(at start (p))")).startsWith("(at start", " ", "(", "p");
        assertThat(texts("(over  all (p))")).startsWith("(over  all");
    }

    @Test
    void tokenize_operatorFollowedByNameCharacters_isPlainBracket() {
        assertThat(texts("(at-robot r1)")).startsWith("(", "at-robot");
        assertThat(texts("(andy)")).startsWith("(", "andy");
    }

    @Test
    void tokenize_arithmeticOperators_areOperatorBrackets() {
        assertThat(texts("(- 1 2)")).startsWith("(-");
        assertThat(texts("(>= (f) 2)")).startsWith("(>=");
        assertThat(texts("(= ?duration 1)")).startsWith("(=");
    }

    @Test
    void tokenize_keywordsParametersAndDashes() {
        assertThat(kinds(":parameters ?p1 - t-1")).containsExactly(TokenKind.KEYWORD,
                                                                   TokenKind.WHITESPACE,
                                                                   TokenKind.PARAMETER,
                                                                   TokenKind.WHITESPACE,
                                                                   TokenKind.DASH,
                                                                   TokenKind.WHITESPACE,
                                                                   TokenKind.OTHER);
        assertThat(texts(":parameters ?p1 - t-1")).containsExactly(":parameters", " ", "?p1", " ", "-", " ", "t-1");
    }

    @Test
    void tokenize_comment_excludesLineBreak() {
        var tokens = PddlLexer.tokenize("; hi\r\n(p)");

        assertEquals(new Token(TokenKind.COMMENT, "; hi", 0, 4), tokens.get(0));
        assertEquals(new Token(TokenKind.WHITESPACE, "\r\n", 4, 6), tokens.get(1));
    }

    @Test
    void tokenize_commentAtEndOfInput_extendsToEnd() {
        var tokens = PddlLexer.tokenize("(p) ; trailing");

        assertEquals("; trailing",
                     tokens.get(tokens.size() - 1)
                           .text());
    }

    @Test
    void tokenize_numbers_areOther() {
        assertThat(texts("-1.5 +2 .5 10")).containsExactly("-1.5", " ", "+2", " ", ".5", " ", "10");
        assertThat(kinds("-1.5")).containsExactly(TokenKind.OTHER);
    }

    @Test
    void tokenize_continuousTimeSymbol_isOther() {
        assertThat(texts("(* #t 2)")).containsExactly("(*", " ", "#t", " ", "2", ")");
    }

    // === Cutoff ===

    @Test
    void tokenize_withCutoff_stopsAfterTokenPassingCutoff() {
        var tokens = new ArrayList<Token>();
        PddlLexer.tokenize("(a b c)", 2, tokens::add);

        assertThat(tokens).extracting(Token::text)
                          .containsExactly("(", "a", " ");
    }

    @Test
    void tokenize_withCutoffBeyondInput_readsEverything() {
        var tokens = new ArrayList<Token>();
        PddlLexer.tokenize("(a)", 100, tokens::add);

        assertEquals(3, tokens.size());
    }

    @Test
    void tokenize_negativeCutoff_throws() {
        assertThrows(IllegalArgumentException.class, () -> PddlLexer.tokenize("(a)", -1, token -> {}));
    }

    // === Token ===

    @Test
    void token_includes_isInclusiveAtBothEnds() {
        var token = Token.of(TokenKind.OTHER, "abc", 2);

        assertEquals(5, token.end());
        assertTrue(token.includes(2));
        assertTrue(token.includes(5));
        assertFalse(token.includes(1));
        assertFalse(token.includes(6));
    }
}

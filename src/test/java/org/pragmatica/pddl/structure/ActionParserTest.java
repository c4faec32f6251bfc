package org.pragmatica.pddl.structure;

import org.junit.jupiter.api.Test;
import org.pragmatica.pddl.model.Parameter;
import org.pragmatica.pddl.parser.ParserConfig;
import org.pragmatica.pddl.parser.SyntaxTreeBuilder;
import org.pragmatica.pddl.tree.LinePositionResolver;
import org.pragmatica.pddl.tree.SyntaxNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for action, process, event and durative action parsing.
 */
class ActionParserTest {

    private static SyntaxNode lastTopLevel(String text) {
        var children = SyntaxTreeBuilder.build(text)
                                        .tree()
                                        .root()
                                        .children();
        return children.get(children.size() - 1);
    }

    @Test
    void instant_readsAllClauses() {
        var text = "(:action a1 :parameters (?p - t1) :precondition (p) :effect (q))";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.name()).contains("a1");
        assertThat(action.parameters()).containsExactly(Parameter.of("p", "t1"));
        assertEquals("(p)", action.precondition()
                                  .orElseThrow()
                                  .text());
        assertEquals("(q)", action.effect()
                                  .orElseThrow()
                                  .text());
        assertFalse(action.isDurative());
        assertEquals(text, action.span()
                                 .extract(text));
    }

    @Test
    void instant_missingClauses_areEmpty() {
        var text = "(:action a2 :parameters (?x))";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.parameters()).containsExactly(Parameter.of("x", "object"));
        assertTrue(action.precondition()
                         .isEmpty());
        assertTrue(action.effect()
                         .isEmpty());
    }

    @Test
    void instant_withoutName_isStillProduced() {
        var text = "(:action :parameters ())";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertTrue(action.name()
                         .isEmpty());
        assertEquals("", action.nameOrEmpty());
        assertThat(action.parameters()).isEmpty();
    }

    @Test
    void instant_unclosedWhileTyping_keepsWhatIsThere() {
        var text = "(:action move :parameters (?r - robot) :precondition (and (at ?r";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.name()).contains("move");
        assertThat(action.precondition()
                         .orElseThrow()
                         .text()).isEqualTo("(and (at ?r");
        assertTrue(action.effect()
                         .isEmpty());
    }

    @Test
    void instant_commentBlockAbove_becomesDocumentation() {
        var text = "; unrelated\n\n;; moves the robot\n; between rooms\n(:action move)";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.documentation()).containsExactly("moves the robot", "between rooms");
    }

    @Test
    void instant_commentTrailingPreviousConstruct_isNotDocumentation() {
        var text = "(:predicates (p)) ; note on predicates\n(:action move)";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.documentation()).isEmpty();
    }

    @Test
    void instant_trailingCommentAboveBlock_endsDocumentation() {
        var text = "(:predicates (p)) ; note on predicates\n; moves the robot\n(:action move)";

        var action = ActionParser.instant(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.documentation()).containsExactly("moves the robot");
    }

    @Test
    void instant_documentationDisabled_isEmpty() {
        var text = "; moves the robot\n(:action move)";

        var action = ActionParser.instant(lastTopLevel(text),
                                          LinePositionResolver.of(text),
                                          new ParserConfig("object", false));

        assertThat(action.documentation()).isEmpty();
    }

    @Test
    void durative_readsTimedClauses() {
        var text = "(:durative-action d :parameters () :duration (= ?duration 1) :condition (at start (p)) :effect (at end (q)))";

        var action = ActionParser.durative(lastTopLevel(text), LinePositionResolver.of(text), ParserConfig.DEFAULT);

        assertThat(action.name()).contains("d");
        assertThat(action.parameters()).isEmpty();
        assertEquals("(= ?duration 1)", action.duration()
                                              .orElseThrow()
                                              .text());
        assertEquals("(at start (p))", action.condition()
                                             .orElseThrow()
                                             .text());
        assertEquals("(at end (q))", action.effect()
                                           .orElseThrow()
                                           .text());
        assertTrue(action.isDurative());
    }
}

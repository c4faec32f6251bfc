package org.pragmatica.pddl.structure;

import org.junit.jupiter.api.Test;
import org.pragmatica.pddl.model.Constraint;
import org.pragmatica.pddl.parser.SyntaxTreeBuilder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@code :constraints} parsing.
 */
class ConstraintsParserTest {

    private static List<Constraint> parse(String text) {
        return ConstraintsParser.parse(SyntaxTreeBuilder.build(text)
                                                        .tree()
                                                        .root()
                                                        .children()
                                                        .get(0));
    }

    @Test
    void parse_topLevelAnd_isFlattenedAndMalformedEntriesDropped() {
        var constraints = parse("(:constraints (and (always (p)) (name g1 (at-base r1)) (after g1 (q))"
                                + " (strictly-after g1 g2) (strictly-after g1)))");

        assertThat(constraints).hasSize(4);
        assertInstanceOf(Constraint.Plain.class, constraints.get(0));
        assertInstanceOf(Constraint.NamedCondition.class, constraints.get(1));
        assertInstanceOf(Constraint.After.class, constraints.get(2));
        assertInstanceOf(Constraint.StrictlyAfter.class, constraints.get(3));
    }

    @Test
    void parse_nestedLeadingAnds_areAllFlattened() {
        var constraints = parse("(:constraints (and (and (and (always (p)) (sometime (q))))))");

        assertThat(constraints).hasSize(2)
                               .allMatch(Constraint.Plain.class::isInstance);
    }

    @Test
    void parse_namedCondition_readsNameAndCondition() {
        var named = (Constraint.NamedCondition) parse("(:constraints (named-condition g1 (at-base r1)))").get(0);

        assertThat(named.name()).contains("g1");
        assertEquals("(at-base r1)", named.condition()
                                          .orElseThrow()
                                          .text());
    }

    @Test
    void parse_after_readsGoalsByNameOrCondition() {
        var after = (Constraint.After) parse("(:constraints (after g1 (q ?x)))").get(0);

        assertThat(after.predecessor()
                        .name()).contains("g1");
        assertTrue(after.predecessor()
                        .condition()
                        .isEmpty());
        assertTrue(after.successor()
                        .name()
                        .isEmpty());
        assertEquals("(q ?x)", after.successor()
                                    .condition()
                                    .orElseThrow()
                                    .text());
    }

    @Test
    void parse_unknownHeadAndEmptyBracket_arePlain() {
        var constraints = parse("(:constraints (foo x) ())");

        assertThat(constraints).hasSize(2)
                               .allMatch(Constraint.Plain.class::isInstance);
    }

    @Test
    void parse_malformedNamedCondition_isDropped() {
        assertThat(parse("(:constraints (name g1) (state-satisfying (p)))")).isEmpty();
    }

    @Test
    void parse_emptySection_givesNoConstraints() {
        assertThat(parse("(:constraints)")).isEmpty();
    }
}

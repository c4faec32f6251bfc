package org.pragmatica.pddl;

import org.junit.jupiter.api.Test;
import org.pragmatica.pddl.error.ParseError;
import org.pragmatica.pddl.error.PddlParseException;
import org.pragmatica.pddl.model.Parameter;
import org.pragmatica.pddl.parser.ParserConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PddlParserTest {

    private static final String DOMAIN = "(define (domain d) (:predicates (p ?x)) (:action a :parameters (?y)))";
    private static final String PROBLEM = "(define (problem p1) (:domain d) (:objects o1) (:init (p o1)) (:goal (p o1)))";

    @Test
    void create_usesDefaultConfiguration() {
        assertEquals(ParserConfig.DEFAULT,
                     PddlParser.create()
                               .config());
    }

    @Test
    void builder_appliesImplicitParameterType() {
        var parser = PddlParser.builder()
                               .implicitParameterType("entity")
                               .captureDocumentation(false)
                               .build();

        var domain = parser.parseDomain(DOMAIN);

        assertThat(domain.predicates()
                         .get(0)
                         .parameters()).containsExactly(Parameter.of("x", "entity"));
        assertThat(domain.actions()
                         .get(0)
                         .parameters()).containsExactly(Parameter.of("y", "entity"));
        assertFalse(parser.config()
                          .captureDocumentation());
    }

    @Test
    void builder_blankImplicitType_isRejected() {
        var builder = PddlParser.builder()
                                .implicitParameterType(" ");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void parseTree_reportsUnmatchedBrackets() {
        var result = PddlParser.create()
                               .parseTree("(p))");

        assertTrue(result.hasErrors());
        assertThat(result.offendingTokens()).hasSize(1);
    }

    @Test
    void parseTree_withCutoff_rejectsNegativeOffset() {
        assertThrows(IllegalArgumentException.class,
                     () -> PddlParser.create()
                                     .parseTree("(p)", -1));
    }

    @Test
    void parseProblem_buildsModel() {
        var problem = PddlParser.create()
                                .parseProblem(PROBLEM);

        assertThat(problem.name()).contains("p1");
        assertThat(problem.objectsOf("object")).containsExactly("o1");
        assertThat(problem.inits()).hasSize(1);
    }

    @Test
    void tryDomain_recognisesDocumentKind() {
        var parser = PddlParser.create();

        assertTrue(parser.tryDomain(DOMAIN)
                         .isPresent());
        assertTrue(parser.tryDomain(PROBLEM)
                         .isEmpty());
        assertTrue(parser.tryDomain("; just a comment")
                         .isEmpty());
    }

    @Test
    void tryProblem_recognisesDocumentKind() {
        var parser = PddlParser.create();

        assertTrue(parser.tryProblem(PROBLEM)
                         .isPresent());
        assertTrue(parser.tryProblem(DOMAIN)
                         .isEmpty());
    }

    @Test
    void parseDomain_withoutDefine_throws() {
        var exception = assertThrows(PddlParseException.class,
                                     () -> PddlParser.create()
                                                     .parseDomain("(:action a)"));

        assertInstanceOf(ParseError.MissingDefine.class, exception.error());
        assertEquals("Missing (define ...) at 0:0", exception.getMessage());
    }
}

package org.pragmatica.pddl.structure;

import org.junit.jupiter.api.Test;
import org.pragmatica.pddl.model.Parameter;
import org.pragmatica.pddl.parser.SyntaxTreeBuilder;
import org.pragmatica.pddl.tree.SyntaxNode;

import static org.assertj.core.api.Assertions.assertThat;

class ParametersParserTest {

    private static SyntaxNode bracket(String text) {
        return SyntaxTreeBuilder.build(text)
                                .tree()
                                .root()
                                .children()
                                .get(0);
    }

    @Test
    void parse_typedGroups_assignTypeToEveryParameterInGroup() {
        var parameters = ParametersParser.parse(bracket("(?from ?to - location ?v - vehicle)"), "object");

        assertThat(parameters).containsExactly(Parameter.of("from", "location"),
                                               Parameter.of("to", "location"),
                                               Parameter.of("v", "vehicle"));
    }

    @Test
    void parse_untypedParameters_getImplicitType() {
        var parameters = ParametersParser.parse(bracket("(?a ?b - t1 ?c)"), "object");

        assertThat(parameters).containsExactly(Parameter.of("a", "t1"),
                                               Parameter.of("b", "t1"),
                                               Parameter.of("c", "object"));
    }

    @Test
    void parse_eitherType_keepsAlternatives() {
        var parameters = ParametersParser.parse(bracket("(?x - (either t1 t2))"), "object");

        assertThat(parameters).containsExactly(Parameter.of("x", "either t1 t2"));
    }

    @Test
    void parse_commentsInsideList_areIgnored() {
        var parameters = ParametersParser.parse(bracket("(?r ; the robot\n - robot)"), "object");

        assertThat(parameters).containsExactly(Parameter.of("r", "robot"));
    }

    @Test
    void toPddlString_rendersTypedParameter() {
        assertThat(Parameter.of("r", "robot")
                            .toPddlString()).isEqualTo("?r - robot");
    }
}

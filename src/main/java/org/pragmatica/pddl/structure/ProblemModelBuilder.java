package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.error.ParseError;
import org.pragmatica.pddl.error.PddlParseException;
import org.pragmatica.pddl.model.ProblemModel;
import org.pragmatica.pddl.model.TypeObjectMap;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SourceLocation;
import org.pragmatica.pddl.tree.SyntaxNode;
import org.pragmatica.pddl.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a {@link ProblemModel} from the syntax tree of a {@code (define (problem ...) ...)} document.
 */
public final class ProblemModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(ProblemModelBuilder.class);

    private ProblemModelBuilder() {}

    /**
     * Build the problem model.
     *
     * @throws PddlParseException if the document has no {@code (define (problem ...) ...)} construct
     */
    public static ProblemModel build(SyntaxTree tree, PositionResolver resolver) {
        var define = tree.defineNode()
                         .orElseThrow(() -> new PddlParseException(new ParseError.MissingDefine(SourceLocation.START)));
        var head = define.firstOpenBracket(PddlStructure.PROBLEM)
                         .orElseThrow(() -> new PddlParseException(new ParseError.MissingHead(resolver.resolveToLocation(define.start()),
                                                                                              PddlStructure.PROBLEM)));
        var init = define.firstOpenBracket(PddlStructure.INIT);
        var model = new ProblemModel(DomainModelBuilder.firstName(head),
                                     define.firstOpenBracket(PddlStructure.DOMAIN_REFERENCE)
                                           .flatMap(DomainModelBuilder::firstName),
                                     DomainModelBuilder.requirements(define),
                                     TypeObjectMap.from(InheritanceParser.parseSections(define.openBrackets(PddlStructure.OBJECTS))),
                                     init.map(InitParser::values)
                                         .orElse(List.of()),
                                     init.map(InitParser::supplyDemands)
                                         .orElse(List.of()),
                                     goal(define),
                                     DomainModelBuilder.constraints(define),
                                     tree);
        log.debug("Problem {} of domain {}: {} object types, {} initial values, {} supply-demands, {} constraints",
                  model.name()
                       .orElse("<unnamed>"),
                  model.domainName()
                       .orElse("<unknown>"),
                  model.objects()
                       .size(),
                  model.inits()
                       .size(),
                  model.supplyDemands()
                       .size(),
                  model.constraints()
                       .size());
        return model;
    }

    /**
     * Check whether the tree holds a problem, i.e. its {@code define} starts with a {@code (problem ...)} head.
     */
    public static boolean isProblem(SyntaxTree tree) {
        return tree.defineNode()
                   .flatMap(define -> define.firstOpenBracket(PddlStructure.PROBLEM))
                   .isPresent();
    }

    private static Optional<SyntaxNode> goal(SyntaxNode define) {
        return define.firstOpenBracket(PddlStructure.GOAL)
                     .flatMap(section -> section.firstChild(child -> child.kind()
                                                                          .isOpenBracket()));
    }
}

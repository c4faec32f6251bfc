package org.pragmatica.pddl.structure;

import org.pragmatica.pddl.error.ParseError;
import org.pragmatica.pddl.error.PddlParseException;
import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.model.Action;
import org.pragmatica.pddl.model.Constraint;
import org.pragmatica.pddl.model.DerivedVariable;
import org.pragmatica.pddl.model.DomainModel;
import org.pragmatica.pddl.model.TypeObjectMap;
import org.pragmatica.pddl.model.Variable;
import org.pragmatica.pddl.parser.ParserConfig;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SourceLocation;
import org.pragmatica.pddl.tree.SourceSpan;
import org.pragmatica.pddl.tree.SyntaxNode;
import org.pragmatica.pddl.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a {@link DomainModel} from the syntax tree of a {@code (define (domain ...) ...)} document.
 *
 * <p>Only the {@code define} construct with its {@code (domain ...)} head is mandatory; every other section
 * that is missing yields an empty collection. When a section appears several times, the results are
 * concatenated in source order.
 */
public final class DomainModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(DomainModelBuilder.class);
    private static final Pattern ANY = Pattern.compile(".");

    private final SyntaxTree tree;
    private final SyntaxNode define;
    private final PositionResolver resolver;
    private final ParserConfig config;

    private DomainModelBuilder(SyntaxTree tree, SyntaxNode define, PositionResolver resolver, ParserConfig config) {
        this.tree = tree;
        this.define = define;
        this.resolver = resolver;
        this.config = config;
    }

    /**
     * Build the domain model.
     *
     * @throws PddlParseException if the document has no {@code (define (domain ...) ...)} construct
     */
    public static DomainModel build(SyntaxTree tree, PositionResolver resolver, ParserConfig config) {
        var define = tree.defineNode()
                         .orElseThrow(() -> new PddlParseException(new ParseError.MissingDefine(SourceLocation.START)));
        var head = define.firstOpenBracket(PddlStructure.DOMAIN)
                         .orElseThrow(() -> new PddlParseException(new ParseError.MissingHead(resolver.resolveToLocation(define.start()),
                                                                                              PddlStructure.DOMAIN)));
        return new DomainModelBuilder(tree, define, resolver, config).build(head);
    }

    /**
     * Check whether the tree holds a domain, i.e. its {@code define} starts with a {@code (domain ...)} head.
     */
    public static boolean isDomain(SyntaxTree tree) {
        return tree.defineNode()
                   .flatMap(define -> define.firstOpenBracket(PddlStructure.DOMAIN))
                   .isPresent();
    }

    private DomainModel build(SyntaxNode head) {
        var typeSections = define.openBrackets(PddlStructure.TYPES);
        var model = new DomainModel(firstName(head),
                                    requirements(define),
                                    InheritanceParser.parseSections(typeSections),
                                    typeLocations(typeSections),
                                    TypeObjectMap.from(InheritanceParser.parseSections(define.openBrackets(PddlStructure.CONSTANTS))),
                                    variables(PddlStructure.PREDICATES),
                                    variables(PddlStructure.FUNCTIONS),
                                    derived(),
                                    actions(),
                                    collect(PddlStructure.PROCESS, this::instantAction),
                                    collect(PddlStructure.EVENT, this::instantAction),
                                    constraints(define),
                                    tree);
        log.debug("Domain {}: {} types, {} predicates, {} functions, {} derived, {} actions, {} processes, {} events, {} constraints",
                  model.name()
                       .orElse("<unnamed>"),
                  model.types()
                       .size(),
                  model.predicates()
                       .size(),
                  model.functions()
                       .size(),
                  model.derived()
                       .size(),
                  model.actions()
                       .size(),
                  model.processes()
                       .size(),
                  model.events()
                       .size(),
                  model.constraints()
                       .size());
        return model;
    }

    static List<String> requirements(SyntaxNode define) {
        return define.openBrackets(PddlStructure.REQUIREMENTS)
                     .stream()
                     .flatMap(section -> section.nonWhitespaceChildren()
                                                .stream())
                     .filter(node -> node.isType(TokenKind.KEYWORD))
                     .map(node -> node.token()
                                      .text())
                     .toList();
    }

    static List<Constraint> constraints(SyntaxNode define) {
        return define.openBrackets(PddlStructure.CONSTRAINTS)
                     .stream()
                     .flatMap(section -> ConstraintsParser.parse(section)
                                                          .stream())
                     .toList();
    }

    private Map<String, SourceSpan> typeLocations(List<SyntaxNode> typeSections) {
        var locations = new LinkedHashMap<String, SourceSpan>();
        typeSections.stream()
                    .flatMap(section -> PddlStructure.significantChildren(section)
                                                     .stream())
                    .filter(node -> node.isType(TokenKind.OTHER))
                    .forEach(node -> locations.putIfAbsent(node.text(), resolver.spanOf(node)));
        return locations;
    }

    private List<Variable> variables(String keyword) {
        return define.openBrackets(keyword)
                     .stream()
                     .flatMap(section -> VariablesParser.parse(section, resolver, config)
                                                        .stream())
                     .toList();
    }

    private List<DerivedVariable> derived() {
        var result = new ArrayList<DerivedVariable>();
        for (var node : define.openBrackets(PddlStructure.DERIVED)) {
            DerivedVariableParser.parse(node, resolver, config)
                                 .ifPresentOrElse(result::add,
                                                  () -> log.debug("Skipping malformed derived variable at offset {}",
                                                                  node.start()));
        }
        return result;
    }

    private List<Action> actions() {
        var actions = new ArrayList<Action>();
        for (var node : define.nestedChildren()) {
            if (node.isOperator(PddlStructure.ACTION)) {
                actions.add(instantAction(node));
            } else if (node.isOperator(PddlStructure.DURATIVE_ACTION)) {
                actions.add(ActionParser.durative(node, resolver, config));
            }
        }
        return actions;
    }

    private Action instantAction(SyntaxNode node) {
        return ActionParser.instant(node, resolver, config);
    }

    private List<Action> collect(String keyword, Function<SyntaxNode, Action> parser) {
        return define.openBrackets(keyword)
                     .stream()
                     .map(parser)
                     .toList();
    }

    static Optional<String> firstName(SyntaxNode node) {
        return node.firstChild(TokenKind.OTHER, ANY)
                   .map(SyntaxNode::text);
    }
}

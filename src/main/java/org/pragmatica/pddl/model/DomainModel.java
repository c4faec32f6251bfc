package org.pragmatica.pddl.model;

import org.pragmatica.pddl.lexer.TokenKind;
import org.pragmatica.pddl.tree.LinePositionResolver;
import org.pragmatica.pddl.tree.PositionResolver;
import org.pragmatica.pddl.tree.SourceSpan;
import org.pragmatica.pddl.tree.SyntaxNode;
import org.pragmatica.pddl.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structure of a PDDL domain. Every collection keeps source order and is empty when its section is absent.
 *
 * @param name          domain name, empty if the {@code (domain ...)} head has no name yet
 * @param requirements  requirement keywords, e.g. {@code :strips}
 * @param typeGraph     declared type inheritance
 * @param typeLocations source range of each type's first declaration
 * @param constants     constants grouped by type
 * @param predicates    predicate declarations
 * @param functions     function declarations
 * @param derived       derived predicates and functions
 * @param actions       instant and durative actions
 * @param processes     processes
 * @param events        events
 * @param constraints   domain constraints
 * @param tree          syntax tree the model was built from
 */
public record DomainModel(
    Optional<String> name,
    List<String> requirements,
    InheritanceGraph typeGraph,
    Map<String, SourceSpan> typeLocations,
    TypeObjectMap constants,
    List<Variable> predicates,
    List<Variable> functions,
    List<DerivedVariable> derived,
    List<Action> actions,
    List<Action> processes,
    List<Action> events,
    List<Constraint> constraints,
    SyntaxTree tree
) {
    public DomainModel {
        requirements = List.copyOf(requirements);
        typeLocations = Map.copyOf(typeLocations);
        predicates = List.copyOf(predicates);
        functions = List.copyOf(functions);
        derived = List.copyOf(derived);
        actions = List.copyOf(actions);
        processes = List.copyOf(processes);
        events = List.copyOf(events);
        constraints = List.copyOf(constraints);
    }

    /**
     * Declared types, without the implicit {@value InheritanceGraph#OBJECT}.
     */
    public List<String> types() {
        return typeGraph.vertices()
                        .stream()
                        .filter(type -> !InheritanceGraph.OBJECT.equals(type))
                        .toList();
    }

    public List<String> typesInheritingFrom(String type) {
        return typeGraph.subtreePointingTo(type);
    }

    public Optional<SourceSpan> typeLocation(String type) {
        return Optional.ofNullable(typeLocations.get(type));
    }

    public Optional<Variable> predicate(String name) {
        return predicates.stream()
                         .filter(predicate -> predicate.matchesShortName(name))
                         .findFirst();
    }

    public Optional<Variable> function(String name) {
        return functions.stream()
                        .filter(function -> function.matchesShortName(name))
                        .findFirst();
    }

    public Optional<Action> action(String name) {
        return actions.stream()
                      .filter(action -> action.name()
                                              .map(name::equalsIgnoreCase)
                                              .orElse(false))
                      .findFirst();
    }

    /**
     * Source ranges of every bracket under {@code define} headed by the variable's name, ignoring case.
     * The declaration itself is included.
     */
    public List<SourceSpan> variableReferences(Variable variable, PositionResolver resolver) {
        return tree.defineNode()
                   .map(define -> define.descendants(node -> headName(node).map(variable::matchesShortName)
                                                                            .orElse(false)))
                   .orElse(List.of())
                   .stream()
                   .map(resolver::spanOf)
                   .toList();
    }

    public List<SourceSpan> variableReferences(Variable variable) {
        return variableReferences(variable, LinePositionResolver.of(tree.source()));
    }

    /**
     * Source ranges of the type name wherever it follows a dash, e.g. {@code ?v - vehicle} or
     * {@code - (either car vehicle)}. The entry in {@code :types} that declares the type without a parent is
     * not a reference.
     */
    public List<SourceSpan> typeReferences(String type, PositionResolver resolver) {
        var root = tree.root();
        var containers = new ArrayList<SyntaxNode>();
        containers.add(root);
        containers.addAll(root.descendants(SyntaxNode::hasChildren));
        var references = new ArrayList<SyntaxNode>();
        for (var container : containers) {
            boolean afterDash = false;
            for (var child : container.nestedChildren()) {
                if (child.isType(TokenKind.WHITESPACE) || child.isType(TokenKind.COMMENT)) {
                    continue;
                }
                if (afterDash) {
                    typeNames(child).stream()
                                    .filter(name -> name.text()
                                                        .equalsIgnoreCase(type))
                                    .forEach(references::add);
                }
                afterDash = child.isType(TokenKind.DASH);
            }
        }
        return references.stream()
                         .sorted(Comparator.comparingInt(SyntaxNode::start))
                         .map(resolver::spanOf)
                         .toList();
    }

    public List<SourceSpan> typeReferences(String type) {
        return typeReferences(type, LinePositionResolver.of(tree.source()));
    }

    private static Optional<String> headName(SyntaxNode node) {
        if (node.isType(TokenKind.OPEN_BRACKET_OPERATOR)) {
            // predicates may be named like operators, e.g. (at ?v ?l)
            return Optional.of(node.token()
                                   .text()
                                   .substring(1)
                                   .trim());
        }
        if (!node.isType(TokenKind.OPEN_BRACKET)) {
            return Optional.empty();
        }
        var children = node.nonWhitespaceChildren();
        if (children.isEmpty() || !children.get(0)
                                           .isType(TokenKind.OTHER)) {
            return Optional.empty();
        }
        return Optional.of(children.get(0)
                                   .text());
    }

    private static List<SyntaxNode> typeNames(SyntaxNode node) {
        if (node.isType(TokenKind.OTHER)) {
            return List.of(node);
        }
        if (!node.isType(TokenKind.OPEN_BRACKET)) {
            return List.of();
        }
        var names = node.nonWhitespaceChildren()
                        .stream()
                        .filter(child -> child.isType(TokenKind.OTHER))
                        .toList();
        if (names.isEmpty() || !names.get(0)
                                     .text()
                                     .equalsIgnoreCase("either")) {
            return List.of();
        }
        return names.subList(1, names.size());
    }
}

package org.pragmatica.pddl.tree;

import org.pragmatica.pddl.lexer.Token;
import org.pragmatica.pddl.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Read-only view of one node of a {@link SyntaxTree}.
 *
 * <p>Node kinds form a closed set:
 * <ul>
 *   <li>{@link Leaf} - comment, parameter, dash, whitespace, bareword or close bracket; never has children</li>
 *   <li>{@link Section} - the document root or a {@code :keyword} section</li>
 *   <li>{@link Bracket} - an open bracket, optionally matched by a close bracket</li>
 * </ul>
 * A node's range starts at its token and extends over all of its descendants.
 */
public sealed interface SyntaxNode {
    Pattern PARAMETRISABLE = Pattern.compile(
        "^\\(\\s*(:action|:durative-action|:process|:event|:derived|forall|sumall|exists)$",
        Pattern.CASE_INSENSITIVE);
    Pattern ACTION_LIKE = Pattern.compile(":action|:durative-action|:process|:event", Pattern.CASE_INSENSITIVE);

    SyntaxTree tree();

    int index();

    default Token token() {
        return tree().tokenOf(index());
    }

    default TokenKind kind() {
        return token().kind();
    }

    default int start() {
        return token().start();
    }

    default int end() {
        return tree().endOf(index());
    }

    /**
     * Check whether the offset falls into the node range. Both ends are inclusive.
     */
    default boolean includes(int offset) {
        return offset >= start() && offset <= end();
    }

    default boolean isType(TokenKind kind) {
        return kind() == kind;
    }

    default boolean isDocument() {
        return isType(TokenKind.DOCUMENT);
    }

    default boolean isRoot() {
        return parent().isEmpty();
    }

    default Optional<SyntaxNode> parent() {
        return tree().parentOf(index());
    }

    /**
     * All child nodes, for brackets including the trailing close bracket leaf.
     */
    default List<SyntaxNode> children() {
        return tree().childrenOf(index());
    }

    /**
     * Child nodes between the node's own delimiters.
     */
    default List<SyntaxNode> nestedChildren() {
        return children();
    }

    default boolean hasChildren() {
        return !nestedChildren().isEmpty();
    }

    default List<SyntaxNode> nonWhitespaceChildren() {
        return nestedChildren().stream()
                               .filter(child -> !child.isType(TokenKind.WHITESPACE))
                               .toList();
    }

    default List<SyntaxNode> childrenOfType(TokenKind kind, Pattern pattern) {
        return nestedChildren().stream()
                               .filter(child -> child.isType(kind))
                               .filter(child -> pattern.matcher(child.token()
                                                                     .text())
                                                       .find())
                               .toList();
    }

    default Optional<SyntaxNode> firstChild(TokenKind kind, Pattern pattern) {
        return childrenOfType(kind, pattern).stream()
                                            .findFirst();
    }

    default Optional<SyntaxNode> firstChild(Predicate<SyntaxNode> predicate) {
        return nestedChildren().stream()
                               .filter(predicate)
                               .findFirst();
    }

    /**
     * Find the first child bracket opened with the given operator, e.g. {@code define} or {@code :action}.
     */
    default Optional<SyntaxNode> firstOpenBracket(String keyword) {
        return firstChild(TokenKind.OPEN_BRACKET_OPERATOR, operatorPattern(keyword));
    }

    /**
     * Check whether this node is a bracket opened with the given operator.
     */
    default boolean isOperator(String keyword) {
        return isType(TokenKind.OPEN_BRACKET_OPERATOR) && operatorPattern(keyword).matcher(token().text())
                                                                                  .find();
    }

    /**
     * All child brackets opened with the given operator.
     */
    default List<SyntaxNode> openBrackets(String keyword) {
        return childrenOfType(TokenKind.OPEN_BRACKET_OPERATOR, operatorPattern(keyword));
    }

    /**
     * Find the bracket nested inside the {@code :keyword} section, e.g. {@code precondition} matches
     * {@code :precondition (...)}.
     */
    default Optional<SyntaxNode> keywordOpenBracket(String keyword) {
        return keywordSection(keyword).flatMap(section -> section.firstChild(child -> child.kind()
                                                                                           .isOpenBracket()));
    }

    /**
     * Find the {@code :keyword} section among the children.
     */
    default Optional<SyntaxNode> keywordSection(String keyword) {
        return firstChild(TokenKind.KEYWORD,
                          Pattern.compile("^:" + Pattern.quote(keyword) + "$", Pattern.CASE_INSENSITIVE));
    }

    /**
     * Closest ancestor of the given kind whose token matches the pattern. The document root is never returned.
     */
    default Optional<SyntaxNode> findAncestor(TokenKind kind, Pattern pattern) {
        var parent = parent();
        while (parent.isPresent() && !parent.get()
                                            .isDocument()) {
            var candidate = parent.get();
            if (candidate.isType(kind) && pattern.matcher(candidate.token()
                                                                   .text())
                                                 .find()) {
                return parent;
            }
            parent = candidate.parent();
        }
        return Optional.empty();
    }

    /**
     * Ancestors whose kind is one of the given kinds, closest first.
     */
    default List<SyntaxNode> ancestorsOfKind(Set<TokenKind> kinds) {
        var result = new ArrayList<SyntaxNode>();
        var parent = parent();
        while (parent.isPresent()) {
            if (kinds.contains(parent.get()
                                     .kind())) {
                result.add(parent.get());
            }
            parent = parent.get()
                           .parent();
        }
        return result;
    }

    /**
     * Closest bracket enclosing this node (or this node, if it is a bracket).
     */
    default Optional<SyntaxNode> expand() {
        Optional<SyntaxNode> node = Optional.of(this);
        while (node.isPresent() && !node.get()
                                        .kind()
                                        .isOpenBracket() && !node.get()
                                                                 .isDocument()) {
            node = node.get()
                       .parent();
        }
        return node.filter(found -> !found.isDocument());
    }

    /**
     * Siblings placed before this node, in source order.
     */
    default List<SyntaxNode> precedingSiblings() {
        return parent().map(parent -> parent.nestedChildren()
                                            .stream()
                                            .filter(sibling -> sibling.start() < start())
                                            .toList())
                       .orElse(List.of());
    }

    /**
     * Siblings placed after this node, in source order.
     */
    default List<SyntaxNode> followingSiblings() {
        return parent().map(parent -> parent.nestedChildren()
                                            .stream()
                                            .filter(sibling -> sibling.start() > start())
                                            .toList())
                       .orElse(List.of());
    }

    /**
     * Enclosing scopes that may declare parameters (actions, derived predicates, quantifiers), closest first.
     */
    default List<SyntaxNode> parametrisableScopes() {
        var scopes = new ArrayList<SyntaxNode>();
        var scope = findAncestor(TokenKind.OPEN_BRACKET_OPERATOR, PARAMETRISABLE);
        while (scope.isPresent()) {
            scopes.add(scope.get());
            scope = scope.get()
                         .findAncestor(TokenKind.OPEN_BRACKET_OPERATOR, PARAMETRISABLE);
        }
        return scopes;
    }

    /**
     * Closest enclosing scope that declares the parameter.
     *
     * @param parameterName parameter name without the {@code ?} sign
     */
    default Optional<SyntaxNode> findParametrisableScope(String parameterName) {
        return parametrisableScopes().stream()
                                     .filter(scope -> scope.declaresParameter(parameterName))
                                     .findFirst();
    }

    /**
     * Node holding the parameter declarations of this scope: the {@code :parameters} bracket of actions,
     * or the first nested bracket of quantifiers and derived predicates.
     */
    default Optional<SyntaxNode> parameterDefinition() {
        if (ACTION_LIKE.matcher(token().text())
                       .find()) {
            return keywordOpenBracket("parameters");
        }
        var nonWhitespace = nonWhitespaceChildren();
        if (nonWhitespace.isEmpty() || !nonWhitespace.get(0)
                                                     .kind()
                                                     .isOpenBracket()) {
            return Optional.empty();
        }
        return Optional.of(nonWhitespace.get(0));
    }

    /**
     * @param parameterName parameter name without the {@code ?} sign
     */
    default boolean declaresParameter(String parameterName) {
        var pattern = Pattern.compile("\\?" + Pattern.quote(parameterName) + "(?![\\w-])", Pattern.CASE_INSENSITIVE);
        return parameterDefinition().map(SyntaxNode::nestedText)
                                    .map(text -> pattern.matcher(text)
                                                        .find())
                                    .orElse(false);
    }

    /**
     * Full text of the node including its delimiters.
     */
    default String text() {
        return tree().source()
                     .substring(start(), end());
    }

    /**
     * Text of the nested children, without the node's own open and close tokens.
     */
    default String nestedText() {
        return tree().textBetween(token().end(), nestedEnd(), false);
    }

    /**
     * Full text with every comment left out.
     */
    default String nonCommentText() {
        return tree().textBetween(start(), end(), true);
    }

    default String nestedNonCommentText() {
        return tree().textBetween(token().end(), nestedEnd(), true);
    }

    /**
     * All nodes below this one matching the predicate, in source order. Close bracket leaves are not visited.
     */
    default List<SyntaxNode> descendants(Predicate<SyntaxNode> predicate) {
        var result = new ArrayList<SyntaxNode>();
        var pending = new ArrayDeque<SyntaxNode>();
        var children = nestedChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (predicate.test(node)) {
                result.add(node);
            }
            var nested = node.nestedChildren();
            for (int i = nested.size() - 1; i >= 0; i--) {
                pending.push(nested.get(i));
            }
        }
        return result;
    }

    private int nestedEnd() {
        if (this instanceof Bracket bracket) {
            return bracket.closeToken()
                          .map(Token::start)
                          .orElse(end());
        }
        return end();
    }

    private static Pattern operatorPattern(String keyword) {
        return Pattern.compile("^\\(\\s*" + Pattern.quote(keyword) + "$", Pattern.CASE_INSENSITIVE);
    }

    record Leaf(SyntaxTree tree, int index) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return SyntaxTree.describe(this);
        }
    }

    record Section(SyntaxTree tree, int index) implements SyntaxNode {
        @Override
        public String toString() {
            return SyntaxTree.describe(this);
        }
    }

    record Bracket(SyntaxTree tree, int index) implements SyntaxNode {
        public Optional<Token> closeToken() {
            return tree.closeTokenOf(index);
        }

        public boolean isClosed() {
            return closeToken().isPresent();
        }

        @Override
        public List<SyntaxNode> nestedChildren() {
            var close = closeToken();
            if (close.isEmpty()) {
                return children();
            }
            return children().stream()
                             .filter(child -> !child.token()
                                                    .equals(close.get()))
                             .toList();
        }

        @Override
        public String toString() {
            return SyntaxTree.describe(this);
        }
    }
}

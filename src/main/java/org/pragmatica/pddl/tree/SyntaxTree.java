package org.pragmatica.pddl.tree;

import org.pragmatica.pddl.lexer.Token;
import org.pragmatica.pddl.lexer.TokenKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable syntax tree of one PDDL document.
 *
 * <p>Nodes are stored in an arena and addressed by index; the synthetic document root has index 0 and every
 * child is stored after its parent. {@link SyntaxNode} values are lightweight views over this arena.
 */
public final class SyntaxTree {
    private static final int ROOT = 0;
    private static final int NO_PARENT = -1;

    private final String source;
    private final Token[] tokens;
    private final int[] parents;
    private final int[][] children;
    private final Token[] closeTokens;
    private final int[] ends;

    private SyntaxTree(String source, Arena arena) {
        int size = arena.tokens.size();
        this.source = source;
        this.tokens = arena.tokens.toArray(new Token[0]);
        this.parents = new int[size];
        this.children = new int[size][];
        this.closeTokens = new Token[size];
        this.ends = new int[size];
        for (int i = 0; i < size; i++) {
            parents[i] = arena.parents.get(i);
            children[i] = arena.children.get(i)
                                        .stream()
                                        .mapToInt(Integer::intValue)
                                        .toArray();
            closeTokens[i] = arena.closeTokens.get(i);
            ends[i] = closeTokens[i] == null
                      ? tokens[i].end()
                      : Math.max(tokens[i].end(), closeTokens[i].end());
        }
        // children always follow their parent, so a reverse sweep settles every range
        for (int i = size - 1; i > ROOT; i--) {
            ends[parents[i]] = Math.max(ends[parents[i]], ends[i]);
        }
    }

    /**
     * Create a mutable arena for building a tree.
     */
    public static Arena arena() {
        return new Arena();
    }

    /**
     * Tree of an empty document.
     */
    public static SyntaxTree empty() {
        return arena().build("");
    }

    public SyntaxNode root() {
        return node(ROOT);
    }

    /**
     * Source text the tree was built from.
     */
    public String source() {
        return source;
    }

    /**
     * Number of nodes, including the document root.
     */
    public int size() {
        return tokens.length;
    }

    /**
     * Find the most specific node at the given offset.
     *
     * @throws IllegalArgumentException if the offset is outside the parsed text
     */
    public SyntaxNode nodeAt(int offset) {
        var root = root();
        if (!root.includes(offset)) {
            throw new IllegalArgumentException("Offset " + offset + " is outside of the parsed range " + root.start()
                                               + "~" + root.end());
        }
        if (!root.hasChildren()) {
            return root;
        }
        return root.children()
                   .stream()
                   .filter(child -> child.includes(offset))
                   .findFirst()
                   .map(child -> childNodeAt(child, offset))
                   .orElse(root);
    }

    private static SyntaxNode childNodeAt(SyntaxNode start, int offset) {
        var node = start;
        while (node.hasChildren() && !node.token()
                                          .includes(offset)) {
            var next = node.children()
                           .stream()
                           .filter(child -> child.includes(offset))
                           .findFirst();
            if (next.isEmpty()) {
                return node;
            }
            node = next.get();
        }
        return node;
    }

    /**
     * Tokens of the nodes on the path from the document root to the node at the offset.
     */
    public List<Token> breadcrumbs(int offset) {
        var path = new ArrayList<Token>();
        Optional<SyntaxNode> node = Optional.of(nodeAt(offset));
        while (node.isPresent()) {
            path.add(node.get()
                         .token());
            node = node.get()
                       .parent();
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    /**
     * The top-level {@code (define ...)} node, if present.
     */
    public Optional<SyntaxNode> defineNode() {
        return root().firstOpenBracket("define");
    }

    SyntaxNode node(int index) {
        var kind = tokens[index].kind();
        if (kind.isOpenBracket()) {
            return new SyntaxNode.Bracket(this, index);
        }
        if (kind.isLeaf()) {
            return new SyntaxNode.Leaf(this, index);
        }
        return new SyntaxNode.Section(this, index);
    }

    Token tokenOf(int index) {
        return tokens[index];
    }

    int endOf(int index) {
        return ends[index];
    }

    Optional<SyntaxNode> parentOf(int index) {
        int parent = parents[index];
        return parent == NO_PARENT
               ? Optional.empty()
               : Optional.of(node(parent));
    }

    List<SyntaxNode> childrenOf(int index) {
        var result = new ArrayList<SyntaxNode>(children[index].length);
        for (int child : children[index]) {
            result.add(node(child));
        }
        return result;
    }

    Optional<Token> closeTokenOf(int index) {
        return Optional.ofNullable(closeTokens[index]);
    }

    /**
     * Source text between the offsets, optionally without the comment tokens in that range.
     */
    String textBetween(int from, int to, boolean skipComments) {
        if (!skipComments) {
            return source.substring(from, to);
        }
        var sb = new StringBuilder();
        for (int i = firstTokenAtOrAfter(from); i < tokens.length && tokens[i].start() < to; i++) {
            if (tokens[i].kind() != TokenKind.COMMENT) {
                sb.append(tokens[i].text());
            }
        }
        return sb.toString();
    }

    // tokens after the root are stored in source order
    private int firstTokenAtOrAfter(int offset) {
        int low = ROOT + 1;
        int high = tokens.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (tokens[mid].start() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    static String describe(SyntaxNode node) {
        var token = node.token();
        return token.kind() + ": text: '" + token.text()
                                                  .replace("\r", "\\r")
                                                  .replace("\n", "\\n") + "', range: " + node.start() + "~"
               + node.end();
    }

    /**
     * Mutable node storage used while a tree is being built. Index 0 holds the document root.
     */
    public static final class Arena {
        private final List<Token> tokens = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();
        private final Map<Integer, Token> closeTokens = new HashMap<>();

        private Arena() {
            tokens.add(Token.document());
            parents.add(NO_PARENT);
            children.add(new ArrayList<>());
        }

        public int root() {
            return ROOT;
        }

        /**
         * Append a node wrapping the token as the last child of the parent.
         *
         * @return index of the new node
         */
        public int add(Token token, int parent) {
            int index = tokens.size();
            tokens.add(token);
            parents.add(parent);
            children.add(new ArrayList<>());
            children.get(parent)
                    .add(index);
            return index;
        }

        /**
         * Record the close bracket of a bracket node. The close token also becomes its last leaf child.
         */
        public void close(int bracket, Token closeToken) {
            closeTokens.put(bracket, closeToken);
            add(closeToken, bracket);
        }

        public Token token(int index) {
            return tokens.get(index);
        }

        public int parent(int index) {
            return parents.get(index);
        }

        public boolean isRoot(int index) {
            return index == ROOT;
        }

        public SyntaxTree build(String source) {
            return new SyntaxTree(source, this);
        }
    }
}

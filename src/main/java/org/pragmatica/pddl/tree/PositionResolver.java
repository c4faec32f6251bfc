package org.pragmatica.pddl.tree;

/**
 * Translates character offsets to editor positions and back.
 */
public interface PositionResolver {
    /**
     * @throws IllegalArgumentException if the offset lies outside the text
     */
    SourceLocation resolveToLocation(int offset);

    /**
     * @throws IllegalArgumentException if the line does not exist
     */
    int resolveToOffset(int line, int column);

    default SourceSpan resolveToSpan(int start, int end) {
        return SourceSpan.of(resolveToLocation(start), resolveToLocation(end));
    }

    default SourceSpan spanOf(SyntaxNode node) {
        return resolveToSpan(node.start(), node.end());
    }
}

package org.pragmatica.pddl.tree;

/**
 * A position in source text. Line and column are zero-based, as editors address positions.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(0, 0, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Check if this location is not after the other one.
     */
    public boolean atOrBefore(SourceLocation other) {
        if (line == other.line) {
            return column <= other.column;
        }
        return line < other.line;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}

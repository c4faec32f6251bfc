package org.pragmatica.pddl.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * Check if the location lies within this span, both ends included.
     */
    public boolean contains(SourceLocation location) {
        return start.atOrBefore(location) && location.atOrBefore(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}

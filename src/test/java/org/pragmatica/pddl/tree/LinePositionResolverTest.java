package org.pragmatica.pddl.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.pddl.parser.SyntaxTreeBuilder;

import static org.junit.jupiter.api.Assertions.*;

class LinePositionResolverTest {

    private final LinePositionResolver resolver = LinePositionResolver.of("ab\ncd\n");

    @Test
    void resolveToLocation_countsLinesAndColumnsFromZero() {
        assertEquals(SourceLocation.at(0, 0, 0), resolver.resolveToLocation(0));
        assertEquals(SourceLocation.at(0, 2, 2), resolver.resolveToLocation(2));
        assertEquals(SourceLocation.at(1, 0, 3), resolver.resolveToLocation(3));
        assertEquals(SourceLocation.at(1, 1, 4), resolver.resolveToLocation(4));
        assertEquals(SourceLocation.at(2, 0, 6), resolver.resolveToLocation(6));
        assertEquals(3, resolver.lineCount());
    }

    @Test
    void resolveToLocation_outsideText_throws() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveToLocation(7));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveToLocation(-1));
    }

    @Test
    void resolveToOffset_clampsColumnToLineEnd() {
        assertEquals(4, resolver.resolveToOffset(1, 1));
        assertEquals(2, resolver.resolveToOffset(0, 10));
        assertEquals(6, resolver.resolveToOffset(2, 3));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveToOffset(3, 0));
    }

    @Test
    void spanOf_coversNodeRange() {
        var text = "(define\n  (domain d))";
        var tree = SyntaxTreeBuilder.build(text)
                                    .tree();
        var domain = tree.defineNode()
                         .orElseThrow()
                         .firstOpenBracket("domain")
                         .orElseThrow();

        var span = LinePositionResolver.of(text)
                                       .spanOf(domain);

        assertEquals(SourceLocation.at(1, 2, 10), span.start());
        assertEquals(SourceLocation.at(1, 12, 20), span.end());
        assertEquals("(domain d)", span.extract(text));
        assertTrue(span.contains(SourceLocation.at(1, 5, 13)));
    }
}

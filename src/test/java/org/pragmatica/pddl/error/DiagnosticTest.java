package org.pragmatica.pddl.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.pddl.tree.LinePositionResolver;
import org.pragmatica.pddl.tree.SourceLocation;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for diagnostic rendering and parse errors.
 */
class DiagnosticTest {

    @Test
    void format_showsOneBasedPositionAndUnderline() {
        var source = "(define (domain d)\n  (:predicates (p)))\n)";
        int offset = source.lastIndexOf(')');
        var span = LinePositionResolver.of(source)
                                       .resolveToSpan(offset, offset + 1);

        var formatted = Diagnostic.error("P0001", "unmatched close bracket", span)
                                  .withLabel("no open bracket to close")
                                  .withHelp("remove the bracket")
                                  .format(source, "d.pddl");

        assertTrue(formatted.startsWith("error[P0001]: unmatched close bracket\n"));
        assertTrue(formatted.contains("--> d.pddl:3:1"));
        assertTrue(formatted.contains("3 | )"));
        assertTrue(formatted.contains("^ no open bracket to close"));
        assertTrue(formatted.contains("= help: remove the bracket"));
    }

    @Test
    void format_secondaryLabelAndNote_areRenderedOnTheirLines() {
        var source = "(define (domain d)\n  (:predicates (p)))\n)";
        var resolver = LinePositionResolver.of(source);
        int offset = source.lastIndexOf(')');

        var formatted = Diagnostic.error("unmatched close bracket", resolver.resolveToSpan(offset, offset + 1))
                                  .withLabel("extra")
                                  .withSecondaryLabel(resolver.resolveToSpan(0, 1), "define ends on line 2")
                                  .withNote("brackets are counted across the whole file")
                                  .format(source, "d.pddl");

        assertTrue(formatted.contains("1 | (define (domain d)\n  | - define ends on line 2\n"));
        assertTrue(formatted.contains("3 | )\n  | ^ extra\n"));
        assertTrue(formatted.contains("= brackets are counted across the whole file"));
    }

    @Test
    void format_withoutFilename_showsPositionOnly() {
        var span = LinePositionResolver.of("abc")
                                       .resolveToSpan(1, 2);

        var formatted = Diagnostic.warning("odd", span)
                                  .format("abc", null);

        assertTrue(formatted.startsWith("warning: odd\n"));
        assertTrue(formatted.contains("  --> 1:2\n"));
        assertTrue(formatted.contains(" | abc\n"));
    }

    @Test
    void formatSimple_isSingleLine() {
        var span = LinePositionResolver.of("x\ny")
                                       .resolveToSpan(2, 3);

        assertEquals("f.pddl:2:1: error: bad", Diagnostic.error("bad", span)
                                                         .formatSimple("f.pddl"));
    }

    @Test
    void parseErrors_describeMissingConstructs() {
        var missingDefine = new ParseError.MissingDefine(SourceLocation.START);
        var missingHead = new ParseError.MissingHead(SourceLocation.at(2, 4, 30), "problem");

        assertEquals("Missing (define ...) at 0:0", missingDefine.message());
        assertEquals("Missing (problem ...) in (define ...) at 2:4", missingHead.message());
        assertSame(missingHead, new PddlParseException(missingHead).error());
        assertEquals(missingHead.message(), new PddlParseException(missingHead).getMessage());
    }
}

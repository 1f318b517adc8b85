package com.pseudoparser.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourcePositionTest {

    @Test
    void testUnknownEndCollapsesToStart() {
        SourcePosition p = new SourcePosition(3, 7, 0, 0, null);
        assertEquals(3, p.endLine());
        assertEquals(7, p.endColumn());
        assertEquals(p, new SourcePosition(3, 7));
    }

    @Test
    void testNegativeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SourcePosition(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> new SourcePosition(1, -1));
    }

    @Test
    void testSpan() {
        SourcePosition a = new SourcePosition(1, 5, 1, 7, "prog.pseudo");
        SourcePosition b = new SourcePosition(2, 1, 2, 9, "prog.pseudo");
        SourcePosition span = a.span(b);
        assertEquals(new SourcePosition(1, 5, 2, 9, "prog.pseudo"), span);
    }

    @Test
    void testToString() {
        assertEquals("4:2", new SourcePosition(4, 2).toString());
        assertEquals("prog.pseudo:4:2", new SourcePosition(4, 2, 4, 8, "prog.pseudo").toString());
        assertTrue(new SourcePosition(4, 2).file().isEmpty());
    }
}

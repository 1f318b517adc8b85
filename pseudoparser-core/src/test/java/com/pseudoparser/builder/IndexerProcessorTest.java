package com.pseudoparser.builder;

import com.pseudoparser.ParsingException;
import com.pseudoparser.ast.IndexRange;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.Var;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class IndexerProcessorTest {

    private final IndexerProcessor indexers = new IndexerProcessor();
    private final NumberLiteral lo = new NumberLiteral(1);
    private final Var hi = new Var("n");

    @Test
    void testBounds() {
        assertEquals(new IndexRange(Optional.of(lo), Optional.of(hi)), indexers.processRange(lo, hi));
        assertEquals(new IndexRange(Optional.empty(), Optional.of(hi)), indexers.processOpenStart(hi));
        assertEquals(new IndexRange(Optional.of(lo), Optional.empty()), indexers.processOpenEnd(lo));
        assertEquals(new IndexRange(Optional.empty(), Optional.empty()), indexers.processOpenBoth());
    }

    @Test
    void testSingleIsTheExpressionItself() {
        assertSame(hi, indexers.processSingle(hi));
    }

    @Test
    void testMissingBound() {
        assertThrows(ParsingException.class, () -> indexers.processRange(null, hi));
        assertThrows(ParsingException.class, () -> indexers.processOpenEnd(null));
        assertThrows(ParsingException.class, () -> indexers.processSingle(null));
    }
}

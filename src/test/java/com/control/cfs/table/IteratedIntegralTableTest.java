package com.control.cfs.table;

import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.engine.IntegrationRule;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;
import org.junit.Test;

import static org.junit.Assert.*;

public class IteratedIntegralTableTest {

    private final WordIndex index = WordIndex.enumerate(2, 1);
    private final TimeGrid grid = TimeGrid.of(0.0, 0.5, 3);

    private IteratedIntegralTable table() {
        double[][] rows = { { 1, 1, 1 }, { 0, 0.5, 1.0 }, { 0, 2, 4 } };
        return new IteratedIntegralTable(index, grid, IntegrationRule.TRAPEZOID, rows);
    }

    @Test
    public void testAccessors() {
        IteratedIntegralTable t = table();
        assertEquals(3, t.size());
        assertEquals(3, t.samples());
        assertEquals(1, t.depth());
        assertSame(grid, t.grid());
        assertEquals(2.0, t.valueAt(Word.parse("x1"), 1), 0.0);
        assertArrayEquals(new double[] { 1, 1.0, 4 }, t.column(2), 0.0);
    }

    @Test
    public void testSeriesIsCopy() {
        IteratedIntegralTable t = table();
        double[] s = t.series(1);
        s[1] = 99;
        assertEquals(0.5, t.valueAt(1, 1), 0.0);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRejectsWrongRowCount() {
        new IteratedIntegralTable(index, grid, IntegrationRule.TRAPEZOID, new double[][] { { 1, 1, 1 } });
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRejectsShortRow() {
        double[][] rows = { { 1, 1, 1 }, { 0, 0.5 }, { 0, 2, 4 } };
        new IteratedIntegralTable(index, grid, IntegrationRule.TRAPEZOID, rows);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownWord() {
        table().valueAt(Word.parse("x0x0"), 0);
    }
}

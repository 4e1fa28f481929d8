package com.control.cfs.util;

import com.control.cfs.ChenFliess;
import com.control.cfs.ChenFliessSeries;
import com.control.cfs.input.InputSignal;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.word.Word;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SeriesExplainTest {

    private ChenFliessSeries series;
    private SeriesExplain explain;

    @Before
    public void setUp() {
        series = ChenFliess.builder("linear").states("z").drift("-z").field("1").output("z").depth(2).build();
        explain = new SeriesExplain(series);
    }

    @Test
    public void testExplainWord() {
        String s = explain.explainWord(Word.parse("x0x1"));
        assertTrue(s, s.contains("Word: x0x1"));
        assertTrue(s, s.contains("Parent: x1 via x0"));
        assertTrue(s, s.contains("h = -1"));
    }

    @Test
    public void testExplainEmptyWordHasNoParent() {
        assertFalse(explain.explainWord(Word.EMPTY).contains("Parent"));
    }

    @Test
    public void testDumpWordIndex() {
        String s = explain.dumpWordIndex();
        assertTrue(s, s.contains("(7 words)"));
        assertTrue(s, s.contains("x0 x1"));
    }

    @Test
    public void testDumpCoefficientsSkipsZeros() {
        String s = explain.dumpCoefficients(series.coefficients(new double[] { 2.0 }));
        assertTrue(s, s.contains("2 of 7 vanish"));
        assertFalse(s, s.contains("x1x0 "));
    }

    @Test
    public void testDumpLieDerivativesAndIntegrals() {
        assertTrue(explain.dumpLieDerivatives().contains("h = z"));
        String s = explain.dumpIntegrals(series.iteratedIntegrals(InputSignal.constant(TimeGrid.of(0, 0.5, 3), 1,
                1.0)));
        assertTrue(s, s.contains("rule=TRAPEZOID"));
        assertTrue(s, s.contains("at t=1.0"));
    }
}

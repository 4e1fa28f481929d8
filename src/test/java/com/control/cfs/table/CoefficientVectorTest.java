package com.control.cfs.table;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.engine.LieDerivativeEngine;
import com.control.cfs.system.ControlAffineSystem;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;
import org.junit.Test;

import static org.junit.Assert.*;

public class CoefficientVectorTest {

    @Test
    public void testValuesAndInitialOutput() {
        WordIndex index = WordIndex.enumerate(2, 1);
        double[] state = { 3.0 };
        CoefficientVector c = new CoefficientVector(index, state, new double[] { 3.0, 0.0, -1.5 });
        state[0] = 7.0;
        assertEquals(3.0, c.state()[0], 0.0);
        assertEquals(3.0, c.initialOutput(), 0.0);
        assertEquals(-1.5, c.valueAt(Word.parse("x1")), 0.0);
        assertEquals(1, c.zeroCount());
        assertEquals(3, c.size());
        c.values()[0] = 42;
        assertEquals(3.0, c.valueAt(0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsWrongLength() {
        new CoefficientVector(WordIndex.enumerate(2, 2), new double[] { 0 }, new double[3]);
    }

    @Test
    public void testEvaluatorSingleRowAndInto() {
        ControlAffineSystem system = ControlAffineSystem.builder("z").drift("-z").field("1").output("z^2").build();
        LieDerivativeTable table = new LieDerivativeEngine().compute(system, 2);
        CoefficientEvaluator evaluator = table.compile();
        double[] z = { 1.5 };
        double[] out = new double[table.size()];
        evaluator.evaluateInto(z, out);
        CoefficientVector v = evaluator.evaluate(z);
        assertArrayEquals(v.values(), out, 0.0);
        int row = table.index().row(Word.parse("x0"));
        // L_{g0} z^2 = -2 z^2
        assertEquals(-4.5, evaluator.evaluate(row, z), 1e-12);
        assertEquals(1, evaluator.stateDimension());
    }

    @Test(expected = ConfigurationException.class)
    public void testEvaluatorRejectsWrongState() {
        ControlAffineSystem system = ControlAffineSystem.builder("z").field("1").output("z").build();
        new LieDerivativeEngine().compute(system, 1).compile().evaluate(new double[] { 1, 2 });
    }

    @Test(expected = ConfigurationException.class)
    public void testInterpretedRejectsWrongState() {
        ControlAffineSystem system = ControlAffineSystem.builder("z").field("1").output("z").build();
        new LieDerivativeEngine().compute(system, 1).evaluate(new double[0]);
    }
}

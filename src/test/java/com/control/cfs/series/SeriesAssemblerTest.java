package com.control.cfs.series;

import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.engine.IteratedIntegralEngine;
import com.control.cfs.engine.LieDerivativeEngine;
import com.control.cfs.input.InputSignal;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.system.ControlAffineSystem;
import com.control.cfs.table.CoefficientVector;
import com.control.cfs.table.IteratedIntegralTable;
import com.control.cfs.table.LieDerivativeTable;
import com.control.cfs.word.Alphabet;
import com.control.cfs.word.WordIndex;
import org.junit.Test;

import static org.junit.Assert.*;

public class SeriesAssemblerTest {

    private final TimeGrid grid = TimeGrid.span(0.0, 0.5, 0.001);

    private static ControlAffineSystem twoInput() {
        return ControlAffineSystem.builder("z1", "z2")
                .drift("-z1", "z1 - z2")
                .field("1", "0")
                .field("0", "z2")
                .output("z1 * z2")
                .build();
    }

    private static TruncatedSeries run(ControlAffineSystem system, InputSignal input, WordIndex index, double[] z0) {
        CoefficientVector c = new LieDerivativeEngine().compute(system, index).compile().evaluate(z0);
        IteratedIntegralTable e = new IteratedIntegralEngine().compute(input, index);
        return SeriesAssembler.assemble(c, e);
    }

    @Test
    public void testIntegratorUnderUnitInput() {
        ControlAffineSystem system = ControlAffineSystem.builder("z").field("1").output("z").build();
        TruncatedSeries y = run(system, InputSignal.constant(grid, 1, 1.0), WordIndex.enumerate(2, 2),
                new double[] { 0.0 });
        for (int j = 0; j < grid.samples(); j++)
            assertEquals(grid.time(j), y.valueAt(j), 1e-12);
    }

    @Test
    public void testDoubleIntegratorUnderUnitInput() {
        ControlAffineSystem system = ControlAffineSystem.builder("z1", "z2")
                .drift("z2", "0")
                .field("0", "1")
                .output("z1")
                .build();
        TruncatedSeries y = run(system, InputSignal.constant(grid, 1, 1.0), WordIndex.enumerate(2, 3),
                new double[] { 0.0, 0.0 });
        for (int j = 0; j < grid.samples(); j++) {
            double t = grid.time(j);
            assertEquals(t * t / 2, y.valueAt(j), 1e-12);
        }
    }

    @Test
    public void testLinearFreeResponseApproachesExponential() {
        ControlAffineSystem system = ControlAffineSystem.builder("z").drift("-z").field("1").output("z").build();
        TruncatedSeries y = run(system, InputSignal.constant(grid, 1, 0.0), WordIndex.enumerate(2, 6),
                new double[] { 1.0 });
        for (int j = 0; j < grid.samples(); j++)
            assertEquals(Math.exp(-grid.time(j)), y.valueAt(j), 5e-6);
    }

    @Test
    public void testPermutedAlphabetGivesSameSeries() {
        InputSignal u = InputSignal.sample(grid, Math::sin, t -> 1 - 2 * t);
        double[] z0 = { 0.4, -0.3 };
        TruncatedSeries standard = run(twoInput(), u, WordIndex.enumerate(3, 3), z0);
        TruncatedSeries permuted = run(twoInput(), u, WordIndex.of(Alphabet.ofOrder(2, 0, 1), 3), z0);
        assertArrayEquals(standard.values(), permuted.values(), 1e-12);
    }

    @Test
    public void testDepthContributionsSumToValues() {
        InputSignal u = InputSignal.sample(grid, Math::cos, t -> t);
        TruncatedSeries y = run(twoInput(), u, WordIndex.enumerate(3, 3), new double[] { 1.0, 2.0 });
        assertEquals(3, y.depth());
        double[] sum = new double[grid.samples()];
        for (int k = 0; k <= y.depth(); k++) {
            double[] c = y.depthContribution(k);
            for (int j = 0; j < sum.length; j++)
                sum[j] += c[j];
        }
        assertArrayEquals(y.values(), sum, 1e-12);
        assertArrayEquals(y.partialSum(3), y.values(), 0.0);
        for (double v : y.partialSum(0))
            assertEquals(2.0, v, 0.0);
    }

    @Test
    public void testExplicitInitialOutput() {
        InputSignal u = InputSignal.constant(grid, 2, 0.5);
        WordIndex index = WordIndex.enumerate(3, 2);
        CoefficientVector c = new LieDerivativeEngine().compute(twoInput(), index).evaluate(new double[] { 1, 1 });
        IteratedIntegralTable e = new IteratedIntegralEngine().compute(u, index);
        TruncatedSeries shifted = SeriesAssembler.assemble(c, e, 10.0);
        TruncatedSeries plain = SeriesAssembler.assemble(c, e);
        for (int j = 0; j < grid.samples(); j++)
            assertEquals(plain.valueAt(j) + 9.0, shifted.valueAt(j), 1e-12);
    }

    @Test
    public void testAssembleFromSymbolicTable() {
        InputSignal u = InputSignal.sample(grid, Math::sin, Math::cos);
        WordIndex index = WordIndex.enumerate(3, 2);
        double[] z0 = { 0.2, 0.1 };
        LieDerivativeTable lie = new LieDerivativeEngine().compute(twoInput(), index);
        IteratedIntegralTable e = new IteratedIntegralEngine().compute(u, index);
        assertArrayEquals(SeriesAssembler.assemble(lie.evaluate(z0), e).values(),
                SeriesAssembler.assemble(lie, e, z0).values(), 1e-12);
    }

    @Test
    public void testStartsAtInitialOutput() {
        InputSignal u = InputSignal.sample(grid, Math::sin, Math::cos);
        TruncatedSeries y = run(twoInput(), u, WordIndex.enumerate(3, 3), new double[] { 3.0, -2.0 });
        assertEquals(-6.0, y.valueAt(0), 0.0);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRejectsMismatchedDepth() {
        CoefficientVector c = new LieDerivativeEngine().compute(twoInput(), 2).evaluate(new double[] { 0, 0 });
        IteratedIntegralTable e = new IteratedIntegralEngine().compute(InputSignal.constant(grid, 2, 1.0), 3);
        SeriesAssembler.assemble(c, e);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRejectsMismatchedOrdering() {
        CoefficientVector c = new LieDerivativeEngine().compute(twoInput(), 2).evaluate(new double[] { 0, 0 });
        IteratedIntegralTable e = new IteratedIntegralEngine().compute(InputSignal.constant(grid, 2, 1.0),
                WordIndex.of(Alphabet.ofOrder(1, 0, 2), 2));
        SeriesAssembler.assemble(c, e);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testPartialSumBeyondDepth() {
        TruncatedSeries y = run(twoInput(), InputSignal.constant(grid, 2, 0.0), WordIndex.enumerate(3, 1),
                new double[] { 0, 0 });
        y.partialSum(2);
    }
}

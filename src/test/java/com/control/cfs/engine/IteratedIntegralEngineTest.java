package com.control.cfs.engine;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.LayerListener;
import com.control.cfs.input.InputSignal;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.table.IteratedIntegralTable;
import com.control.cfs.word.Alphabet;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class IteratedIntegralEngineTest {

    private final TimeGrid grid = TimeGrid.span(0.0, 1.0, 0.001);
    private final InputSignal unit = InputSignal.constant(grid, 1, 1.0);

    @Test
    public void testEmptyWordIsOne() {
        InputSignal u = InputSignal.sample(grid, Math::sin, Math::cos);
        IteratedIntegralTable table = new IteratedIntegralEngine().compute(u, 2);
        for (int j = 0; j < grid.samples(); j++)
            assertEquals(1.0, table.valueAt(Word.EMPTY, j), 0.0);
    }

    @Test
    public void testUnitInputGivesPowersOfTime() {
        IteratedIntegralTable table = new IteratedIntegralEngine().compute(unit, 3);
        for (int j = 0; j < grid.samples(); j++) {
            double t = grid.time(j);
            assertEquals(t, table.valueAt(Word.parse("x1"), j), 1e-12);
            assertEquals(t, table.valueAt(Word.parse("x0"), j), 1e-12);
            assertEquals(t * t / 2, table.valueAt(Word.parse("x1x1"), j), 1e-12);
            assertEquals(t * t * t / 6, table.valueAt(Word.parse("x1x1x1"), j), 1e-6);
        }
    }

    @Test
    public void testIntegralsStartAtZero() {
        InputSignal u = InputSignal.sample(grid, t -> 3 + t);
        IteratedIntegralTable table = new IteratedIntegralEngine().compute(u, 3);
        for (int r = 1; r < table.size(); r++)
            assertEquals(0.0, table.valueAt(r, 0), 0.0);
    }

    @Test
    public void testLeftmostLetterIsOutermostIntegral() {
        // u(t) = t: E_{x0 x1} = ∫∫u = t^3/6, E_{x1 x0} = ∫ u(τ) τ dτ = t^3/3
        InputSignal u = InputSignal.sample(grid, t -> t);
        IteratedIntegralTable table = new IteratedIntegralEngine().compute(u, 2);
        int last = grid.samples() - 1;
        assertEquals(1.0 / 6, table.valueAt(Word.parse("x0x1"), last), 1e-6);
        assertEquals(1.0 / 3, table.valueAt(Word.parse("x1x0"), last), 1e-6);
    }

    @Test
    public void testRectangleRule() {
        TimeGrid g = TimeGrid.of(0.0, 0.1, 11);
        IteratedIntegralTable table = new IteratedIntegralEngine(IntegrationRule.RECTANGLE)
                .compute(InputSignal.constant(g, 1, 1.0), 2);
        assertEquals(IntegrationRule.RECTANGLE, table.rule());
        for (int j = 0; j < g.samples(); j++) {
            double t = g.time(j);
            assertEquals(t, table.valueAt(Word.parse("x1"), j), 1e-12);
            // left-point sum of τ over [0, t): t (t - dt) / 2
            assertEquals(t * (t - 0.1) / 2, table.valueAt(Word.parse("x1x1"), j), 1e-12);
        }
    }

    @Test
    public void testComputeWordMatchesTableRow() {
        InputSignal u = InputSignal.sample(grid, t -> Math.sin(3 * t), t -> t * t - 0.5);
        IteratedIntegralEngine engine = new IteratedIntegralEngine();
        IteratedIntegralTable table = engine.compute(u, 3);
        for (Word w : table.index().words())
            assertArrayEquals(w.toString(), table.series(w), engine.computeWord(u, w), 0.0);
    }

    @Test
    public void testParallelMatchesSerial() {
        TimeGrid g = TimeGrid.span(0.0, 1.0, 0.01);
        InputSignal u = InputSignal.sample(g, Math::sin, t -> Math.exp(-t));
        IteratedIntegralEngine serial = new IteratedIntegralEngine();
        IteratedIntegralEngine parallel = new IteratedIntegralEngine();
        parallel.setParallel(true);
        // layer 4 holds 81 rows, enough to fan out
        IteratedIntegralTable a = serial.compute(u, 5);
        IteratedIntegralTable b = parallel.compute(u, 5);
        for (int r = 0; r < a.size(); r++)
            assertArrayEquals(a.series(r), b.series(r), 0.0);
    }

    @Test
    public void testPrefixStability() {
        InputSignal u = InputSignal.sample(grid, Math::cos);
        IteratedIntegralEngine engine = new IteratedIntegralEngine();
        IteratedIntegralTable shallow = engine.compute(u, 2);
        IteratedIntegralTable deep = engine.compute(u, 4);
        for (int r = 0; r < shallow.size(); r++)
            assertArrayEquals(shallow.series(r), deep.series(r), 0.0);
    }

    @Test
    public void testPermutedAlphabetKeepsWordValues() {
        InputSignal u = InputSignal.sample(grid, Math::sin, t -> 1 - t);
        IteratedIntegralEngine engine = new IteratedIntegralEngine();
        IteratedIntegralTable standard = engine.compute(u, 3);
        IteratedIntegralTable permuted = engine.compute(u, WordIndex.of(Alphabet.ofOrder(2, 0, 1), 3));
        for (Word w : standard.index().words())
            assertArrayEquals(w.toString(), standard.series(w), permuted.series(w), 0.0);
    }

    @Test(expected = ConfigurationException.class)
    public void testChannelCountMismatch() {
        InputSignal twoChannels = InputSignal.constant(grid, 2, 1.0);
        new IteratedIntegralEngine().compute(twoChannels, WordIndex.enumerate(2, 2));
    }

    @Test(expected = ConfigurationException.class)
    public void testComputeWordRejectsUnknownChannel() {
        new IteratedIntegralEngine().computeWord(unit, Word.parse("x2x1"));
    }

    @Test(expected = ConfigurationException.class)
    public void testNullRuleRejected() {
        new IteratedIntegralEngine(null);
    }

    @Test
    public void testListenerSeesEveryLayer() {
        List<String> events = new ArrayList<>();
        IteratedIntegralEngine engine = new IteratedIntegralEngine();
        engine.setListener(new LayerListener() {
            @Override
            public void onComputationStart(String name, WordIndex index) {
                events.add("start " + index.depth());
            }

            @Override
            public void onLayerComputed(String name, int depth, int words, long durationNanos) {
                events.add("layer " + depth + ":" + words);
            }

            @Override
            public void onLayerError(String name, int depth, Word word, Throwable error) {
                events.add("error " + depth);
            }

            @Override
            public void onComputationEnd(String name, int totalWords, long durationNanos) {
                events.add("end " + totalWords);
            }
        });
        engine.compute(InputSignal.constant(grid, 2, 1.0), 2);
        assertEquals(List.of("start 2", "layer 0:1", "layer 1:3", "layer 2:9", "end 13"), events);
    }
}

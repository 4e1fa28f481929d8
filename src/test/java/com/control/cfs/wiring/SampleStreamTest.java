package com.control.cfs.wiring;

import com.control.cfs.ChenFliess;
import com.control.cfs.ChenFliessSeries;
import com.control.cfs.input.InputSignal;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.series.TruncatedSeries;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class SampleStreamTest {

    @Test
    public void testStreamedOutputMatchesBatch() throws InterruptedException {
        ChenFliessSeries series = ChenFliess.builder("two-input")
                .states("z1", "z2")
                .drift("-z1", "z1 - z2")
                .field("1", "0")
                .field("0", "z2")
                .output("z1 * z2")
                .depth(3)
                .build();
        double[] z0 = { 0.5, 0.2 };
        TimeGrid grid = TimeGrid.of(0.0, 0.005, 201);
        InputSignal u = InputSignal.sample(grid, Math::sin, t -> 1 - t);
        TruncatedSeries batch = series.simulate(u, z0);

        SamplePublisher publisher = series.streaming(z0, grid.t0(), grid.dt());
        CountDownLatch done = new CountDownLatch(1);
        double[] last = new double[2];
        publisher.setOutputCallback((j, t, y) -> {
            if (j == grid.samples() - 1) {
                last[0] = t;
                last[1] = y;
                done.countDown();
            }
        });

        try (SampleStream stream = SampleStream.start(publisher, 64)) {
            double[] sample = new double[2];
            for (int j = 0; j < grid.samples(); j++) {
                sample[0] = u.valueAt(1, j);
                sample[1] = u.valueAt(2, j);
                stream.publish(sample, j == grid.samples() - 1);
            }
            assertEquals(grid.samples(), stream.published());
            assertTrue("stream did not drain", done.await(10, TimeUnit.SECONDS));
        }
        assertEquals(grid.tf(), last[0], 1e-12);
        assertEquals(batch.valueAt(grid.samples() - 1), last[1], 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBufferSizeMustBePowerOfTwo() {
        ChenFliessSeries series = ChenFliess.builder("i").states("z").field("1").output("z").depth(1).build();
        SampleStream.start(series.streaming(new double[] { 0 }, 0, 0.1), 100);
    }
}
